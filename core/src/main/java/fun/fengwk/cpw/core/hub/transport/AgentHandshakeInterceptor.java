package fun.fengwk.cpw.core.hub.transport;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Copies the agent credential of the upgrade request into the session attributes.
 * Headers win over query parameters. Validation happens once the socket is open so a
 * rejected agent receives a proper close code.
 *
 * @author fengwk
 */
public class AgentHandshakeInterceptor implements HandshakeInterceptor {

    public static final String AGENT_ID_ATTRIBUTE = "cpw.agentId";
    public static final String TOKEN_ATTRIBUTE = "cpw.agentToken";

    static final String AGENT_ID_HEADER = "x-agent-id";
    static final String TOKEN_HEADER = "x-agent-token";
    private static final String BEARER_PREFIX = "Bearer ";

    @Override
    public boolean beforeHandshake(
        ServerHttpRequest request,
        ServerHttpResponse response,
        WebSocketHandler wsHandler,
        Map<String, Object> attributes
    ) {
        HttpHeaders headers = request.getHeaders();
        MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();

        String agentId = firstText(headers.getFirst(AGENT_ID_HEADER), query.getFirst("agentId"));
        String token = firstText(headers.getFirst(TOKEN_HEADER), bearer(headers.getFirst(HttpHeaders.AUTHORIZATION)));
        token = firstText(token, query.getFirst("token"));

        if (agentId != null) {
            attributes.put(AGENT_ID_ATTRIBUTE, agentId);
        }
        if (token != null) {
            attributes.put(TOKEN_ATTRIBUTE, token);
        }
        return true;
    }

    @Override
    public void afterHandshake(
        ServerHttpRequest request,
        ServerHttpResponse response,
        WebSocketHandler wsHandler,
        Exception exception
    ) {
    }

    private static String bearer(String authorization) {
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    private static String firstText(String first, String second) {
        if (StringUtils.hasText(first)) {
            return first.trim();
        }
        return StringUtils.hasText(second) ? second.trim() : null;
    }

}
