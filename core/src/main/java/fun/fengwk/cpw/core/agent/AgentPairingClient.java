package fun.fengwk.cpw.core.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.cpw.core.hub.auth.PairingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Redeems a pairing code against the coordinator.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentPairingClient {

    private static final HttpClient PAIRING_HTTP_CLIENT = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(Duration.ofSeconds(10))
        .build();

    private final ObjectMapper objectMapper;
    private final AgentProperties agentProperties;

    public PairingResult pair(String pairUrl, String code, String agentId) {
        HttpRequest request;
        try {
            String body = objectMapper.writeValueAsString(Map.of("code", code, "agentId", agentId));
            request = HttpRequest.newBuilder()
                .uri(URI.create(pairUrl))
                .timeout(Duration.ofMillis(agentProperties.getPairTimeoutMs()))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        } catch (IOException ex) {
            throw new IllegalStateException("failed to build pairing request: " + ex.getMessage(), ex);
        }

        HttpResponse<String> response;
        try {
            response = PAIRING_HTTP_CLIENT.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new IllegalStateException("failed to pair agent: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while pairing agent", ex);
        }

        if (response.statusCode() / 100 != 2) {
            throw new IllegalStateException("failed to pair agent: status=" + response.statusCode() + ", body=" + response.body());
        }
        try {
            PairingResult result = objectMapper.readValue(response.body(), PairingResult.class);
            log.info("agent paired, agentId={}, userId={}", result.agentId(), result.userId());
            return result;
        } catch (IOException ex) {
            throw new IllegalStateException("failed to parse pairing response: " + ex.getMessage(), ex);
        }
    }

    /**
     * {@code ws://host/ws/agent} becomes {@code http://host/api/agents/pair}.
     */
    public static String derivePairUrl(String hubUrl) {
        URI uri = URI.create(hubUrl);
        String scheme = "wss".equalsIgnoreCase(uri.getScheme()) ? "https" : "http";
        String authority = uri.getRawAuthority();
        return scheme + "://" + authority + "/api/agents/pair";
    }

}
