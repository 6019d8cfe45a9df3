package fun.fengwk.cpw.core.hub.transport;

import fun.fengwk.cpw.core.hub.AgentHub;
import fun.fengwk.cpw.core.hub.ConnectedAgent;
import fun.fengwk.cpw.core.hub.exception.AgentAuthException;
import fun.fengwk.cpw.core.hub.protocol.HubCloseCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Bridges servlet websocket events into the {@link AgentHub}.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class HubWebSocketHandler extends TextWebSocketHandler {

    static final String AGENT_ATTRIBUTE = "cpw.connectedAgent";

    private final AgentHub agentHub;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String agentId = (String) session.getAttributes().get(AgentHandshakeInterceptor.AGENT_ID_ATTRIBUTE);
        String token = (String) session.getAttributes().get(AgentHandshakeInterceptor.TOKEN_ATTRIBUTE);
        try {
            ConnectedAgent agent = agentHub.register(agentId, token, new WebSocketAgentConnection(session));
            session.getAttributes().put(AGENT_ATTRIBUTE, agent);
        } catch (AgentAuthException ex) {
            log.warn("agent rejected, agentId={}, remote={}, error={}", agentId, session.getRemoteAddress(), ex.getMessage());
            session.close(new CloseStatus(HubCloseCodes.POLICY_VIOLATION, ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("agent registration failed, agentId={}", agentId, ex);
            session.close(new CloseStatus(HubCloseCodes.INTERNAL_ERROR, "Internal error"));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectedAgent agent = (ConnectedAgent) session.getAttributes().get(AGENT_ATTRIBUTE);
        if (agent == null) {
            return;
        }
        agentHub.handleMessage(agent, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("agent transport error, sessionId={}, error={}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConnectedAgent agent = (ConnectedAgent) session.getAttributes().remove(AGENT_ATTRIBUTE);
        if (agent != null) {
            agentHub.handleClose(agent, status.getCode(), status.getReason());
        }
    }

}
