package fun.fengwk.cpw.core.hub.transport;

import fun.fengwk.cpw.core.hub.AgentConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Agent connection backed by a servlet websocket session. Sends are serialized by the decorator.
 *
 * @author fengwk
 */
@Slf4j
class WebSocketAgentConnection implements AgentConnection {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 8 * 1024 * 1024;

    private final WebSocketSession session;

    WebSocketAgentConnection(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException ex) {
            log.debug("close agent session failed, sessionId={}, error={}", session.getId(), ex.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

}
