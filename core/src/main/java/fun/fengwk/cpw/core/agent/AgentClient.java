package fun.fengwk.cpw.core.agent;

import fun.fengwk.cpw.core.hub.protocol.HelloMessage;
import fun.fengwk.cpw.core.hub.protocol.HubCloseCodes;
import fun.fengwk.cpw.core.hub.protocol.HubMessage;
import fun.fengwk.cpw.core.hub.protocol.HubMessageCodec;
import fun.fengwk.cpw.core.hub.protocol.PingMessage;
import fun.fengwk.cpw.core.hub.protocol.PongMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcMessage;
import jakarta.annotation.PreDestroy;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Agent side of the hub connection: hello on connect, pong on ping, RPCs handed to the dispatcher,
 * and a jittered reconnect unless the hub replaced this connection.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AgentClient extends TextWebSocketHandler {

    static final Map<String, Object> CAPABILITIES = Map.of(
        "cart", true, "variants", true, "browserStatus", true, "addCart", true, "login", true);

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 8 * 1024 * 1024;

    private final AgentProperties agentProperties;
    private final HubMessageCodec codec;
    private final AgentRpcDispatcher dispatcher;
    private final WebSocketClient webSocketClient;
    private final ScheduledExecutorService reconnectExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "cpw-agent-reconnect");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile AgentIdentity identity;
    private volatile WebSocketSession session;

    @Autowired
    public AgentClient(AgentProperties agentProperties, HubMessageCodec codec, AgentRpcDispatcher dispatcher) {
        this(agentProperties, codec, dispatcher, createWebSocketClient(agentProperties));
    }

    AgentClient(AgentProperties agentProperties, HubMessageCodec codec, AgentRpcDispatcher dispatcher, WebSocketClient webSocketClient) {
        this.agentProperties = agentProperties;
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.webSocketClient = webSocketClient;
    }

    static WebSocketClient createWebSocketClient(AgentProperties agentProperties) {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(agentProperties.getMaxMessageBytes());
        container.setDefaultMaxBinaryMessageBufferSize(agentProperties.getMaxMessageBytes());
        return new StandardWebSocketClient(container);
    }

    public void start(AgentIdentity identity) {
        this.identity = identity;
        connect();
    }

    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    @PreDestroy
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        reconnectExecutor.shutdownNow();
        WebSocketSession current = session;
        if (current != null && current.isOpen()) {
            try {
                current.close(new CloseStatus(HubCloseCodes.GOING_AWAY, "Agent shutting down"));
            } catch (IOException ex) {
                log.debug("close hub session failed, error={}", ex.getMessage());
            }
        }
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        this.session = decorated;
        log.info("connected to hub, agentId={}, hubUrl={}", identity.agentId(), identity.hubUrl());
        send(new HelloMessage(identity.agentId(), agentProperties.getName(), agentProperties.getVersion(), CAPABILITIES));
    }

    @Override
    protected void handleTextMessage(WebSocketSession rawSession, TextMessage message) {
        HubMessage decoded;
        try {
            decoded = codec.decode(message.getPayload());
        } catch (IllegalArgumentException ex) {
            log.warn("drop invalid hub message, error={}", ex.getMessage());
            return;
        }
        if (decoded instanceof PingMessage ping) {
            send(new PongMessage(ping.ts()));
        } else if (decoded instanceof RpcMessage rpc) {
            log.info("rpc received, method={}, requestId={}", rpc.method(), rpc.requestId());
            dispatcher.dispatch(rpc, this::send);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession rawSession, CloseStatus status) {
        session = null;
        if (status.getCode() == HubCloseCodes.REPLACED) {
            log.warn("hub replaced this connection by a newer one, not reconnecting, agentId={}", identity.agentId());
            return;
        }
        if (status.getCode() == HubCloseCodes.POLICY_VIOLATION) {
            log.warn("hub rejected agent credentials, reason={}", status.getReason());
        } else {
            log.info("hub connection closed, code={}, reason={}", status.getCode(), status.getReason());
        }
        scheduleReconnect();
    }

    @Override
    public void handleTransportError(WebSocketSession rawSession, Throwable exception) {
        log.debug("hub transport error, error={}", exception.getMessage());
    }

    void send(HubMessage message) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            log.debug("hub not connected, drop {}", message.getClass().getSimpleName());
            return;
        }
        try {
            current.sendMessage(new TextMessage(codec.encode(message)));
        } catch (IOException | IllegalStateException ex) {
            log.warn("send to hub failed, type={}, error={}", message.getClass().getSimpleName(), ex.getMessage());
        }
    }

    private void connect() {
        if (stopped.get()) {
            return;
        }
        AgentIdentity current = identity;
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add("x-agent-id", current.agentId());
        headers.add("x-agent-token", current.token());
        log.info("connecting to hub, agentId={}, hubUrl={}", current.agentId(), current.hubUrl());
        webSocketClient.execute(this, headers, URI.create(current.hubUrl())).whenComplete((connected, ex) -> {
            if (ex != null) {
                log.warn("connect to hub failed, hubUrl={}, error={}", current.hubUrl(), ex.getMessage());
                scheduleReconnect();
            }
        });
    }

    private void scheduleReconnect() {
        if (stopped.get()) {
            return;
        }
        long min = Math.max(0, agentProperties.getReconnectMinDelayMs());
        long max = Math.max(min + 1, agentProperties.getReconnectMaxDelayMs());
        long delayMs = ThreadLocalRandom.current().nextLong(min, max);
        log.info("reconnecting to hub, delayMs={}", delayMs);
        reconnectExecutor.schedule(this::connect, delayMs, TimeUnit.MILLISECONDS);
    }

}
