package fun.fengwk.cpw.core.hub;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import fun.fengwk.cpw.core.hub.auth.AgentAuthService;
import fun.fengwk.cpw.core.hub.auth.AgentPrincipal;
import fun.fengwk.cpw.core.hub.exception.AgentDisconnectedException;
import fun.fengwk.cpw.core.hub.exception.AgentNotConnectedException;
import fun.fengwk.cpw.core.hub.exception.RemoteCallException;
import fun.fengwk.cpw.core.hub.exception.RpcTimeoutException;
import fun.fengwk.cpw.core.hub.protocol.HelloMessage;
import fun.fengwk.cpw.core.hub.protocol.HubCloseCodes;
import fun.fengwk.cpw.core.hub.protocol.HubMessage;
import fun.fengwk.cpw.core.hub.protocol.HubMessageCodec;
import fun.fengwk.cpw.core.hub.protocol.PingMessage;
import fun.fengwk.cpw.core.hub.protocol.PongMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcProgress;
import fun.fengwk.cpw.core.hub.protocol.RpcProgressMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcResultMessage;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Registry of connected agents and the call/progress/result protocol spoken with them.
 *
 * <p>Lifecycle model:
 * <ul>
 *     <li>One live connection per agent id. A newer connection replaces the older one, which is
 *     closed with {@link HubCloseCodes#REPLACED} and has its pending calls rejected.</li>
 *     <li>Every pending call is owned by the connection it was sent on and completes at most once:
 *     by its result, its timeout, or the disconnect of its owner.</li>
 *     <li>Stale connections are dropped only while they have no pending call, a long remote
 *     operation can legitimately stay silent.</li>
 * </ul>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AgentHub {

    private final HubProperties hubProperties;
    private final AgentAuthService agentAuthService;
    private final HubMessageCodec codec;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<String, ConnectedAgent> agents = new ConcurrentHashMap<>();
    private final Map<String, PendingCall> pendingCalls = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    @Autowired
    public AgentHub(HubProperties hubProperties, AgentAuthService agentAuthService, HubMessageCodec codec) {
        this(hubProperties, agentAuthService, codec, Clock.systemUTC(), Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cpw-hub-timer");
            thread.setDaemon(true);
            return thread;
        }));
    }

    AgentHub(
        HubProperties hubProperties,
        AgentAuthService agentAuthService,
        HubMessageCodec codec,
        Clock clock,
        ScheduledExecutorService scheduler
    ) {
        this.hubProperties = hubProperties;
        this.agentAuthService = agentAuthService;
        this.codec = codec;
        this.clock = clock;
        this.scheduler = scheduler;
    }

    @PostConstruct
    public void start() {
        long intervalMs = hubProperties.resolvePingIntervalMs();
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("agent hub started, path={}, pingIntervalMs={}", hubProperties.getPath(), intervalMs);
    }

    /**
     * Authenticate and register a new connection.
     *
     * @throws fun.fengwk.cpw.core.hub.exception.AgentAuthException when the credential is rejected
     */
    public ConnectedAgent register(String agentId, String token, AgentConnection connection) {
        AgentPrincipal principal = agentAuthService.verifyToken(agentId, token);
        ConnectedAgent agent = new ConnectedAgent(agentId, principal.userId(), connection, clock.millis());
        ConnectedAgent previous = agents.put(agentId, agent);
        if (previous != null && previous != agent) {
            log.info(
                "agent connection replaced, agentId={}, previousConnection={}, connection={}",
                agentId,
                previous.getConnection().id(),
                connection.id()
            );
            rejectPendingCalls(previous, id -> new AgentDisconnectedException("Agent replaced agentId=" + id));
            previous.getConnection().close(HubCloseCodes.REPLACED, HubCloseCodes.REPLACED_REASON);
        }
        log.info("agent connected, agentId={}, userId={}, connection={}", agentId, principal.userId(), connection.id());
        return agent;
    }

    public void handleMessage(ConnectedAgent agent, String text) {
        agent.touch(clock.millis());
        HubMessage message;
        try {
            message = codec.decode(text);
        } catch (IllegalArgumentException ex) {
            log.warn("drop invalid agent message, agentId={}, error={}", agent.getAgentId(), ex.getMessage());
            return;
        }

        if (message instanceof HelloMessage hello) {
            agent.describe(hello.name(), hello.version(), hello.capabilities());
            log.info("agent hello, agentId={}, name={}, version={}", agent.getAgentId(), hello.name(), hello.version());
        } else if (message instanceof PingMessage ping) {
            sendQuietly(agent, new PongMessage(ping.ts()));
        } else if (message instanceof RpcProgressMessage progress) {
            handleProgress(agent, progress);
        } else if (message instanceof RpcResultMessage result) {
            handleResult(agent, result);
        } else if (!(message instanceof PongMessage)) {
            log.debug("ignore unexpected agent message, agentId={}, type={}", agent.getAgentId(), message.getClass().getSimpleName());
        }
    }

    public void handleClose(ConnectedAgent agent, int code, String reason) {
        if (agents.remove(agent.getAgentId(), agent)) {
            log.info("agent disconnected, agentId={}, code={}, reason={}", agent.getAgentId(), code, reason);
        }
        rejectPendingCalls(agent, id -> new AgentDisconnectedException("Agent disconnected agentId=" + id));
    }

    /**
     * Invoke a method on a connected agent.
     *
     * <p>The returned future fails with {@link AgentNotConnectedException} right away when the agent
     * is not connected, with {@link RpcTimeoutException} when the budget elapses, with
     * {@link RemoteCallException} when the agent answers {@code ok=false}, and with
     * {@link AgentDisconnectedException} when the connection drops first.
     */
    public CompletableFuture<JsonNode> call(String agentId, String method, Object params, CallOptions options) {
        ConnectedAgent agent = agentId == null ? null : agents.get(agentId);
        if (shutdown.get() || agent == null || !agent.getConnection().isOpen()) {
            return CompletableFuture.failedFuture(new AgentNotConnectedException("Agent not connected agentId=" + agentId));
        }
        CallOptions resolved = options == null ? CallOptions.defaults() : options;
        long timeoutMs = Math.max(
            hubProperties.getMinCallTimeoutMs(),
            resolved.getTimeoutMs() == null ? hubProperties.getDefaultCallTimeoutMs() : resolved.getTimeoutMs()
        );

        String requestId = UUID.randomUUID().toString();
        PendingCall call = new PendingCall(requestId, method, agent, resolved.getOnProgress());
        pendingCalls.put(requestId, call);
        // A close racing this call may have rejected pending calls before the put above.
        if (agents.get(agentId) != agent) {
            pendingCalls.remove(requestId, call);
            return CompletableFuture.failedFuture(new AgentNotConnectedException("Agent not connected agentId=" + agentId));
        }
        call.timeoutTask = scheduler.schedule(() -> expire(call, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS);

        try {
            JsonNode paramsNode = params == null ? null : codec.getObjectMapper().valueToTree(params);
            agent.getConnection().send(codec.encode(new RpcMessage(requestId, method, paramsNode)));
            log.debug("rpc sent, agentId={}, method={}, requestId={}, timeoutMs={}", agentId, method, requestId, timeoutMs);
        } catch (Exception ex) {
            log.warn("rpc send failed, agentId={}, method={}, error={}", agentId, method, ex.getMessage());
            if (pendingCalls.remove(requestId, call)) {
                call.cancelTimeout();
                call.future.completeExceptionally(
                    new AgentNotConnectedException("failed to send rpc to agentId=" + agentId + ": " + ex.getMessage()));
            }
        }
        return call.future;
    }

    public boolean isConnected(String agentId) {
        ConnectedAgent agent = agentId == null ? null : agents.get(agentId);
        return agent != null && agent.getConnection().isOpen();
    }

    /**
     * Shared agents, bound to no user, are owned by everyone.
     */
    public boolean isOwnedBy(String agentId, String userId) {
        ConnectedAgent agent = agentId == null ? null : agents.get(agentId);
        if (agent == null) {
            return false;
        }
        return agent.getUserId() == null || Objects.equals(agent.getUserId(), userId);
    }

    /**
     * Connected agents bound to the user, oldest connection first.
     */
    public List<String> findAgentsOwnedBy(String userId) {
        List<String> result = new ArrayList<>();
        for (ConnectedAgent agent : sortedAgents()) {
            if (userId != null && userId.equals(agent.getUserId()) && agent.getConnection().isOpen()) {
                result.add(agent.getAgentId());
            }
        }
        return result;
    }

    public List<String> findSharedAgents() {
        List<String> result = new ArrayList<>();
        for (ConnectedAgent agent : sortedAgents()) {
            if (agent.getUserId() == null && agent.getConnection().isOpen()) {
                result.add(agent.getAgentId());
            }
        }
        return result;
    }

    public List<AgentSummary> listConnectedAgents() {
        List<AgentSummary> summaries = new ArrayList<>();
        for (ConnectedAgent agent : sortedAgents()) {
            summaries.add(new AgentSummary(
                agent.getAgentId(),
                agent.getUserId(),
                agent.getName(),
                agent.getVersion(),
                agent.getCapabilities(),
                agent.getConnectedAt(),
                agent.getLastSeenAt(),
                countPendingCalls(agent)
            ));
        }
        return summaries;
    }

    /**
     * Ping every connection and drop stale ones that have no pending call.
     */
    public void sweep() {
        long now = clock.millis();
        long staleAfterMs = hubProperties.resolveStaleAfterMs();
        for (ConnectedAgent agent : List.copyOf(agents.values())) {
            if (now - agent.getLastSeenAt() > staleAfterMs) {
                int pending = countPendingCalls(agent);
                if (pending == 0) {
                    log.info("closing stale agent connection, agentId={}, idleMs={}", agent.getAgentId(), now - agent.getLastSeenAt());
                    agent.getConnection().close(HubCloseCodes.GOING_AWAY, "Stale connection");
                    handleClose(agent, HubCloseCodes.GOING_AWAY, "Stale connection");
                    continue;
                }
                log.debug("stale agent kept for pending calls, agentId={}, pending={}", agent.getAgentId(), pending);
            }
            sendQuietly(agent, new PingMessage(now));
        }
    }

    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdownNow();
        for (ConnectedAgent agent : List.copyOf(agents.values())) {
            agent.getConnection().close(HubCloseCodes.GOING_AWAY, "Hub shutting down");
            handleClose(agent, HubCloseCodes.GOING_AWAY, "Hub shutting down");
        }
    }

    private void handleProgress(ConnectedAgent agent, RpcProgressMessage message) {
        PendingCall call = message.requestId() == null ? null : pendingCalls.get(message.requestId());
        if (call == null || call.owner != agent || call.onProgress == null) {
            return;
        }
        RpcProgress progress = RpcProgress.from(message.progress());
        if (progress == null) {
            log.debug("drop malformed progress, agentId={}, requestId={}", agent.getAgentId(), message.requestId());
            return;
        }
        try {
            call.onProgress.accept(progress, message.log());
        } catch (Exception ex) {
            log.warn("progress callback failed, requestId={}, error={}", message.requestId(), ex.getMessage());
        }
    }

    private void handleResult(ConnectedAgent agent, RpcResultMessage message) {
        PendingCall call = message.requestId() == null ? null : pendingCalls.get(message.requestId());
        if (call == null) {
            log.debug("late rpc result discarded, agentId={}, requestId={}", agent.getAgentId(), message.requestId());
            return;
        }
        if (call.owner != agent) {
            log.warn("rpc result from foreign connection ignored, agentId={}, requestId={}", agent.getAgentId(), message.requestId());
            return;
        }
        if (!pendingCalls.remove(call.requestId, call)) {
            return;
        }
        call.cancelTimeout();
        if (message.ok()) {
            call.future.complete(message.result() == null ? NullNode.getInstance() : message.result());
        } else {
            String error = message.error() == null ? RemoteCallException.DEFAULT_MESSAGE : message.error();
            call.future.completeExceptionally(new RemoteCallException(error));
        }
    }

    private void expire(PendingCall call, long timeoutMs) {
        if (!pendingCalls.remove(call.requestId, call)) {
            return;
        }
        log.info(
            "rpc call timed out, agentId={}, method={}, requestId={}, timeoutMs={}",
            call.owner.getAgentId(),
            call.method,
            call.requestId,
            timeoutMs
        );
        call.future.completeExceptionally(new RpcTimeoutException(
            "RPC timeout method=" + call.method + " agentId=" + call.owner.getAgentId() + " timeoutMs=" + timeoutMs));
    }

    private void rejectPendingCalls(ConnectedAgent owner, Function<String, RuntimeException> errorFactory) {
        for (PendingCall call : List.copyOf(pendingCalls.values())) {
            if (call.owner != owner) {
                continue;
            }
            if (pendingCalls.remove(call.requestId, call)) {
                call.cancelTimeout();
                call.future.completeExceptionally(errorFactory.apply(owner.getAgentId()));
            }
        }
    }

    private int countPendingCalls(ConnectedAgent agent) {
        int count = 0;
        for (PendingCall call : pendingCalls.values()) {
            if (call.owner == agent) {
                count++;
            }
        }
        return count;
    }

    private List<ConnectedAgent> sortedAgents() {
        List<ConnectedAgent> sorted = new ArrayList<>(agents.values());
        sorted.sort(Comparator.comparingLong(ConnectedAgent::getConnectedAt));
        return sorted;
    }

    private void sendQuietly(ConnectedAgent agent, HubMessage message) {
        try {
            agent.getConnection().send(codec.encode(message));
        } catch (Exception ex) {
            log.debug("send to agent failed, agentId={}, error={}", agent.getAgentId(), ex.getMessage());
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (Exception ex) {
            log.warn("agent sweep failed, error={}", ex.getMessage(), ex);
        }
    }

}
