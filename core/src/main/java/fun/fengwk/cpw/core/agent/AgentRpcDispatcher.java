package fun.fengwk.cpw.core.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.cpw.core.hub.protocol.AgentMethods;
import fun.fengwk.cpw.core.hub.protocol.HubMessage;
import fun.fengwk.cpw.core.hub.protocol.HubMessageCodec;
import fun.fengwk.cpw.core.hub.protocol.PongMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcProgress;
import fun.fengwk.cpw.core.hub.protocol.RpcProgressMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcResultMessage;
import fun.fengwk.cpw.core.service.browser.session.AccountSessionManager;
import fun.fengwk.cpw.core.service.cart.CartScrapeService;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.cartadd.BulkCartAddService;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddRequest;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;
import fun.fengwk.cpw.core.service.coordination.AccountTaskCoordinator;
import fun.fengwk.cpw.core.service.login.AccountLoginService;
import fun.fengwk.cpw.core.service.login.model.LoginResult;
import fun.fengwk.cpw.core.service.scrape.ScrapeErrorCode;
import fun.fengwk.cpw.core.service.scrape.ScrapeException;
import fun.fengwk.cpw.core.service.variant.VariantScrapeService;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Serves hub RPCs on the agent.
 *
 * <p>Browser methods run one at a time on a dedicated thread, Playwright objects are not thread-safe.
 * Bulk cart add and login hold no page between their steps and run on their own pool, a scrape
 * queued on the browser thread can then pause a bulk cart add of the same account. Pause, cancel
 * and status methods run on a separate pool so they can answer while a scrape is running.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AgentRpcDispatcher {

    private final CartScrapeService cartScrapeService;
    private final VariantScrapeService variantScrapeService;
    private final AccountTaskCoordinator accountTaskCoordinator;
    private final AccountSessionManager accountSessionManager;
    private final BulkCartAddService bulkCartAddService;
    private final AccountLoginService accountLoginService;
    private final ObjectMapper objectMapper;
    private final AgentProperties agentProperties;
    private final ExecutorService browserExecutor = Executors.newSingleThreadExecutor(daemon("cpw-agent-browser"));
    private final ExecutorService longCallExecutor = Executors.newCachedThreadPool(daemon("cpw-agent-long-call"));
    private final ExecutorService controlExecutor = Executors.newCachedThreadPool(daemon("cpw-agent-control"));
    private final ScheduledExecutorService heartbeatExecutor = Executors.newSingleThreadScheduledExecutor(daemon("cpw-agent-heartbeat"));
    private final AtomicInteger runningBrowserCalls = new AtomicInteger();

    @Autowired
    public AgentRpcDispatcher(
        CartScrapeService cartScrapeService,
        VariantScrapeService variantScrapeService,
        AccountTaskCoordinator accountTaskCoordinator,
        AccountSessionManager accountSessionManager,
        BulkCartAddService bulkCartAddService,
        AccountLoginService accountLoginService,
        HubMessageCodec hubMessageCodec,
        AgentProperties agentProperties
    ) {
        this.cartScrapeService = cartScrapeService;
        this.variantScrapeService = variantScrapeService;
        this.accountTaskCoordinator = accountTaskCoordinator;
        this.accountSessionManager = accountSessionManager;
        this.bulkCartAddService = bulkCartAddService;
        this.accountLoginService = accountLoginService;
        this.objectMapper = hubMessageCodec.getObjectMapper();
        this.agentProperties = agentProperties;
    }

    /**
     * Run the call asynchronously, every outcome ends in exactly one result message.
     */
    public void dispatch(RpcMessage message, Consumer<HubMessage> sender) {
        boolean browserCall = isBrowserMethod(message.method());
        boolean longCall = isLongMethod(message.method());
        ExecutorService executor = browserCall ? browserExecutor : longCall ? longCallExecutor : controlExecutor;
        try {
            executor.execute(() -> run(message, sender, browserCall || longCall));
        } catch (RejectedExecutionException ex) {
            sender.accept(RpcResultMessage.failure(message.requestId(), "agent shutting down"));
        }
    }

    @PreDestroy
    public void shutdown() {
        browserExecutor.shutdownNow();
        longCallExecutor.shutdownNow();
        controlExecutor.shutdownNow();
        heartbeatExecutor.shutdownNow();
    }

    JsonNode invoke(String requestId, String method, JsonNode params, Consumer<HubMessage> sender) {
        String name = method == null ? "" : method;
        return switch (name) {
            case AgentMethods.SCRAPE_CART -> scrapeCart(requestId, read(params, AgentMethods.ScrapeCartParams.class), sender);
            case AgentMethods.ENUMERATE_VARIANTS -> enumerateVariants(read(params, AgentMethods.EnumerateVariantsParams.class));
            case AgentMethods.PAUSE_ADD_FOR_SCRAPE -> pause(read(params, AgentMethods.PauseParams.class));
            case AgentMethods.RESUME_ADD_FOR_SCRAPE -> resume(read(params, AgentMethods.PauseParams.class));
            case AgentMethods.GET_BROWSER_STATUS -> browserStatus();
            case AgentMethods.ADD_ALL_SKUS_TO_CART -> addAllSkus(requestId, read(params, AgentMethods.AddAllSkusParams.class), sender);
            case AgentMethods.LOGIN_ACCOUNT -> login(requestId, read(params, AgentMethods.LoginParams.class), sender);
            case AgentMethods.CANCEL_LOGIN -> cancelLogin(read(params, AgentMethods.LoginParams.class));
            default -> throw new IllegalArgumentException("Unknown method: " + method);
        };
    }

    private void run(RpcMessage message, Consumer<HubMessage> sender, boolean heartbeatCall) {
        ScheduledFuture<?> heartbeat = null;
        if (heartbeatCall) {
            runningBrowserCalls.incrementAndGet();
            long interval = Math.max(1000, agentProperties.getHeartbeatIntervalMs());
            heartbeat = heartbeatExecutor.scheduleAtFixedRate(
                () -> sender.accept(new PongMessage(System.currentTimeMillis())), interval, interval, TimeUnit.MILLISECONDS);
        }
        long startedAt = System.currentTimeMillis();
        try {
            JsonNode result = invoke(message.requestId(), message.method(), message.params(), sender);
            sender.accept(RpcResultMessage.success(message.requestId(), result));
            log.info("rpc served, method={}, requestId={}, costMs={}", message.method(), message.requestId(), System.currentTimeMillis() - startedAt);
        } catch (ScrapeException ex) {
            log.warn("rpc failed, method={}, requestId={}, code={}, error={}", message.method(), message.requestId(), ex.getCode(), ex.getMessage());
            sender.accept(RpcResultMessage.failure(message.requestId(), ScrapeErrorCode.encode(ex)));
        } catch (RuntimeException ex) {
            log.warn("rpc failed, method={}, requestId={}, error={}", message.method(), message.requestId(), ex.getMessage(), ex);
            String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            sender.accept(RpcResultMessage.failure(message.requestId(), error));
        } finally {
            if (heartbeat != null) {
                heartbeat.cancel(false);
                runningBrowserCalls.decrementAndGet();
            }
        }
    }

    private JsonNode scrapeCart(String requestId, AgentMethods.ScrapeCartParams params, Consumer<HubMessage> sender) {
        requireAccount(params.accountId());
        Set<String> expected = params.expectedListingIds() == null ? Set.of() : params.expectedListingIds();
        sender.accept(RpcProgressMessage.of(requestId, new RpcProgress(expected.size(), 0, 0, 0), "cart scrape started"));
        CartCollectResult result = cartScrapeService.scrapeCart(params.accountId(), params.credential(), expected);
        int found = result.distinctListingIds().size();
        int missing = result.getMissingExpectedIds() == null ? 0 : result.getMissingExpectedIds().size();
        sender.accept(RpcProgressMessage.of(requestId,
            new RpcProgress(Math.max(expected.size(), found), found, found, missing),
            "cart scrape finished, reason=" + result.getStopReason()));
        return objectMapper.valueToTree(result);
    }

    private JsonNode enumerateVariants(AgentMethods.EnumerateVariantsParams params) {
        requireAccount(params.accountId());
        List<SkuVariant> variants = variantScrapeService.enumerateVariants(params.accountId(), params.credential(), params.listingId());
        return objectMapper.valueToTree(variants);
    }

    private JsonNode pause(AgentMethods.PauseParams params) {
        requireAccount(params.accountId());
        long timeoutMs = params.timeoutMs() == null ? agentProperties.getPauseTimeoutMs() : params.timeoutMs();
        boolean paused = accountTaskCoordinator.requestPause(params.accountId(), timeoutMs);
        return objectMapper.valueToTree(new AgentMethods.PauseResult(paused));
    }

    private JsonNode resume(AgentMethods.PauseParams params) {
        requireAccount(params.accountId());
        boolean wasPaused = accountTaskCoordinator.resume(params.accountId());
        return objectMapper.valueToTree(new AgentMethods.ResumeResult(wasPaused));
    }

    private JsonNode addAllSkus(String requestId, AgentMethods.AddAllSkusParams params, Consumer<HubMessage> sender) {
        requireAccount(params.accountId());
        BulkAddRequest request = BulkAddRequest.builder()
            .listingId(params.listingId())
            .existingSkuProperties(params.existingSkuProperties())
            .maxSkus(params.maxSkus())
            .build();
        try {
            BulkAddResult result = bulkCartAddService.addAllVariants(params.accountId(), params.credential(), request,
                (total, current, success, failed, line) ->
                    sender.accept(RpcProgressMessage.of(requestId, new RpcProgress(total, current, success, failed), line)));
            return objectMapper.valueToTree(result);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("bulk cart add interrupted", ex);
        }
    }

    private JsonNode login(String requestId, AgentMethods.LoginParams params, Consumer<HubMessage> sender) {
        requireAccount(params.accountId());
        LoginResult result = accountLoginService.login(params.accountId(),
            image -> sender.accept(RpcProgressMessage.of(requestId, new RpcProgress(1, 0, 0, 0), screenshotLog(image))));
        return objectMapper.valueToTree(result);
    }

    private JsonNode cancelLogin(AgentMethods.LoginParams params) {
        requireAccount(params.accountId());
        return objectMapper.valueToTree(new AgentMethods.CancelLoginResult(accountLoginService.cancel(params.accountId())));
    }

    private String screenshotLog(String image) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", AgentMethods.SCREENSHOT_LOG_TYPE);
        node.put("image", image);
        return node.toString();
    }

    private JsonNode browserStatus() {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("busy", runningBrowserCalls.get() > 0);
        node.set("sessions", objectMapper.valueToTree(accountSessionManager.listSessionSummaries()));
        return node;
    }

    private <T> T read(JsonNode params, Class<T> type) {
        if (params == null || !params.isObject()) {
            throw new IllegalArgumentException("params must be an object");
        }
        try {
            return objectMapper.treeToValue(params, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid params: " + ex.getOriginalMessage(), ex);
        }
    }

    private static void requireAccount(String accountId) {
        if (!StringUtils.hasText(accountId)) {
            throw new IllegalArgumentException("accountId is required");
        }
    }

    private static boolean isBrowserMethod(String method) {
        return AgentMethods.SCRAPE_CART.equals(method) || AgentMethods.ENUMERATE_VARIANTS.equals(method);
    }

    private static boolean isLongMethod(String method) {
        return AgentMethods.ADD_ALL_SKUS_TO_CART.equals(method) || AgentMethods.LOGIN_ACCOUNT.equals(method);
    }

    private static ThreadFactory daemon(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

}
