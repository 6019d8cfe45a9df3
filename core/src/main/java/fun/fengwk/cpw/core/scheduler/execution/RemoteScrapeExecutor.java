package fun.fengwk.cpw.core.scheduler.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.hub.AgentHub;
import fun.fengwk.cpw.core.hub.CallOptions;
import fun.fengwk.cpw.core.hub.exception.RemoteCallException;
import fun.fengwk.cpw.core.hub.protocol.AgentMethods;
import fun.fengwk.cpw.core.scheduler.SchedulerProperties;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.cartadd.BulkAddListener;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddRequest;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;
import fun.fengwk.cpw.core.service.login.LoginListener;
import fun.fengwk.cpw.core.service.login.model.LoginResult;
import fun.fengwk.cpw.core.service.scrape.ScrapeErrorCode;
import fun.fengwk.cpw.core.service.scrape.ScrapeException;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs scrapes on a connected agent through the hub. Scrape error codes carried by a failed
 * result are turned back into their typed exceptions.
 *
 * @author fengwk
 */
@Slf4j
public class RemoteScrapeExecutor implements ScrapeExecutor {

    private static final long PAUSE_CALL_SLACK_MS = 5000;

    private final AgentHub agentHub;
    private final ObjectMapper objectMapper;
    private final SchedulerProperties schedulerProperties;
    private final String agentId;

    public RemoteScrapeExecutor(AgentHub agentHub, ObjectMapper objectMapper, SchedulerProperties schedulerProperties, String agentId) {
        this.agentHub = agentHub;
        this.objectMapper = objectMapper;
        this.schedulerProperties = schedulerProperties;
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }

    @Override
    public String describe() {
        return "agent:" + agentId;
    }

    @Override
    public CartCollectResult scrapeCart(AccountRecord account, Set<String> expectedListingIds) {
        JsonNode node = await(agentHub.call(
            agentId,
            AgentMethods.SCRAPE_CART,
            new AgentMethods.ScrapeCartParams(account.getId(), account.getCredential(), expectedListingIds),
            CallOptions.builder()
                .timeoutMs(schedulerProperties.getRemoteCartTimeoutMs())
                .onProgress((progress, line) -> log.debug(
                    "cart scrape progress, agentId={}, accountId={}, current={}, total={}, log={}",
                    agentId, account.getId(), progress.current(), progress.total(), line))
                .build()
        ));
        return convert(node, new TypeReference<CartCollectResult>() {});
    }

    @Override
    public List<SkuVariant> enumerateVariants(AccountRecord account, String listingId) {
        JsonNode node = await(agentHub.call(
            agentId,
            AgentMethods.ENUMERATE_VARIANTS,
            new AgentMethods.EnumerateVariantsParams(account.getId(), account.getCredential(), listingId),
            CallOptions.builder().timeoutMs(schedulerProperties.getRemoteVariantTimeoutMs()).build()
        ));
        return convert(node, new TypeReference<List<SkuVariant>>() {});
    }

    @Override
    public boolean requestPause(String accountId, long timeoutMs) {
        try {
            JsonNode node = await(agentHub.call(
                agentId,
                AgentMethods.PAUSE_ADD_FOR_SCRAPE,
                new AgentMethods.PauseParams(accountId, timeoutMs),
                CallOptions.builder().timeoutMs(timeoutMs + PAUSE_CALL_SLACK_MS).build()
            ));
            return convert(node, new TypeReference<AgentMethods.PauseResult>() {}).paused();
        } catch (RuntimeException ex) {
            log.warn("remote pause failed, agentId={}, accountId={}, error={}", agentId, accountId, ex.getMessage());
            return false;
        }
    }

    @Override
    public void resume(String accountId) {
        try {
            await(agentHub.call(
                agentId,
                AgentMethods.RESUME_ADD_FOR_SCRAPE,
                new AgentMethods.PauseParams(accountId, null),
                CallOptions.builder().timeoutMs(schedulerProperties.getResumeTimeoutMs()).build()
            ));
        } catch (RuntimeException ex) {
            log.warn("remote resume failed, agentId={}, accountId={}, error={}", agentId, accountId, ex.getMessage());
        }
    }

    @Override
    public LoginResult login(AccountRecord account, LoginListener listener) {
        JsonNode node = await(agentHub.call(
            agentId,
            AgentMethods.LOGIN_ACCOUNT,
            new AgentMethods.LoginParams(account.getId()),
            CallOptions.builder()
                .timeoutMs(schedulerProperties.getRemoteLoginTimeoutMs())
                .onProgress((progress, line) -> forwardScreenshot(account.getId(), line, listener))
                .build()
        ));
        return convert(node, new TypeReference<LoginResult>() {});
    }

    @Override
    public boolean cancelLogin(String accountId) {
        JsonNode node = await(agentHub.call(
            agentId,
            AgentMethods.CANCEL_LOGIN,
            new AgentMethods.LoginParams(accountId),
            CallOptions.builder().timeoutMs(schedulerProperties.getCancelLoginTimeoutMs()).build()
        ));
        return convert(node, new TypeReference<AgentMethods.CancelLoginResult>() {}).cancelled();
    }

    @Override
    public BulkAddResult addAllVariantsToCart(AccountRecord account, BulkAddRequest request, BulkAddListener listener) {
        JsonNode node = await(agentHub.call(
            agentId,
            AgentMethods.ADD_ALL_SKUS_TO_CART,
            new AgentMethods.AddAllSkusParams(
                account.getId(),
                account.getCredential(),
                request.getListingId(),
                request.getExistingSkuProperties(),
                request.getMaxSkus()),
            CallOptions.builder()
                .timeoutMs(schedulerProperties.getRemoteCartAddTimeoutMs())
                .onProgress((progress, line) -> listener.onProgress(
                    progress.total(), progress.current(), progress.success(), progress.failed(), line))
                .build()
        ));
        return convert(node, new TypeReference<BulkAddResult>() {});
    }

    private void forwardScreenshot(String accountId, String line, LoginListener listener) {
        if (line == null) {
            return;
        }
        JsonNode payload;
        try {
            payload = objectMapper.readTree(line);
        } catch (JsonProcessingException ex) {
            log.debug("login progress is not a screenshot, agentId={}, accountId={}", agentId, accountId);
            return;
        }
        if (AgentMethods.SCREENSHOT_LOG_TYPE.equals(payload.path("type").asText()) && payload.hasNonNull("image")) {
            listener.onScreenshot(payload.get("image").asText());
        }
    }

    private JsonNode await(CompletableFuture<JsonNode> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for agent " + agentId, ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RemoteCallException remote) {
                Optional<ScrapeException> decoded = ScrapeErrorCode.decode(remote.getMessage());
                if (decoded.isPresent()) {
                    throw decoded.get();
                }
                throw remote;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("agent call failed: " + cause.getMessage(), cause);
        }
    }

    private <T> T convert(JsonNode node, TypeReference<T> type) {
        try {
            return objectMapper.convertValue(node, type);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("failed to parse agent result: " + ex.getMessage(), ex);
        }
    }

}
