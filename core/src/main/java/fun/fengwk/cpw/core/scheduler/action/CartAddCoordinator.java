package fun.fengwk.cpw.core.scheduler.action;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.scheduler.AccountOutcomeRecorder;
import fun.fengwk.cpw.core.scheduler.SchedulerProperties;
import fun.fengwk.cpw.core.scheduler.execution.ExecutionRouter;
import fun.fengwk.cpw.core.scheduler.execution.ScrapeExecutor;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddRequest;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;
import fun.fengwk.cpw.core.service.scrape.ScrapeException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts bulk cart adds on the account's execution surface and tracks their progress. Cart scrapes
 * of the same account keep working meanwhile, they pause the bulk add at its next safe point.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class CartAddCoordinator {

    private final AccountStore accountStore;
    private final ExecutionRouter executionRouter;
    private final AccountOutcomeRecorder outcomeRecorder;
    private final SchedulerProperties schedulerProperties;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Clock clock;
    private final Map<String, CartAddRun> runs = new ConcurrentHashMap<>();

    @Autowired
    public CartAddCoordinator(
        AccountStore accountStore,
        ExecutionRouter executionRouter,
        AccountOutcomeRecorder outcomeRecorder,
        SchedulerProperties schedulerProperties
    ) {
        this(accountStore, executionRouter, outcomeRecorder, schedulerProperties,
            Executors.newCachedThreadPool(daemon()), Clock.systemUTC());
    }

    CartAddCoordinator(
        AccountStore accountStore,
        ExecutionRouter executionRouter,
        AccountOutcomeRecorder outcomeRecorder,
        SchedulerProperties schedulerProperties,
        Executor executor,
        Clock clock
    ) {
        this.accountStore = accountStore;
        this.executionRouter = executionRouter;
        this.outcomeRecorder = outcomeRecorder;
        this.schedulerProperties = schedulerProperties;
        this.executor = executor;
        this.ownedExecutor = executor instanceof ExecutorService service ? service : null;
        this.clock = clock;
    }

    /**
     * @param maxSkus variant limit, null uses the agent's configured limit
     * @throws IllegalArgumentException when the listing id is malformed or the account is unknown or inactive
     * @throws IllegalStateException when a bulk cart add already runs for the account
     */
    public CartAddView start(String accountId, String listingId, Integer maxSkus) {
        if (listingId == null || !listingId.matches("\\d+")) {
            throw new IllegalArgumentException("invalid listing id: " + listingId);
        }
        AccountRecord account = accountStore.findActiveAccount(accountId)
            .orElseThrow(() -> new IllegalArgumentException("account not found or inactive: " + accountId));
        ScrapeExecutor scrapeExecutor = executionRouter.route(account);
        CartAddRun run = new CartAddRun(accountId, listingId, scrapeExecutor.describe(), clock.millis(),
            schedulerProperties.getJobLogLimit());
        CartAddRun previous = runs.compute(accountId, (id, existing) ->
            existing != null && existing.state == ActionState.RUNNING ? existing : run);
        if (previous != run) {
            throw new IllegalStateException("bulk cart add already running for account " + accountId);
        }
        BulkAddRequest request = BulkAddRequest.builder().listingId(listingId).maxSkus(maxSkus).build();
        log.info("bulk cart add started, accountId={}, listingId={}, executor={}", accountId, listingId, scrapeExecutor.describe());
        try {
            executor.execute(() -> runCartAdd(account, scrapeExecutor, request, run));
        } catch (RejectedExecutionException ex) {
            run.finish(ActionState.FAILED, null, "coordinator shutting down", clock.millis());
            throw new IllegalStateException("coordinator shutting down", ex);
        }
        return run.view();
    }

    public Optional<CartAddView> find(String accountId) {
        CartAddRun run = runs.get(accountId);
        return run == null ? Optional.empty() : Optional.of(run.view());
    }

    @PreDestroy
    public void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private void runCartAdd(AccountRecord account, ScrapeExecutor scrapeExecutor, BulkAddRequest request, CartAddRun run) {
        try {
            BulkAddResult result = scrapeExecutor.addAllVariantsToCart(account, request, run::progress);
            run.finish(ActionState.SUCCEEDED, result, null, clock.millis());
            log.info("bulk cart add finished, accountId={}, listingId={}, success={}, failed={}, skipped={}",
                account.getId(), request.getListingId(), result.getSuccessCount(), result.getFailedCount(), result.getSkippedCount());
        } catch (ScrapeException ex) {
            if (AccountOutcomeRecorder.isChallenge(ex)) {
                outcomeRecorder.recordChallenged(account, ex);
            }
            run.finish(ActionState.FAILED, null, ex.getCode() + ": " + ex.getMessage(), clock.millis());
            log.warn("bulk cart add aborted, accountId={}, code={}, error={}", account.getId(), ex.getCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            run.finish(ActionState.FAILED, null, error, clock.millis());
            log.warn("bulk cart add failed, accountId={}, error={}", account.getId(), error);
        }
    }

    private static ThreadFactory daemon() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "cpw-cart-add-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static class CartAddRun {

        private final String accountId;
        private final String listingId;
        private final String executor;
        private final long startedAt;
        private final int logLimit;
        private final List<String> logs = new ArrayList<>();
        private volatile ActionState state = ActionState.RUNNING;
        private int total;
        private int current;
        private int success;
        private int failed;
        private BulkAddResult result;
        private String error;
        private Long finishedAt;

        CartAddRun(String accountId, String listingId, String executor, long startedAt, int logLimit) {
            this.accountId = accountId;
            this.listingId = listingId;
            this.executor = executor;
            this.startedAt = startedAt;
            this.logLimit = Math.max(1, logLimit);
        }

        synchronized void progress(int total, int current, int success, int failed, String line) {
            this.total = total;
            this.current = current;
            this.success = success;
            this.failed = failed;
            if (line != null) {
                logs.add(line);
                if (logs.size() > logLimit) {
                    logs.remove(0);
                }
            }
        }

        synchronized void finish(ActionState finalState, BulkAddResult finalResult, String finalError, long at) {
            result = finalResult;
            error = finalError;
            finishedAt = at;
            state = finalState;
        }

        synchronized CartAddView view() {
            return new CartAddView(accountId, listingId, executor, state, total, current, success, failed,
                List.copyOf(logs), result, error, startedAt, finishedAt);
        }

    }

}
