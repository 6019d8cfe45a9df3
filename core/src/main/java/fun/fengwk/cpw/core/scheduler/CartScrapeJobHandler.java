package fun.fengwk.cpw.core.scheduler;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.facade.result.ScrapeOutcome;
import fun.fengwk.cpw.core.facade.result.ScrapeResultSink;
import fun.fengwk.cpw.core.scheduler.execution.ExecutionRouter;
import fun.fengwk.cpw.core.scheduler.execution.ScrapeExecutor;
import fun.fengwk.cpw.core.scheduler.queue.JobContext;
import fun.fengwk.cpw.core.scheduler.queue.JobHandler;
import fun.fengwk.cpw.core.scheduler.queue.NonRetryableJobException;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.scrape.ScrapeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Set;

/**
 * Executes {@code cart-scrape} jobs.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class CartScrapeJobHandler implements JobHandler {

    private final AccountStore accountStore;
    private final ExecutionRouter executionRouter;
    private final ScrapeResultSink scrapeResultSink;
    private final AccountOutcomeRecorder outcomeRecorder;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    @Autowired
    public CartScrapeJobHandler(
        AccountStore accountStore,
        ExecutionRouter executionRouter,
        ScrapeResultSink scrapeResultSink,
        AccountOutcomeRecorder outcomeRecorder,
        SchedulerProperties schedulerProperties
    ) {
        this(accountStore, executionRouter, scrapeResultSink, outcomeRecorder, schedulerProperties, Clock.systemUTC());
    }

    CartScrapeJobHandler(
        AccountStore accountStore,
        ExecutionRouter executionRouter,
        ScrapeResultSink scrapeResultSink,
        AccountOutcomeRecorder outcomeRecorder,
        SchedulerProperties schedulerProperties,
        Clock clock
    ) {
        this.accountStore = accountStore;
        this.executionRouter = executionRouter;
        this.scrapeResultSink = scrapeResultSink;
        this.outcomeRecorder = outcomeRecorder;
        this.schedulerProperties = schedulerProperties;
        this.clock = clock;
    }

    @Override
    public String type() {
        return ScrapeJobs.CART_SCRAPE;
    }

    @Override
    public ScrapeOutcome handle(JobContext context) throws InterruptedException {
        String accountId = context.getString(ScrapeJobs.ACCOUNT_ID);
        boolean force = context.getBoolean(ScrapeJobs.FORCE);
        if (!force && QuietHours.of(schedulerProperties).contains(clock.instant())) {
            log.info("quiet hours active, cart scrape skipped, accountId={}", accountId);
            context.log("quiet hours active, skipped");
            return new ScrapeOutcome(0, 0, 0);
        }

        AccountRecord account = accountStore.findActiveAccount(accountId)
            .orElseThrow(() -> new NonRetryableJobException("account not found or inactive, accountId=" + accountId));
        ScrapeExecutor executor = executionRouter.route(account);
        log.info("cart scrape started, accountId={}, executor={}, force={}", accountId, executor.describe(), force);
        context.log("executor=" + executor.describe());

        CartCollectResult result;
        try {
            result = collect(context, executor, account);
        } catch (ScrapeException ex) {
            if (AccountOutcomeRecorder.isChallenge(ex)) {
                throw outcomeRecorder.recordChallenged(account, ex);
            }
            outcomeRecorder.recordFailure(account, ex);
            throw ex;
        } catch (RuntimeException ex) {
            outcomeRecorder.recordFailure(account, ex);
            throw ex;
        }

        ScrapeOutcome outcome = scrapeResultSink.acceptCart(account, result);
        outcomeRecorder.recordSuccess(account);
        log.info(
            "cart scrape finished, accountId={}, updated={}, missing={}, failed={}",
            accountId,
            outcome.updated(),
            outcome.missing(),
            outcome.failed()
        );
        context.log("updated=" + outcome.updated() + " missing=" + outcome.missing() + " failed=" + outcome.failed());
        return outcome;
    }

    /**
     * Borrow the session from a running bulk operation, then collect with up to
     * {@code extraPasses} more passes while a pass failed or found fewer listings than expected.
     */
    CartCollectResult collect(JobContext context, ScrapeExecutor executor, AccountRecord account) throws InterruptedException {
        String accountId = account.getId();
        Set<String> expected = account.getExpectedListingIds() == null ? Set.of() : account.getExpectedListingIds();
        boolean paused = executor.requestPause(accountId, schedulerProperties.getPauseTimeoutMs());
        context.log("bulk pause granted=" + paused);
        try {
            CartCollectResult best = null;
            RuntimeException lastError = null;
            int passes = 1 + Math.max(0, schedulerProperties.getExtraPasses());
            for (int pass = 1; pass <= passes; pass++) {
                if (pass > 1) {
                    Thread.sleep(schedulerProperties.getExtraPassDelayMs());
                }
                try {
                    CartCollectResult next = executor.scrapeCart(account, expected);
                    if (best == null || next.distinctListingIds().size() > best.distinctListingIds().size()) {
                        best = next;
                    }
                } catch (ScrapeException ex) {
                    if (AccountOutcomeRecorder.isChallenge(ex)) {
                        throw ex;
                    }
                    lastError = ex;
                    context.log("pass " + pass + " failed: " + ex.getMessage());
                } catch (RuntimeException ex) {
                    lastError = ex;
                    context.log("pass " + pass + " failed: " + ex.getMessage());
                    log.info("cart pass failed, accountId={}, pass={}, error={}", accountId, pass, ex.getMessage());
                }
                if (best != null && best.distinctListingIds().size() >= expected.size()) {
                    break;
                }
            }
            if (best == null) {
                throw lastError;
            }
            context.log("distinct=" + best.distinctListingIds().size() + " expected=" + expected.size());
            return best;
        } finally {
            executor.resume(accountId);
        }
    }

}
