package fun.fengwk.cpw.core.scheduler;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.facade.result.ScrapeResultSink;
import fun.fengwk.cpw.core.scheduler.execution.ExecutionRouter;
import fun.fengwk.cpw.core.scheduler.execution.ScrapeExecutor;
import fun.fengwk.cpw.core.scheduler.queue.JobContext;
import fun.fengwk.cpw.core.scheduler.queue.JobHandler;
import fun.fengwk.cpw.core.scheduler.queue.NonRetryableJobException;
import fun.fengwk.cpw.core.service.scrape.ScrapeException;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Executes {@code variant-scrape} jobs.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VariantScrapeJobHandler implements JobHandler {

    private final AccountStore accountStore;
    private final ExecutionRouter executionRouter;
    private final ScrapeResultSink scrapeResultSink;
    private final AccountOutcomeRecorder outcomeRecorder;
    private final SchedulerProperties schedulerProperties;

    @Override
    public String type() {
        return ScrapeJobs.VARIANT_SCRAPE;
    }

    @Override
    public Map<String, Object> handle(JobContext context) {
        String accountId = context.getString(ScrapeJobs.ACCOUNT_ID);
        String listingId = context.getString(ScrapeJobs.LISTING_ID);
        AccountRecord account = accountStore.findActiveAccount(accountId)
            .orElseThrow(() -> new NonRetryableJobException("account not found or inactive, accountId=" + accountId));
        ScrapeExecutor executor = executionRouter.route(account);
        context.log("executor=" + executor.describe());

        List<SkuVariant> variants;
        executor.requestPause(accountId, schedulerProperties.getPauseTimeoutMs());
        try {
            variants = executor.enumerateVariants(account, listingId);
        } catch (ScrapeException ex) {
            if (AccountOutcomeRecorder.isChallenge(ex)) {
                throw outcomeRecorder.recordChallenged(account, ex);
            }
            outcomeRecorder.recordFailure(account, ex);
            throw ex;
        } catch (IllegalArgumentException ex) {
            throw new NonRetryableJobException(ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            outcomeRecorder.recordFailure(account, ex);
            throw ex;
        } finally {
            executor.resume(accountId);
        }

        scrapeResultSink.acceptVariants(account, listingId, variants);
        outcomeRecorder.recordSuccess(account);
        log.info("variant scrape finished, accountId={}, listingId={}, variants={}", accountId, listingId, variants.size());
        context.log("variants=" + variants.size());
        return Map.of(ScrapeJobs.LISTING_ID, listingId, "variants", variants.size());
    }

}
