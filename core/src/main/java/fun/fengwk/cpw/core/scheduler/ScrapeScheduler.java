package fun.fengwk.cpw.core.scheduler;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.scheduler.queue.JobListener;
import fun.fengwk.cpw.core.scheduler.queue.JobQueue;
import fun.fengwk.cpw.core.scheduler.queue.JobSpec;
import fun.fengwk.cpw.core.scheduler.queue.JobView;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Decides when each account cart is due and enqueues the scrape jobs.
 *
 * <p>Each tick does nothing during a risk pause or inside quiet hours. Otherwise every active account
 * with monitored listings that is neither queued nor running is checked against its jittered due time.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ScrapeScheduler implements JobListener {

    private final SchedulerProperties schedulerProperties;
    private final JobQueue jobQueue;
    private final AccountStore accountStore;
    private final RiskBackoff riskBackoff;
    private final Clock clock;
    private final Map<String, ScheduleState> states = new ConcurrentHashMap<>();
    private volatile boolean quietPaused;
    private ScheduledExecutorService executor;

    @Autowired
    public ScrapeScheduler(
        SchedulerProperties schedulerProperties,
        JobQueue jobQueue,
        AccountStore accountStore,
        RiskBackoff riskBackoff
    ) {
        this(schedulerProperties, jobQueue, accountStore, riskBackoff, Clock.systemUTC());
    }

    ScrapeScheduler(
        SchedulerProperties schedulerProperties,
        JobQueue jobQueue,
        AccountStore accountStore,
        RiskBackoff riskBackoff,
        Clock clock
    ) {
        this.schedulerProperties = schedulerProperties;
        this.jobQueue = jobQueue;
        this.accountStore = accountStore;
        this.riskBackoff = riskBackoff;
        this.clock = clock;
        jobQueue.addListener(this);
    }

    @PostConstruct
    public void start() {
        if (!schedulerProperties.isEnabled()) {
            log.info("scrape scheduler disabled");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cpw-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::tickSafely, 0, schedulerProperties.getTickIntervalMs(), TimeUnit.MILLISECONDS);
        log.info(
            "scrape scheduler started, tickMs={}, pollingIntervalMs={}",
            schedulerProperties.getTickIntervalMs(),
            schedulerProperties.getPollingIntervalMs()
        );
    }

    @PreDestroy
    public void stop() {
        if (executor != null) {
            executor.shutdownNow();
            log.info("scrape scheduler stopped");
        }
    }

    /**
     * Run one scheduling pass.
     *
     * @return number of jobs enqueued
     */
    public int tick() {
        long now = clock.millis();
        if (riskBackoff.isPaused()) {
            log.debug("risk pause active, scheduling skipped, pauseUntil={}", riskBackoff.getPauseUntil());
            return 0;
        }
        if (QuietHours.of(schedulerProperties).contains(clock.instant())) {
            if (!quietPaused) {
                log.info(
                    "quiet hours active, scheduling suspended, window={}-{}",
                    schedulerProperties.getQuietHoursStart(),
                    schedulerProperties.getQuietHoursEnd()
                );
            }
            quietPaused = true;
            return 0;
        }
        if (quietPaused) {
            log.info("quiet hours ended, scheduling resumed");
        }
        quietPaused = false;

        int enqueued = 0;
        Set<String> seen = new HashSet<>();
        List<AccountRecord> accounts = accountStore.listActiveAccounts();
        for (AccountRecord account : accounts) {
            seen.add(account.getId());
            if (account.getExpectedListingIds() == null || account.getExpectedListingIds().isEmpty()) {
                continue;
            }
            ScheduleState state = states.computeIfAbsent(account.getId(), ScheduleState::new);
            if (state.isRunning() || isQueued(state)) {
                continue;
            }
            long interval = schedulerProperties.getPollingIntervalMs();
            if (!DueTimeCalculator.isDue(account.getId(), state.getLastRunAt(), now, interval)) {
                continue;
            }
            String jobId = ScrapeJobs.cartScrapeJobId(account.getId(), now, interval);
            if (enqueueCart(jobId, account.getId(), false, schedulerProperties.getCartJobPriority())) {
                state.markQueued(jobId);
                enqueued++;
                log.info("cart scrape scheduled, accountId={}, jobId={}", account.getId(), jobId);
            }
        }
        states.entrySet().removeIf(entry -> !seen.contains(entry.getKey()) && !entry.getValue().isRunning() && !isQueued(entry.getValue()));
        return enqueued;
    }

    /**
     * Enqueue a forced cart scrape outside the time bucket, ignoring quiet hours.
     *
     * @return the job id
     */
    public String triggerNow(String accountId) {
        accountStore.findActiveAccount(accountId)
            .orElseThrow(() -> new IllegalArgumentException("account not found or inactive: " + accountId));
        String jobId = ScrapeJobs.manualCartScrapeJobId(accountId, clock.millis());
        enqueueCart(jobId, accountId, true, schedulerProperties.getManualJobPriority());
        states.computeIfAbsent(accountId, ScheduleState::new).markQueued(jobId);
        log.info("cart scrape triggered manually, accountId={}, jobId={}", accountId, jobId);
        return jobId;
    }

    /**
     * @return the job id, an existing one when the same listing was queued in this bucket
     */
    public String triggerVariants(String accountId, String listingId) {
        if (listingId == null || !listingId.trim().matches("\\d+")) {
            throw new IllegalArgumentException("invalid listing id: " + listingId);
        }
        accountStore.findActiveAccount(accountId)
            .orElseThrow(() -> new IllegalArgumentException("account not found or inactive: " + accountId));
        String jobId = ScrapeJobs.variantScrapeJobId(accountId, listingId.trim(), clock.millis(), schedulerProperties.getPollingIntervalMs());
        jobQueue.enqueue(JobSpec.builder()
            .jobId(jobId)
            .type(ScrapeJobs.VARIANT_SCRAPE)
            .payload(Map.of(ScrapeJobs.ACCOUNT_ID, accountId, ScrapeJobs.LISTING_ID, listingId.trim()))
            .priority(schedulerProperties.getVariantJobPriority())
            .attempts(schedulerProperties.getVariantJobAttempts())
            .backoffMs(schedulerProperties.getCartJobBackoffMs())
            .build());
        return jobId;
    }

    public Optional<ScheduleState> getState(String accountId) {
        return Optional.ofNullable(states.get(accountId));
    }

    @Override
    public void onActive(JobView job) {
        if (ScrapeJobs.CART_SCRAPE.equals(job.type())) {
            states.computeIfAbsent(accountIdOf(job), ScheduleState::new).markStarted();
        }
    }

    @Override
    public void onAttemptFinished(JobView job) {
        if (ScrapeJobs.CART_SCRAPE.equals(job.type())) {
            states.computeIfAbsent(accountIdOf(job), ScheduleState::new).markFinished(clock.millis());
        }
    }

    private boolean enqueueCart(String jobId, String accountId, boolean force, int priority) {
        return jobQueue.enqueue(JobSpec.builder()
            .jobId(jobId)
            .type(ScrapeJobs.CART_SCRAPE)
            .payload(Map.of(ScrapeJobs.ACCOUNT_ID, accountId, ScrapeJobs.FORCE, force))
            .priority(priority)
            .attempts(schedulerProperties.getCartJobAttempts())
            .backoffMs(schedulerProperties.getCartJobBackoffMs())
            .build());
    }

    private boolean isQueued(ScheduleState state) {
        String jobId = state.getQueuedJobId();
        if (jobId == null) {
            return false;
        }
        Optional<JobView> job = jobQueue.findJob(jobId);
        return job.isPresent() && !job.get().state().isFinished();
    }

    private String accountIdOf(JobView job) {
        return String.valueOf(job.payload().get(ScrapeJobs.ACCOUNT_ID));
    }

    private void tickSafely() {
        try {
            tick();
        } catch (Exception ex) {
            log.error("scheduling pass failed", ex);
        }
    }

}
