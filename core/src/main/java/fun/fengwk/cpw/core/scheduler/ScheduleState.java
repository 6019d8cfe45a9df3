package fun.fengwk.cpw.core.scheduler;

/**
 * Scheduling state of one account, owned by {@link ScrapeScheduler}.
 *
 * @author fengwk
 */
public class ScheduleState {

    private final String accountId;
    private volatile long lastRunAt;
    private volatile boolean running;
    private volatile String queuedJobId;

    ScheduleState(String accountId) {
        this.accountId = accountId;
    }

    public String getAccountId() {
        return accountId;
    }

    /**
     * Finish time of the last attempt, 0 when the account never ran.
     */
    public long getLastRunAt() {
        return lastRunAt;
    }

    public boolean isRunning() {
        return running;
    }

    public String getQueuedJobId() {
        return queuedJobId;
    }

    void markQueued(String jobId) {
        this.queuedJobId = jobId;
    }

    void markStarted() {
        this.running = true;
    }

    void markFinished(long now) {
        this.running = false;
        this.lastRunAt = now;
    }

}
