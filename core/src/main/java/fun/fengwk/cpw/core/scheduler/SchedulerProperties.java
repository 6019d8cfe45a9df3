package fun.fengwk.cpw.core.scheduler;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scheduler, queue and job execution configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.scheduler")
public class SchedulerProperties {

    /**
     * Enable the periodic scheduling loop. Manual triggers work either way.
     */
    private boolean enabled = true;

    /**
     * Cadence of the scheduling loop.
     */
    private long tickIntervalMs = 10000;

    /**
     * Base re-scrape interval per account, the effective threshold is jittered in [0.5, 1.5) of it.
     */
    private long pollingIntervalMs = 60 * 60 * 1000L;

    /**
     * Quiet hours start, {@code HH:mm}. Empty or equal to the end disables quiet hours.
     */
    private String quietHoursStart = "";

    private String quietHoursEnd = "";

    /**
     * Zone the quiet hours are evaluated in.
     */
    private String zoneId = "Asia/Shanghai";

    private int cartJobPriority = 5;

    private int cartJobAttempts = 2;

    private long cartJobBackoffMs = 30000;

    /**
     * Priority of manual triggers, they overtake scheduled jobs.
     */
    private int manualJobPriority = 1;

    private int variantJobPriority = 3;

    private int variantJobAttempts = 1;

    /**
     * How long a scrape waits for a running bulk operation to reach a safe point.
     */
    private long pauseTimeoutMs = 20000;

    private long resumeTimeoutMs = 15000;

    /**
     * Extra collection passes when a pass failed or found fewer listings than expected.
     */
    private int extraPasses = 2;

    private long extraPassDelayMs = 1500;

    private long remoteCartTimeoutMs = 10 * 60 * 1000L;

    private long remoteVariantTimeoutMs = 5 * 60 * 1000L;

    /**
     * Budget of a remote login, a little longer than the agent's own login timeout.
     */
    private long remoteLoginTimeoutMs = 12 * 60 * 1000L;

    private long cancelLoginTimeoutMs = 8000;

    private long remoteCartAddTimeoutMs = 60 * 60 * 1000L;

    /**
     * Consecutive failures after which an account cools down.
     */
    private int cooldownThreshold = 5;

    private long riskBasePauseMs = 5 * 60 * 1000L;

    private long riskMaxPauseMs = 60 * 60 * 1000L;

    /**
     * Finished job records kept for lookup.
     */
    private int jobRetention = 1000;

    private int jobLogLimit = 200;

    /**
     * Worker poll timeout, also bounds how late a delayed retry becomes runnable.
     */
    private long workerPollMs = 200;

}
