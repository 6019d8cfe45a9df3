package fun.fengwk.cpw.core.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Process-wide pause after risk signals: {@code min(base x 2^(streak-1), max)}, reset by any clean success.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class RiskBackoff {

    private final SchedulerProperties schedulerProperties;
    private final Clock clock;
    private int streak;
    private long pauseUntil;

    @Autowired
    public RiskBackoff(SchedulerProperties schedulerProperties) {
        this(schedulerProperties, Clock.systemUTC());
    }

    RiskBackoff(SchedulerProperties schedulerProperties, Clock clock) {
        this.schedulerProperties = schedulerProperties;
        this.clock = clock;
    }

    /**
     * @return the pause applied, in milliseconds
     */
    public synchronized long recordRiskSignal() {
        streak++;
        long base = schedulerProperties.getRiskBasePauseMs();
        long max = schedulerProperties.getRiskMaxPauseMs();
        long pauseMs = base * (1L << Math.min(30, streak - 1));
        if (pauseMs <= 0 || pauseMs > max) {
            pauseMs = max;
        }
        pauseUntil = clock.millis() + pauseMs;
        log.warn("risk pause escalated, streak={}, pauseMs={}", streak, pauseMs);
        return pauseMs;
    }

    public synchronized void recordSuccess() {
        if (streak > 0 || pauseUntil > 0) {
            log.info("risk pause cleared, previousStreak={}", streak);
        }
        streak = 0;
        pauseUntil = 0;
    }

    public synchronized boolean isPaused() {
        return clock.millis() < pauseUntil;
    }

    public synchronized int getStreak() {
        return streak;
    }

    public synchronized long getPauseUntil() {
        return pauseUntil;
    }

}
