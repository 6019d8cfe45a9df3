package fun.fengwk.cpw.core.scheduler;

import fun.fengwk.cpw.core.hub.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class RiskBackoffTest {

    private MutableClock clock;
    private RiskBackoff riskBackoff;

    @BeforeEach
    public void setUp() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.setRiskBasePauseMs(1000);
        properties.setRiskMaxPauseMs(5000);
        clock = new MutableClock(10_000L);
        riskBackoff = new RiskBackoff(properties, clock);
    }

    @Test
    public void shouldDoublePauseUpToMax() {
        assertThat(riskBackoff.recordRiskSignal()).isEqualTo(1000);
        assertThat(riskBackoff.recordRiskSignal()).isEqualTo(2000);
        assertThat(riskBackoff.recordRiskSignal()).isEqualTo(4000);
        assertThat(riskBackoff.recordRiskSignal()).isEqualTo(5000);
        assertThat(riskBackoff.getStreak()).isEqualTo(4);
        assertThat(riskBackoff.getPauseUntil()).isEqualTo(15_000L);
    }

    @Test
    public void shouldUseFiveMinuteBaseAndHourCapByDefault() {
        RiskBackoff defaults = new RiskBackoff(new SchedulerProperties(), clock);
        long minute = 60_000L;

        assertThat(defaults.recordRiskSignal()).isEqualTo(5 * minute);
        assertThat(defaults.recordRiskSignal()).isEqualTo(10 * minute);
        assertThat(defaults.recordRiskSignal()).isEqualTo(20 * minute);
        assertThat(defaults.recordRiskSignal()).isEqualTo(40 * minute);
        assertThat(defaults.recordRiskSignal()).isEqualTo(60 * minute);
        assertThat(defaults.recordRiskSignal()).isEqualTo(60 * minute);
        assertThat(defaults.getPauseUntil()).isEqualTo(10_000L + 60 * minute);
    }

    @Test
    public void shouldPauseUntilDeadline() {
        riskBackoff.recordRiskSignal();

        assertThat(riskBackoff.isPaused()).isTrue();
        clock.advance(1000);
        assertThat(riskBackoff.isPaused()).isFalse();
    }

    @Test
    public void shouldResetOnSuccess() {
        riskBackoff.recordRiskSignal();
        riskBackoff.recordRiskSignal();

        riskBackoff.recordSuccess();

        assertThat(riskBackoff.isPaused()).isFalse();
        assertThat(riskBackoff.getStreak()).isZero();
        assertThat(riskBackoff.recordRiskSignal()).isEqualTo(1000);
    }

}
