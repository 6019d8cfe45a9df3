package fun.fengwk.cpw.core.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class QuietHoursTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Shanghai");

    @Test
    public void shouldMatchSameDayWindow() {
        QuietHours quietHours = new QuietHours("12:00", "14:00", ZONE);

        assertThat(quietHours.contains(at(12, 0))).isTrue();
        assertThat(quietHours.contains(at(13, 59))).isTrue();
        assertThat(quietHours.contains(at(14, 0))).isFalse();
        assertThat(quietHours.contains(at(11, 59))).isFalse();
    }

    @Test
    public void shouldWrapAroundMidnight() {
        QuietHours quietHours = new QuietHours("23:00", "07:00", ZONE);

        assertThat(quietHours.contains(at(23, 30))).isTrue();
        assertThat(quietHours.contains(at(3, 0))).isTrue();
        assertThat(quietHours.contains(at(7, 0))).isFalse();
        assertThat(quietHours.contains(at(12, 0))).isFalse();
    }

    @Test
    public void shouldBeDisabledWhenUnsetOrInvalid() {
        assertThat(new QuietHours("", "", ZONE).isEnabled()).isFalse();
        assertThat(new QuietHours("25:00", "07:00", ZONE).isEnabled()).isFalse();
        assertThat(new QuietHours("7:00", "08:00", ZONE).isEnabled()).isFalse();
        assertThat(new QuietHours("08:00", "08:00", ZONE).contains(at(8, 0))).isFalse();
    }

    @Test
    public void shouldParseMinutes() {
        assertThat(QuietHours.parseMinutes(" 01:30 ")).isEqualTo(90);
        assertThat(QuietHours.parseMinutes("23:60")).isEqualTo(-1);
        assertThat(QuietHours.parseMinutes(null)).isEqualTo(-1);
    }

    private Instant at(int hour, int minute) {
        return LocalDateTime.of(2024, 5, 1, hour, minute).atZone(ZONE).toInstant();
    }

}
