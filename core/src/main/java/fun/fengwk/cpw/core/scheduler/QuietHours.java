package fun.fengwk.cpw.core.scheduler;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.regex.Pattern;

/**
 * Daily {@code [start, end)} window, wrapping midnight when start is after end.
 *
 * @author fengwk
 */
public class QuietHours {

    private static final Pattern HH_MM = Pattern.compile("^\\d{2}:\\d{2}$");

    private final int startMinute;
    private final int endMinute;
    private final ZoneId zoneId;

    public QuietHours(String start, String end, ZoneId zoneId) {
        this.startMinute = parseMinutes(start);
        this.endMinute = parseMinutes(end);
        this.zoneId = zoneId;
    }

    public static QuietHours of(SchedulerProperties properties) {
        return new QuietHours(properties.getQuietHoursStart(), properties.getQuietHoursEnd(), ZoneId.of(properties.getZoneId()));
    }

    public boolean isEnabled() {
        return startMinute >= 0 && endMinute >= 0 && startMinute != endMinute;
    }

    public boolean contains(Instant instant) {
        if (!isEnabled()) {
            return false;
        }
        LocalTime time = instant.atZone(zoneId).toLocalTime();
        int minute = time.getHour() * 60 + time.getMinute();
        if (startMinute < endMinute) {
            return minute >= startMinute && minute < endMinute;
        }
        return minute >= startMinute || minute < endMinute;
    }

    static int parseMinutes(String value) {
        if (value == null) {
            return -1;
        }
        String text = value.trim();
        if (!HH_MM.matcher(text).matches()) {
            return -1;
        }
        int hour = Integer.parseInt(text.substring(0, 2));
        int minute = Integer.parseInt(text.substring(3, 5));
        if (hour > 23 || minute > 59) {
            return -1;
        }
        return hour * 60 + minute;
    }

}
