package fun.fengwk.cpw.core.scheduler;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Jittered due-time thresholds. The threshold for an {@code (accountId, lastRunAt)} pair is fixed,
 * so repeated ticks agree, while different accounts spread across {@code [0.5, 1.5) x base}.
 *
 * @author fengwk
 */
public final class DueTimeCalculator {

    private static final double TWO_POW_32 = 4294967296.0;

    private DueTimeCalculator() {
    }

    public static long thresholdMs(String accountId, long lastRunAt, long baseIntervalMs) {
        CRC32 crc = new CRC32();
        crc.update((accountId + ":" + lastRunAt).getBytes(StandardCharsets.UTF_8));
        double fraction = crc.getValue() / TWO_POW_32;
        return (long) (baseIntervalMs * (0.5 + fraction));
    }

    /**
     * An account that never ran is due at once.
     */
    public static boolean isDue(String accountId, long lastRunAt, long now, long baseIntervalMs) {
        if (lastRunAt <= 0) {
            return true;
        }
        return now - lastRunAt >= thresholdMs(accountId, lastRunAt, baseIntervalMs);
    }

    public static long nextDueAt(String accountId, long lastRunAt, long baseIntervalMs) {
        if (lastRunAt <= 0) {
            return 0;
        }
        return lastRunAt + thresholdMs(accountId, lastRunAt, baseIntervalMs);
    }

}
