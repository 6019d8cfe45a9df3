package fun.fengwk.cpw.core.scheduler.queue;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Per-attempt view handed to a {@link JobHandler}.
 *
 * @author fengwk
 */
public class JobContext {

    private final String jobId;
    private final String type;
    private final Map<String, Object> payload;
    private final int attempt;
    private final Consumer<String> logSink;

    public JobContext(String jobId, String type, Map<String, Object> payload, int attempt, Consumer<String> logSink) {
        this.jobId = jobId;
        this.type = type;
        this.payload = payload == null ? Map.of() : payload;
        this.attempt = attempt;
        this.logSink = logSink;
    }

    public String getJobId() {
        return jobId;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * 1-based attempt number.
     */
    public int getAttempt() {
        return attempt;
    }

    public String getString(String key) {
        Object value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }

    public boolean getBoolean(String key) {
        Object value = payload.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }

    /**
     * Append a line to the job log, queryable with the job.
     */
    public void log(String line) {
        if (logSink != null) {
            logSink.accept(line);
        }
    }

}
