package fun.fengwk.cpw.core.scheduler.queue;

import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a queued job.
 *
 * @author fengwk
 */
public record JobView(
    String jobId,
    String type,
    Map<String, Object> payload,
    JobState state,
    int priority,
    int attemptsMade,
    int maxAttempts,
    String lastError,
    Object result,
    List<String> logs,
    long createdAt,
    long updatedAt
) {
}
