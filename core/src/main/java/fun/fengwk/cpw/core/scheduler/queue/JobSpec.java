package fun.fengwk.cpw.core.scheduler.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Enqueue request.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSpec {

    /**
     * Idempotency key. Enqueueing an id whose job is still unfinished is a no-op.
     */
    private String jobId;

    private String type;

    @Builder.Default
    private Map<String, Object> payload = Map.of();

    /**
     * Lower value runs first.
     */
    @Builder.Default
    private int priority = 5;

    @Builder.Default
    private int attempts = 1;

    /**
     * First retry delay, doubled on every further attempt.
     */
    private long backoffMs;

}
