package fun.fengwk.cpw.core.scheduler.queue;

/**
 * Fails a job immediately, remaining attempts are discarded.
 *
 * @author fengwk
 */
public class NonRetryableJobException extends RuntimeException {

    public NonRetryableJobException(String message) {
        super(message);
    }

    public NonRetryableJobException(String message, Throwable cause) {
        super(message, cause);
    }

}
