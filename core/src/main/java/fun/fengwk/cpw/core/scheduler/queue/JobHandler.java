package fun.fengwk.cpw.core.scheduler.queue;

/**
 * Processes jobs of one type. Throwing fails the attempt, {@link NonRetryableJobException}
 * fails the job without further attempts.
 *
 * @author fengwk
 */
public interface JobHandler {

    String type();

    Object handle(JobContext context) throws Exception;

}
