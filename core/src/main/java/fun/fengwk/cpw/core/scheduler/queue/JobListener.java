package fun.fengwk.cpw.core.scheduler.queue;

/**
 * @author fengwk
 */
public interface JobListener {

    default void onActive(JobView job) {
    }

    /**
     * Called whenever a job leaves the active state: completed, failed, or delayed for a retry.
     */
    default void onAttemptFinished(JobView job) {
    }

}
