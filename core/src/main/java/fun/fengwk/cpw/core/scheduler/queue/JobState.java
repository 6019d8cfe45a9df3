package fun.fengwk.cpw.core.scheduler.queue;

/**
 * @author fengwk
 */
public enum JobState {

    PENDING,
    DELAYED,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }

}
