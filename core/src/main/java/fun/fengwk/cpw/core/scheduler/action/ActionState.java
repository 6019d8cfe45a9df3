package fun.fengwk.cpw.core.scheduler.action;

/**
 * @author fengwk
 */
public enum ActionState {

    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED

}
