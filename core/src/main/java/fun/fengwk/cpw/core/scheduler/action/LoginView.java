package fun.fengwk.cpw.core.scheduler.action;

/**
 * Snapshot of the latest login of an account.
 *
 * @param screenshot latest base64 jpeg of the login page, null before the first one arrived
 * @author fengwk
 */
public record LoginView(
    String accountId,
    String executor,
    ActionState state,
    String screenshot,
    int screenshots,
    String error,
    long startedAt,
    Long finishedAt
) {
}
