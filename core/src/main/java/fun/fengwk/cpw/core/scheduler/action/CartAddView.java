package fun.fengwk.cpw.core.scheduler.action;

import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;

import java.util.List;

/**
 * Snapshot of the latest bulk cart add of an account.
 *
 * @author fengwk
 */
public record CartAddView(
    String accountId,
    String listingId,
    String executor,
    ActionState state,
    int total,
    int current,
    int success,
    int failed,
    List<String> logs,
    BulkAddResult result,
    String error,
    long startedAt,
    Long finishedAt
) {
}
