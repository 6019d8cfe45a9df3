package fun.fengwk.cpw.core.service.browser.session;

/**
 * @author fengwk
 */
public record SessionSummary(String accountId, long lastUsedAt, boolean pageClosed, String url) {
}
