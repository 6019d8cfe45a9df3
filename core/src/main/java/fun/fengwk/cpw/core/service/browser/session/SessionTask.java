package fun.fengwk.cpw.core.service.browser.session;

/**
 * Unit of work executed against a live account session.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface SessionTask<T> {

    T execute(AccountBrowserSession session) throws Exception;

}
