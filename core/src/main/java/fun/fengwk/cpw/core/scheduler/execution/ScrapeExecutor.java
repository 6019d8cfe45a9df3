package fun.fengwk.cpw.core.scheduler.execution;

import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.cartadd.BulkAddListener;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddRequest;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;
import fun.fengwk.cpw.core.service.login.LoginListener;
import fun.fengwk.cpw.core.service.login.model.LoginResult;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;

import java.util.List;
import java.util.Set;

/**
 * Execution surface bound to an account: the local session manager or a remote agent.
 *
 * @author fengwk
 */
public interface ScrapeExecutor {

    /**
     * {@code local} or {@code agent:<id>}, for logs.
     */
    String describe();

    CartCollectResult scrapeCart(AccountRecord account, Set<String> expectedListingIds);

    List<SkuVariant> enumerateVariants(AccountRecord account, String listingId);

    /**
     * Best-effort pause of a bulk operation running on the same account.
     *
     * @return whether the bulk operation is paused
     */
    boolean requestPause(String accountId, long timeoutMs);

    void resume(String accountId);

    /**
     * Interactive login, screenshots stream to the listener until the account is logged in.
     */
    LoginResult login(AccountRecord account, LoginListener listener);

    /**
     * @return whether a login was running for the account
     */
    boolean cancelLogin(String accountId);

    BulkAddResult addAllVariantsToCart(AccountRecord account, BulkAddRequest request, BulkAddListener listener);

}
