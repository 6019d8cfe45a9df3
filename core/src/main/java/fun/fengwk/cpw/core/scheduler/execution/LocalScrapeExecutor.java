package fun.fengwk.cpw.core.scheduler.execution;

import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.service.cart.CartScrapeService;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.cartadd.BulkAddListener;
import fun.fengwk.cpw.core.service.cartadd.BulkCartAddService;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddRequest;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;
import fun.fengwk.cpw.core.service.coordination.AccountTaskCoordinator;
import fun.fengwk.cpw.core.service.login.AccountLoginService;
import fun.fengwk.cpw.core.service.login.LoginListener;
import fun.fengwk.cpw.core.service.login.model.LoginResult;
import fun.fengwk.cpw.core.service.variant.VariantScrapeService;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class LocalScrapeExecutor implements ScrapeExecutor {

    private final CartScrapeService cartScrapeService;
    private final VariantScrapeService variantScrapeService;
    private final AccountTaskCoordinator accountTaskCoordinator;
    private final AccountLoginService accountLoginService;
    private final BulkCartAddService bulkCartAddService;

    @Override
    public String describe() {
        return "local";
    }

    @Override
    public CartCollectResult scrapeCart(AccountRecord account, Set<String> expectedListingIds) {
        return cartScrapeService.scrapeCart(account.getId(), account.getCredential(), expectedListingIds);
    }

    @Override
    public List<SkuVariant> enumerateVariants(AccountRecord account, String listingId) {
        return variantScrapeService.enumerateVariants(account.getId(), account.getCredential(), listingId);
    }

    @Override
    public boolean requestPause(String accountId, long timeoutMs) {
        return accountTaskCoordinator.requestPause(accountId, timeoutMs);
    }

    @Override
    public void resume(String accountId) {
        accountTaskCoordinator.resume(accountId);
    }

    @Override
    public LoginResult login(AccountRecord account, LoginListener listener) {
        return accountLoginService.login(account.getId(), listener);
    }

    @Override
    public boolean cancelLogin(String accountId) {
        return accountLoginService.cancel(accountId);
    }

    @Override
    public BulkAddResult addAllVariantsToCart(AccountRecord account, BulkAddRequest request, BulkAddListener listener) {
        try {
            return bulkCartAddService.addAllVariants(account.getId(), account.getCredential(), request, listener);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("bulk cart add interrupted, accountId=" + account.getId(), ex);
        }
    }

}
