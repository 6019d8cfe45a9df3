package fun.fengwk.cpw.core.facade.result;

import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;

import java.util.List;

/**
 * Consumer of scrape results. Persistence and notifications live behind it.
 *
 * @author fengwk
 */
public interface ScrapeResultSink {

    ScrapeOutcome acceptCart(AccountRecord account, CartCollectResult result);

    void acceptVariants(AccountRecord account, String listingId, List<SkuVariant> variants);

}
