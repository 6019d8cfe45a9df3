package fun.fengwk.cpw.core.facade.result.impl;

import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.facade.result.ScrapeOutcome;
import fun.fengwk.cpw.core.facade.result.ScrapeResultSink;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.cart.model.CartLineItem;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Result sink that only logs. Counts are derived against the account's monitored listings.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class LoggingScrapeResultSink implements ScrapeResultSink {

    @Override
    public ScrapeOutcome acceptCart(AccountRecord account, CartCollectResult result) {
        Set<String> priced = new HashSet<>();
        Set<String> unpriced = new HashSet<>();
        for (CartLineItem item : result.getItems()) {
            if (item.getFinalPrice() != null && item.getFinalPrice().compareTo(BigDecimal.ZERO) > 0) {
                priced.add(item.getListingId());
            } else {
                unpriced.add(item.getListingId());
            }
            log.info(
                "cart item, accountId={}, listingId={}, skuId={}, finalPrice={}, title={}",
                account.getId(),
                item.getListingId(),
                item.getSkuId(),
                item.getFinalPrice(),
                item.getTitle()
            );
        }
        unpriced.removeAll(priced);

        Set<String> monitored = account.getExpectedListingIds();
        int updated;
        int missing;
        int failed;
        if (monitored == null || monitored.isEmpty()) {
            updated = priced.size();
            missing = 0;
            failed = unpriced.size();
        } else {
            updated = 0;
            missing = 0;
            failed = 0;
            for (String listingId : monitored) {
                if (priced.contains(listingId)) {
                    updated++;
                } else if (unpriced.contains(listingId)) {
                    failed++;
                } else {
                    missing++;
                }
            }
        }
        ScrapeOutcome outcome = new ScrapeOutcome(updated, missing, failed);
        log.info("cart result accepted, accountId={}, outcome={}", account.getId(), outcome);
        return outcome;
    }

    @Override
    public void acceptVariants(AccountRecord account, String listingId, List<SkuVariant> variants) {
        for (SkuVariant variant : variants) {
            log.info(
                "variant, accountId={}, listingId={}, skuId={}, properties={}, finalPrice={}",
                account.getId(),
                listingId,
                variant.getSkuId(),
                variant.getProperties(),
                variant.getFinalPrice()
            );
        }
    }

}
