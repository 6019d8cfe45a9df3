package fun.fengwk.cpw.core.service.cartadd;

import fun.fengwk.cpw.core.service.browser.BrowserProperties;
import fun.fengwk.cpw.core.service.browser.HumanProperties;
import fun.fengwk.cpw.core.service.browser.RiskSignalDetector;
import fun.fengwk.cpw.core.service.browser.session.AccountSessionManager;
import fun.fengwk.cpw.core.service.cart.CartScrapeService;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.cart.model.CartLineItem;
import fun.fengwk.cpw.core.service.cartadd.impl.PlaywrightCartAddPageDriver;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddRequest;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;
import fun.fengwk.cpw.core.service.variant.VariantEnumerator;
import fun.fengwk.cpw.core.service.variant.VariantProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Adds all variants of a listing to the account cart, skipping the variants the cart already holds.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BulkCartAddService {

    private final BulkCartAdder bulkCartAdder;
    private final CartScrapeService cartScrapeService;
    private final AccountSessionManager sessionManager;
    private final VariantEnumerator variantEnumerator;
    private final RiskSignalDetector riskSignalDetector;
    private final VariantProperties variantProperties;
    private final CartAddProperties cartAddProperties;
    private final BrowserProperties browserProperties;
    private final HumanProperties humanProperties;

    public BulkAddResult addAllVariants(
        String accountId,
        String credential,
        BulkAddRequest request,
        BulkAddListener listener
    ) throws InterruptedException {
        String listingId = request.getListingId();
        if (listingId == null || !listingId.matches("\\d+")) {
            throw new IllegalArgumentException("invalid listing id: " + listingId);
        }
        BulkAddRequest effective = request;
        if (request.getExistingSkuProperties() == null) {
            effective = request.toBuilder().existingSkuProperties(readCartVariants(accountId, credential, listingId)).build();
        }
        CartAddPageDriver driver = new PlaywrightCartAddPageDriver(
            sessionManager, accountId, credential, variantEnumerator, riskSignalDetector,
            variantProperties, cartAddProperties, browserProperties, humanProperties);
        return bulkCartAdder.addAll(accountId, driver, effective, listener);
    }

    private Set<String> readCartVariants(String accountId, String credential, String listingId) {
        CartCollectResult cart = cartScrapeService.scrapeCart(accountId, credential, Set.of(listingId));
        Set<String> existing = cart.getItems().stream()
            .filter(item -> listingId.equals(item.getListingId()))
            .map(CartLineItem::getSkuProperties)
            .filter(properties -> properties != null && !properties.isBlank())
            .collect(Collectors.toSet());
        log.info("cart variants of listing read, accountId={}, listingId={}, existing={}", accountId, listingId, existing.size());
        return existing;
    }

}
