package fun.fengwk.cpw.core.service.variant;

import com.microsoft.playwright.Page;
import fun.fengwk.cpw.core.service.browser.BrowserProperties;
import fun.fengwk.cpw.core.service.browser.HumanBehavior;
import fun.fengwk.cpw.core.service.browser.HumanProperties;
import fun.fengwk.cpw.core.service.browser.RiskSignalDetector;
import fun.fengwk.cpw.core.service.browser.session.AccountSessionManager;
import fun.fengwk.cpw.core.service.variant.impl.PlaywrightVariantPageDriver;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Opens a listing in the account session and enumerates its variants.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VariantScrapeService {

    private final AccountSessionManager sessionManager;
    private final VariantEnumerator variantEnumerator;
    private final RiskSignalDetector riskSignalDetector;
    private final VariantProperties variantProperties;
    private final BrowserProperties browserProperties;
    private final HumanProperties humanProperties;

    public List<SkuVariant> enumerateVariants(String accountId, String credential, String listingId) {
        if (listingId == null || !listingId.matches("\\d+")) {
            throw new IllegalArgumentException("invalid listing id: " + listingId);
        }
        log.info("start variant enumeration, accountId={}, listingId={}", accountId, listingId);
        return sessionManager.execute(accountId, credential, session -> {
            Page page = session.getPage();
            HumanBehavior human = new HumanBehavior(page, humanProperties);
            human.navigate(String.format(variantProperties.getItemUrlTemplate(), listingId), browserProperties.getNavigateTimeoutMs());
            riskSignalDetector.check(page);
            human.occasionalWander();
            return variantEnumerator.enumerate(new PlaywrightVariantPageDriver(page, variantProperties, human), listingId);
        });
    }

}
