package fun.fengwk.cpw.core.service.cart;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.cpw.core.service.browser.BrowserProperties;
import fun.fengwk.cpw.core.service.browser.HumanBehavior;
import fun.fengwk.cpw.core.service.browser.HumanProperties;
import fun.fengwk.cpw.core.service.browser.RiskSignalDetector;
import fun.fengwk.cpw.core.service.browser.session.AccountSessionManager;
import fun.fengwk.cpw.core.service.cart.impl.PlaywrightCartPageDriver;
import fun.fengwk.cpw.core.service.cart.model.CartCollectRequest;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.scrape.ConvergenceGiveUpException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads an account cart through its live browser session.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CartScrapeService {

    private static final Pattern CART_URL_PATTERN = Pattern.compile("cart\\.taobao\\.com/cart\\.htm", Pattern.CASE_INSENSITIVE);

    private final AccountSessionManager sessionManager;
    private final CartCollector cartCollector;
    private final RiskSignalDetector riskSignalDetector;
    private final CartProperties cartProperties;
    private final BrowserProperties browserProperties;
    private final HumanProperties humanProperties;
    private final ObjectMapper objectMapper;

    public CartCollectResult scrapeCart(String accountId, String credential, Set<String> expectedListingIds) {
        long startedAt = System.currentTimeMillis();
        log.info("start cart scrape, accountId={}, expected={}", accountId, expectedListingIds == null ? 0 : expectedListingIds.size());

        CartCollectResult result = sessionManager.execute(accountId, credential, session -> {
            Page page = session.getPage();
            HumanBehavior human = new HumanBehavior(page, humanProperties);
            openCart(page, human);
            riskSignalDetector.check(page);
            human.occasionalWander();
            CartPageDriver driver = new PlaywrightCartPageDriver(page, cartProperties, objectMapper, human);
            return cartCollector.collect(driver, CartCollectRequest.builder()
                .expectedListingIds(expectedListingIds == null ? Set.of() : expectedListingIds)
                .build());
        });

        if (result.getItems().isEmpty() && !result.getStopReason().isConverged()) {
            throw new ConvergenceGiveUpException("cart collection gave up with no items, reason="
                + result.getStopReason() + ", diagnosis=" + result.getDiagnosis());
        }
        log.info(
            "cart scrape finished, accountId={}, items={}, uiTotal={}, reason={}, costMs={}",
            accountId,
            result.getItems().size(),
            result.getUiTotalCount(),
            result.getStopReason(),
            System.currentTimeMillis() - startedAt
        );
        return result;
    }

    private void openCart(Page page, HumanBehavior human) {
        String url = page.url();
        if (url != null && CART_URL_PATTERN.matcher(url).find()) {
            page.reload(new Page.ReloadOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout(browserProperties.getNavigateTimeoutMs()));
            human.think(1200, 2400);
        } else {
            human.navigate(cartProperties.getCartUrl(), browserProperties.getNavigateTimeoutMs());
        }
        // Close any overlay that would cover the list.
        page.keyboard().press("Escape");
    }

}
