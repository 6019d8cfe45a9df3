package fun.fengwk.cpw.core.service.cartadd.impl;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import fun.fengwk.cpw.core.service.browser.BrowserProperties;
import fun.fengwk.cpw.core.service.browser.HumanBehavior;
import fun.fengwk.cpw.core.service.browser.HumanProperties;
import fun.fengwk.cpw.core.service.browser.RiskSignalDetector;
import fun.fengwk.cpw.core.service.browser.session.AccountSessionManager;
import fun.fengwk.cpw.core.service.cartadd.CartAddException;
import fun.fengwk.cpw.core.service.cartadd.CartAddPageDriver;
import fun.fengwk.cpw.core.service.cartadd.CartAddProperties;
import fun.fengwk.cpw.core.service.variant.VariantEnumerator;
import fun.fengwk.cpw.core.service.variant.VariantProperties;
import fun.fengwk.cpw.core.service.variant.impl.PlaywrightVariantPageDriver;
import fun.fengwk.cpw.core.service.variant.model.OptionGroup;
import fun.fengwk.cpw.core.service.variant.model.OptionSelection;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import fun.fengwk.cpw.core.service.variant.model.VariantOption;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Cart add driver over the account session. Every call takes the account page for one step only.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightCartAddPageDriver implements CartAddPageDriver {

    static final String IS_DISABLED_SCRIPT = """
        (el) => el.disabled === true
          || el.getAttribute('aria-disabled') === 'true'
          || /disabled|forbid/i.test(String(el.getAttribute('class') || ''))
        """;

    static final String MINI_CART_COUNT_SCRIPT = """
        (selectors) => {
          for (const selector of selectors) {
            const el = document.querySelector(selector);
            const text = el ? String(el.textContent || '').replace(/\\s+/g, '') : '';
            if (/^\\d+$/.test(text)) return Number(text);
          }
          return null;
        }
        """;

    static final String SUCCESS_TEXT_SCRIPT = """
        (pattern) => new RegExp(pattern).test(document.body ? document.body.innerText : '')
        """;

    private final AccountSessionManager sessionManager;
    private final String accountId;
    private final String credential;
    private final VariantEnumerator variantEnumerator;
    private final RiskSignalDetector riskSignalDetector;
    private final VariantProperties variantProperties;
    private final CartAddProperties cartAddProperties;
    private final BrowserProperties browserProperties;
    private final HumanProperties humanProperties;

    public PlaywrightCartAddPageDriver(
        AccountSessionManager sessionManager,
        String accountId,
        String credential,
        VariantEnumerator variantEnumerator,
        RiskSignalDetector riskSignalDetector,
        VariantProperties variantProperties,
        CartAddProperties cartAddProperties,
        BrowserProperties browserProperties,
        HumanProperties humanProperties
    ) {
        this.sessionManager = sessionManager;
        this.accountId = accountId;
        this.credential = credential;
        this.variantEnumerator = variantEnumerator;
        this.riskSignalDetector = riskSignalDetector;
        this.variantProperties = variantProperties;
        this.cartAddProperties = cartAddProperties;
        this.browserProperties = browserProperties;
        this.humanProperties = humanProperties;
    }

    @Override
    public void openListing(String listingId) {
        sessionManager.execute(accountId, credential, session -> {
            Page page = session.getPage();
            HumanBehavior human = new HumanBehavior(page, humanProperties);
            human.navigate(String.format(variantProperties.getItemUrlTemplate(), listingId), browserProperties.getNavigateTimeoutMs());
            riskSignalDetector.check(page);
            human.browse();
            return null;
        });
    }

    @Override
    public List<SkuVariant> listVariants(String listingId) {
        return sessionManager.execute(accountId, credential, session -> {
            Page page = session.getPage();
            HumanBehavior human = new HumanBehavior(page, humanProperties);
            return variantEnumerator.enumerate(new PlaywrightVariantPageDriver(page, variantProperties, human), listingId);
        });
    }

    @Override
    public void addToCart(SkuVariant variant) {
        sessionManager.execute(accountId, credential, session -> {
            Page page = session.getPage();
            HumanBehavior human = new HumanBehavior(page, humanProperties);
            selectOptions(page, human, variant);

            if (ThreadLocalRandom.current().nextDouble() < cartAddProperties.getRandomScrollChance()) {
                long distance = 100 + ThreadLocalRandom.current().nextInt(201);
                human.smoothScroll(ThreadLocalRandom.current().nextBoolean() ? distance : -distance);
            }
            human.occasionalWander();

            Locator button = findAddButton(page);
            if (button == null) {
                throw new CartAddException("add-to-cart button not found");
            }
            if (Boolean.TRUE.equals(button.evaluate(IS_DISABLED_SCRIPT))) {
                throw new CartAddException("add-to-cart button disabled");
            }
            Integer countBefore = readMiniCartCount(page);
            try {
                human.click(button, cartAddProperties.getClickTimeoutMs());
            } catch (PlaywrightException ex) {
                throw new CartAddException("add-to-cart click failed: " + ex.getMessage());
            }
            riskSignalDetector.check(page);
            if (!awaitConfirmation(page, countBefore)) {
                throw new CartAddException("add-to-cart not confirmed");
            }
            // Close the confirmation layer so it does not cover the sku panel.
            page.keyboard().press("Escape");
            log.debug("variant added to cart, accountId={}, skuId={}", accountId, variant.getSkuId());
            return null;
        });
    }

    @Override
    public void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }

    private void selectOptions(Page page, HumanBehavior human, SkuVariant variant) {
        PlaywrightVariantPageDriver variantDriver = new PlaywrightVariantPageDriver(page, variantProperties, human);
        for (OptionSelection selection : variant.getSelections()) {
            OptionGroup group = new OptionGroup(selection.groupId(), selection.groupName());
            VariantOption option = new VariantOption(selection.optionId(), selection.optionLabel());
            if (!variantDriver.select(group, option)) {
                throw new CartAddException("option not selectable: " + selection.groupName() + ":" + selection.optionLabel());
            }
        }
    }

    private Locator findAddButton(Page page) {
        for (String selector : cartAddProperties.getAddButtonSelectors()) {
            Locator candidate = page.locator(selector).first();
            try {
                if (candidate.isVisible()) {
                    return candidate;
                }
            } catch (PlaywrightException ex) {
                log.debug("add button selector failed, selector={}, error={}", selector, ex.getMessage());
            }
        }
        return null;
    }

    private Integer readMiniCartCount(Page page) {
        Object raw = page.evaluate(MINI_CART_COUNT_SCRIPT, cartAddProperties.getMiniCartCountSelectors());
        return raw instanceof Number number ? number.intValue() : null;
    }

    private boolean awaitConfirmation(Page page, Integer countBefore) {
        long deadline = System.currentTimeMillis() + cartAddProperties.getSuccessTimeoutMs();
        while (true) {
            if (Boolean.TRUE.equals(page.evaluate(SUCCESS_TEXT_SCRIPT, cartAddProperties.getSuccessTextPattern()))) {
                return true;
            }
            Integer count = readMiniCartCount(page);
            if (countBefore != null && count != null && count > countBefore) {
                return true;
            }
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            page.waitForTimeout(cartAddProperties.getSuccessPollIntervalMs());
        }
    }

}
