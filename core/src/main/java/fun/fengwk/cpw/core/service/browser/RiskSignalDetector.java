package fun.fengwk.cpw.core.service.browser;

import com.microsoft.playwright.Page;
import fun.fengwk.cpw.core.service.scrape.NeedsCaptchaException;
import fun.fengwk.cpw.core.service.scrape.NeedsLoginException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Detects login walls, slider captchas and access-denied pages.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class RiskSignalDetector {

    static final List<String> LOGIN_URL_MARKERS = List.of("login.taobao.com", "login.tmall.com");

    static final List<String> LOGIN_SELECTORS = List.of(
        "#fm-login-id",
        "input[name=\"fm-login-id\"]",
        "#fm-login-password",
        "#login-form",
        ".login-box",
        ".qrcode-login",
        "iframe[src*=\"login.taobao.com\"]",
        "iframe[src*=\"login.tmall.com\"]"
    );

    static final List<String> CAPTCHA_SELECTORS = List.of(
        "#nc_1_n1z",
        ".nc-container",
        ".J_MIDDLEWARE_FRAME_WIDGET"
    );

    static final List<String> CAPTCHA_TEXTS = List.of("滑动验证", "请完成验证");

    static final List<String> ACCESS_DENIED_URL_MARKERS = List.of("punish", "secdev", "waf");

    /**
     * Classify the page state from its url, the selectors found on it and its visible text.
     */
    public RiskSignal classify(String url, Set<String> presentSelectors, String bodyText) {
        String lowerUrl = url == null ? "" : url.toLowerCase(Locale.ROOT);
        for (String marker : LOGIN_URL_MARKERS) {
            if (lowerUrl.contains(marker)) {
                return RiskSignal.LOGIN_REQUIRED;
            }
        }
        for (String marker : ACCESS_DENIED_URL_MARKERS) {
            if (lowerUrl.contains(marker)) {
                return RiskSignal.ACCESS_DENIED;
            }
        }
        for (String selector : CAPTCHA_SELECTORS) {
            if (presentSelectors.contains(selector)) {
                return RiskSignal.CAPTCHA;
            }
        }
        String text = bodyText == null ? "" : bodyText;
        for (String marker : CAPTCHA_TEXTS) {
            if (text.contains(marker)) {
                return RiskSignal.CAPTCHA;
            }
        }
        for (String selector : LOGIN_SELECTORS) {
            if (presentSelectors.contains(selector)) {
                return RiskSignal.LOGIN_REQUIRED;
            }
        }
        return RiskSignal.NONE;
    }

    public RiskSignal detect(Page page) {
        Set<String> present = new LinkedHashSet<>();
        for (String selector : CAPTCHA_SELECTORS) {
            if (isPresent(page, selector)) {
                present.add(selector);
            }
        }
        for (String selector : LOGIN_SELECTORS) {
            if (isPresent(page, selector)) {
                present.add(selector);
            }
        }
        return classify(page.url(), present, readBodyText(page));
    }

    /**
     * Throw the matching challenge exception when the page is not usable for scraping.
     */
    public void check(Page page) {
        RiskSignal signal = detect(page);
        switch (signal) {
            case LOGIN_REQUIRED -> throw new NeedsLoginException("login required, url=" + page.url());
            case CAPTCHA -> throw new NeedsCaptchaException("captcha required, url=" + page.url());
            case ACCESS_DENIED -> throw new NeedsCaptchaException("access denied, url=" + page.url());
            default -> {
            }
        }
    }

    private boolean isPresent(Page page, String selector) {
        try {
            return page.querySelector(selector) != null;
        } catch (RuntimeException ex) {
            log.debug("risk selector check failed, selector={}, error={}", selector, ex.getMessage());
            return false;
        }
    }

    private String readBodyText(Page page) {
        try {
            Object text = page.evaluate("() => (document.body && document.body.innerText || '').slice(0, 5000)");
            return text == null ? "" : text.toString();
        } catch (RuntimeException ex) {
            log.debug("read body text failed, error={}", ex.getMessage());
            return "";
        }
    }

}
