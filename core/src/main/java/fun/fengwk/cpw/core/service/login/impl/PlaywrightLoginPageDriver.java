package fun.fengwk.cpw.core.service.login.impl;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.ScreenshotType;
import fun.fengwk.cpw.core.service.browser.BrowserProperties;
import fun.fengwk.cpw.core.service.browser.HumanBehavior;
import fun.fengwk.cpw.core.service.browser.HumanProperties;
import fun.fengwk.cpw.core.service.browser.session.AccountSessionManager;
import fun.fengwk.cpw.core.service.login.LoginPageDriver;
import fun.fengwk.cpw.core.service.login.LoginProperties;
import fun.fengwk.cpw.core.service.login.model.LoginCookie;
import fun.fengwk.cpw.core.service.login.model.LoginSnapshot;
import fun.fengwk.cpw.core.service.scrape.SessionInvalidException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Login page driver over a credential-less account session. Every poll holds the account page
 * lock only for the capture itself.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightLoginPageDriver implements LoginPageDriver {

    private final AccountSessionManager sessionManager;
    private final String accountId;
    private final LoginProperties loginProperties;
    private final BrowserProperties browserProperties;
    private final HumanProperties humanProperties;

    public PlaywrightLoginPageDriver(
        AccountSessionManager sessionManager,
        String accountId,
        LoginProperties loginProperties,
        BrowserProperties browserProperties,
        HumanProperties humanProperties
    ) {
        this.sessionManager = sessionManager;
        this.accountId = accountId;
        this.loginProperties = loginProperties;
        this.browserProperties = browserProperties;
        this.humanProperties = humanProperties;
    }

    @Override
    public void open() {
        sessionManager.execute(accountId, "", session -> {
            new HumanBehavior(session.getPage(), humanProperties)
                .navigate(loginProperties.getLoginUrl(), browserProperties.getNavigateTimeoutMs());
            return null;
        });
    }

    @Override
    public LoginSnapshot capture() {
        try {
            return sessionManager.executeOnCurrent(accountId, session -> {
                Page page = session.getPage();
                if (page.isClosed()) {
                    return LoginSnapshot.closedPage();
                }
                List<LoginCookie> cookies = new ArrayList<>();
                for (Cookie cookie : session.getBrowserContext().cookies()) {
                    cookies.add(toLoginCookie(cookie));
                }
                return new LoginSnapshot(false, page.url(), screenshot(page), cookies);
            });
        } catch (SessionInvalidException ex) {
            log.info("login session gone, accountId={}, error={}", accountId, ex.getMessage());
            return LoginSnapshot.closedPage();
        }
    }

    private String screenshot(Page page) {
        try {
            byte[] image = page.screenshot(new Page.ScreenshotOptions()
                .setType(ScreenshotType.JPEG)
                .setQuality(loginProperties.getScreenshotQuality())
                .setTimeout(loginProperties.getScreenshotTimeoutMs()));
            return Base64.getEncoder().encodeToString(image);
        } catch (PlaywrightException ex) {
            log.debug("login screenshot failed, accountId={}, error={}", accountId, ex.getMessage());
            return null;
        }
    }

    private LoginCookie toLoginCookie(Cookie cookie) {
        return new LoginCookie(
            cookie.name,
            cookie.value,
            cookie.domain,
            cookie.path,
            cookie.expires,
            cookie.httpOnly,
            cookie.secure,
            cookie.sameSite == null ? null : cookie.sameSite.name().toLowerCase(Locale.ROOT)
        );
    }

}
