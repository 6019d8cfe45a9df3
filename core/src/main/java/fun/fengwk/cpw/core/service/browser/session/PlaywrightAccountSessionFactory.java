package fun.fengwk.cpw.core.service.browser.session;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.Proxy;
import fun.fengwk.cpw.core.service.browser.BrowserProperties;
import fun.fengwk.cpw.core.service.browser.BrowserStealthSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Launches one playwright browser per account session and injects the account cookies.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightAccountSessionFactory implements AccountSessionFactory {

    private final BrowserProperties browserProperties;
    private final CredentialCookies credentialCookies;

    @Override
    public AccountBrowserSession create(String accountId, String credential, String credentialFingerprint) {
        List<Cookie> cookies = credentialCookies.parse(credential);

        Playwright playwright = null;
        Browser browser = null;
        BrowserContext browserContext = null;
        try {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(buildLaunchOptions());
            browserContext = browser.newContext(buildContextOptions());
            BrowserStealthSupport.apply(browserContext, browserProperties);
            browserContext.setDefaultNavigationTimeout(browserProperties.getNavigateTimeoutMs());
            if (!cookies.isEmpty()) {
                browserContext.addCookies(cookies);
            }
            Page page = browserContext.newPage();
            log.info("created account session, accountId={}, cookies={}", accountId, cookies.size());
            return new AccountBrowserSession(accountId, credentialFingerprint, playwright, browser, browserContext, page);
        } catch (RuntimeException ex) {
            log.warn("create account session failed, accountId={}, error={}", accountId, ex.getMessage(), ex);
            // Partially initialized resources must not leak.
            closeQuietly(browserContext);
            closeQuietly(browser);
            closeQuietly(playwright);
            throw new IllegalStateException("failed to create session: " + ex.getMessage(), ex);
        }
    }

    private BrowserType.LaunchOptions buildLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());
        if (browserProperties.getIgnoreDefaultArgs() != null && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        if (StringUtils.hasText(browserProperties.getProxyServer())) {
            Proxy proxy = new Proxy(browserProperties.getProxyServer());
            if (StringUtils.hasText(browserProperties.getProxyUsername())) {
                proxy.setUsername(browserProperties.getProxyUsername());
            }
            if (StringUtils.hasText(browserProperties.getProxyPassword())) {
                proxy.setPassword(browserProperties.getProxyPassword());
            }
            options.setProxy(proxy);
        }
        return options;
    }

    private Browser.NewContextOptions buildContextOptions() {
        Browser.NewContextOptions options = new Browser.NewContextOptions()
            .setViewportSize(browserProperties.getViewportWidth(), browserProperties.getViewportHeight());

        String userAgent = resolveUserAgent();
        if (StringUtils.hasText(userAgent)) {
            options.setUserAgent(userAgent);
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }

        Map<String, String> headers = new HashMap<>();
        if (browserProperties.getExtraHeaders() != null) {
            browserProperties.getExtraHeaders().forEach((key, value) -> {
                if (StringUtils.hasText(key) && StringUtils.hasText(value)) {
                    headers.put(key, value);
                }
            });
        }
        if (StringUtils.hasText(browserProperties.getAcceptLanguage())) {
            headers.putIfAbsent("Accept-Language", browserProperties.getAcceptLanguage());
        }
        if (!headers.isEmpty()) {
            options.setExtraHTTPHeaders(headers);
        }
        return options;
    }

    private String resolveUserAgent() {
        if (StringUtils.hasText(browserProperties.getUserAgent())) {
            return browserProperties.getUserAgent();
        }
        List<String> userAgents = browserProperties.getUserAgents();
        if (userAgents == null || userAgents.isEmpty()) {
            return "";
        }
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

    private void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            log.debug("close resource failed, error={}", ex.getMessage());
        }
    }

}
