package fun.fengwk.cpw.core.service.browser.session;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import lombok.extern.slf4j.Slf4j;

/**
 * One live automation session bound to a single account.
 *
 * <p>The session owns its playwright driver, browser, context and page. Close is idempotent
 * and releases resources from the innermost outward.
 *
 * @author fengwk
 */
@Slf4j
public class AccountBrowserSession {

    private final String accountId;
    private final String credentialFingerprint;
    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext browserContext;
    private final Page page;
    private final long createdAt;
    private volatile long lastUsedAt;
    private volatile boolean closed = false;

    public AccountBrowserSession(
        String accountId,
        String credentialFingerprint,
        Playwright playwright,
        Browser browser,
        BrowserContext browserContext,
        Page page
    ) {
        this.accountId = accountId;
        this.credentialFingerprint = credentialFingerprint;
        this.playwright = playwright;
        this.browser = browser;
        this.browserContext = browserContext;
        this.page = page;
        this.createdAt = System.currentTimeMillis();
        this.lastUsedAt = createdAt;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getCredentialFingerprint() {
        return credentialFingerprint;
    }

    public Page getPage() {
        return page;
    }

    public BrowserContext getBrowserContext() {
        return browserContext;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getLastUsedAt() {
        return lastUsedAt;
    }

    public boolean isClosed() {
        return closed;
    }

    void touch() {
        lastUsedAt = System.currentTimeMillis();
    }

    /**
     * Trivial round-trip through the live page.
     */
    public boolean isHealthy() {
        if (closed) {
            return false;
        }
        try {
            if (page.isClosed()) {
                return false;
            }
            return Boolean.TRUE.equals(page.evaluate("() => true"));
        } catch (Exception ex) {
            log.info("session health check failed, accountId={}, error={}", accountId, ex.getMessage());
            return false;
        }
    }

    public SessionSummary summarize() {
        boolean pageClosed;
        String url;
        try {
            pageClosed = closed || page.isClosed();
            url = pageClosed ? "" : page.url();
        } catch (Exception ex) {
            pageClosed = true;
            url = "";
        }
        return new SessionSummary(accountId, lastUsedAt, pageClosed, url);
    }

    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        closeStep("page", page);
        closeStep("browser context", browserContext);
        closeStep("browser", browser);
        closeStep("playwright", playwright);
    }

    private void closeStep(String resource, AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            if (isExpectedCloseException(ex)) {
                log.debug("{} already closed for account {}, skip close", resource, accountId);
            } else {
                log.warn("failed to close {} for account {}", resource, accountId, ex);
            }
        }
    }

    static boolean isExpectedCloseException(Exception ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase();
        String exceptionName = ex.getClass().getSimpleName();
        return "TargetClosedError".equals(exceptionName)
            || message.contains("target page, context or browser has been closed")
            || message.contains("channel has been closed")
            || message.contains("connection closed");
    }

}
