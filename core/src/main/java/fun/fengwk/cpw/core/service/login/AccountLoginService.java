package fun.fengwk.cpw.core.service.login;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.cpw.core.service.browser.BrowserProperties;
import fun.fengwk.cpw.core.service.browser.HumanProperties;
import fun.fengwk.cpw.core.service.browser.session.AccountSessionManager;
import fun.fengwk.cpw.core.service.login.impl.PlaywrightLoginPageDriver;
import fun.fengwk.cpw.core.service.login.model.LoginCookie;
import fun.fengwk.cpw.core.service.login.model.LoginResult;
import fun.fengwk.cpw.core.service.login.model.LoginSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Interactive login of an account: opens the login page in a fresh session, streams screenshots to
 * the operator and returns the session cookies once the site considers the account logged in.
 *
 * <p>At most one login runs per account, starting a new one cancels the previous attempt.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AccountLoginService {

    private final AccountSessionManager sessionManager;
    private final LoginProperties loginProperties;
    private final BrowserProperties browserProperties;
    private final HumanProperties humanProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, LoginCancelToken> tokens = new ConcurrentHashMap<>();

    @Autowired
    public AccountLoginService(
        AccountSessionManager sessionManager,
        LoginProperties loginProperties,
        BrowserProperties browserProperties,
        HumanProperties humanProperties,
        ObjectMapper objectMapper
    ) {
        this(sessionManager, loginProperties, browserProperties, humanProperties, objectMapper, Clock.systemUTC());
    }

    AccountLoginService(
        AccountSessionManager sessionManager,
        LoginProperties loginProperties,
        BrowserProperties browserProperties,
        HumanProperties humanProperties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.sessionManager = sessionManager;
        this.loginProperties = loginProperties;
        this.browserProperties = browserProperties;
        this.humanProperties = humanProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public LoginResult login(String accountId, LoginListener listener) {
        LoginCancelToken token = new LoginCancelToken();
        LoginCancelToken previous = tokens.put(accountId, token);
        if (previous != null) {
            log.info("login restarted, cancel previous attempt, accountId={}", accountId);
            previous.cancel();
        }
        try {
            sessionManager.dispose(accountId);
            return awaitLogin(accountId, newPageDriver(accountId), token, listener);
        } finally {
            tokens.remove(accountId, token);
            // The login session carries no stored credential, scrapes must not reuse it.
            sessionManager.dispose(accountId);
        }
    }

    /**
     * @return whether a login was running for the account
     */
    public boolean cancel(String accountId) {
        LoginCancelToken token = tokens.get(accountId);
        if (token == null) {
            return false;
        }
        token.cancel();
        log.info("login cancel requested, accountId={}", accountId);
        return true;
    }

    public boolean isLoginRunning(String accountId) {
        return tokens.containsKey(accountId);
    }

    LoginPageDriver newPageDriver(String accountId) {
        return new PlaywrightLoginPageDriver(sessionManager, accountId, loginProperties, browserProperties, humanProperties);
    }

    LoginResult awaitLogin(String accountId, LoginPageDriver driver, LoginCancelToken token, LoginListener listener) {
        token.throwIfCancelled();
        driver.open();
        long deadline = clock.millis() + loginProperties.getTimeoutMs();
        int polls = 0;
        while (clock.millis() < deadline) {
            token.throwIfCancelled();
            LoginSnapshot snapshot = driver.capture();
            polls++;
            if (snapshot.closed()) {
                throw new LoginException("Login page closed");
            }
            if (snapshot.screenshot() != null) {
                notifyScreenshot(accountId, listener, snapshot.screenshot());
            }
            if (!isLoginPage(snapshot.url()) && hasAuthCookies(snapshot.cookies())) {
                log.info("login succeeded, accountId={}, polls={}, cookies={}", accountId, polls, snapshot.cookies().size());
                return new LoginResult(toCredential(snapshot.cookies()));
            }
            try {
                if (token.await(loginProperties.getPollIntervalMs())) {
                    throw new LoginCancelledException();
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new LoginException("Login interrupted", ex);
            }
        }
        log.warn("login timed out, accountId={}, polls={}", accountId, polls);
        throw new LoginException("Login timeout");
    }

    boolean isLoginPage(String url) {
        String value = url == null ? "" : url;
        return loginProperties.getLoginHosts().stream().anyMatch(value::contains);
    }

    boolean hasAuthCookies(List<LoginCookie> cookies) {
        if (cookies == null) {
            return false;
        }
        return cookies.stream().anyMatch(cookie -> loginProperties.getAuthCookieNames().contains(cookie.name())
            && cookie.domain() != null
            && loginProperties.getAuthCookieDomains().stream().anyMatch(cookie.domain()::contains));
    }

    private void notifyScreenshot(String accountId, LoginListener listener, String image) {
        try {
            listener.onScreenshot(image);
        } catch (RuntimeException ex) {
            log.warn("login screenshot listener failed, accountId={}, error={}", accountId, ex.getMessage());
        }
    }

    private String toCredential(List<LoginCookie> cookies) {
        try {
            return objectMapper.writeValueAsString(cookies);
        } catch (JsonProcessingException ex) {
            throw new LoginException("failed to serialize login cookies: " + ex.getOriginalMessage(), ex);
        }
    }

}
