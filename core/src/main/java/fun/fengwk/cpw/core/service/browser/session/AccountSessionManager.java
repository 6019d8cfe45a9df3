package fun.fengwk.cpw.core.service.browser.session;

import fun.fengwk.cpw.core.service.scrape.SessionInvalidException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns at most one live browser session per account.
 *
 * <p>All create and teardown decisions are serialized behind one process-wide lock, so two
 * callers can never build two sessions for the same account. A session is rebuilt when its
 * page stops answering or the credential material changed since it was built.
 *
 * <p>Work on an account page additionally holds a per-account lock, so steps of different
 * operations on the same account never interleave on the page.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AccountSessionManager {

    private final AccountSessionFactory sessionFactory;
    private final Map<String, AccountBrowserSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public AccountSessionManager(AccountSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    public AccountBrowserSession getOrCreate(String accountId, String credential) {
        String fingerprint = CredentialCookies.fingerprint(credential);
        lock.lock();
        try {
            AccountBrowserSession existing = sessions.get(accountId);
            if (existing != null) {
                boolean sameCredential = fingerprint.equals(existing.getCredentialFingerprint());
                if (sameCredential && existing.isHealthy()) {
                    existing.touch();
                    return existing;
                }
                log.info(
                    "rebuild account session, accountId={}, reason={}",
                    accountId,
                    sameCredential ? "unhealthy" : "credential changed"
                );
                sessions.remove(accountId);
                existing.close();
            }
            AccountBrowserSession created = sessionFactory.create(accountId, credential, fingerprint);
            sessions.put(accountId, created);
            return created;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a task against the account session, rebuilding the session and retrying once when the
     * failure shows the page or browser died underneath the task.
     */
    public <T> T execute(String accountId, String credential, SessionTask<T> task) {
        ReentrantLock accountLock = accountLock(accountId);
        accountLock.lock();
        try {
            Exception lastError = null;
            for (int attempt = 1; attempt <= 2; attempt++) {
                AccountBrowserSession session = getOrCreate(accountId, credential);
                try {
                    return task.execute(session);
                } catch (RuntimeException ex) {
                    if (!isFatalSessionError(ex)) {
                        throw ex;
                    }
                    lastError = ex;
                } catch (Exception ex) {
                    if (!isFatalSessionError(ex)) {
                        throw new IllegalStateException("session task failed: " + ex.getMessage(), ex);
                    }
                    lastError = ex;
                }
                log.warn("session died during task, accountId={}, attempt={}, error={}", accountId, attempt, lastError.getMessage());
                dispose(accountId);
            }
            throw new SessionInvalidException(
                "session unusable after rebuild: " + lastError.getMessage(), lastError);
        } finally {
            accountLock.unlock();
        }
    }

    /**
     * Run a task against the current account session as it is, without health check, rebuild or retry.
     *
     * @throws SessionInvalidException when the account has no open session
     */
    public <T> T executeOnCurrent(String accountId, SessionTask<T> task) {
        ReentrantLock accountLock = accountLock(accountId);
        accountLock.lock();
        try {
            AccountBrowserSession session = sessions.get(accountId);
            if (session == null || session.isClosed()) {
                throw new SessionInvalidException("no open session for account " + accountId);
            }
            session.touch();
            return task.execute(session);
        } catch (RuntimeException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("session task failed: " + ex.getMessage(), ex);
        } finally {
            accountLock.unlock();
        }
    }

    public void dispose(String accountId) {
        lock.lock();
        try {
            AccountBrowserSession session = sessions.remove(accountId);
            if (session != null) {
                session.close();
                log.info("disposed account session, accountId={}", accountId);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean hasSession(String accountId) {
        return sessions.containsKey(accountId);
    }

    public Optional<AccountBrowserSession> getSession(String accountId) {
        return Optional.ofNullable(sessions.get(accountId));
    }

    public List<SessionSummary> listSessionSummaries() {
        List<SessionSummary> summaries = new ArrayList<>();
        for (AccountBrowserSession session : sessions.values()) {
            summaries.add(session.summarize());
        }
        return summaries;
    }

    @PreDestroy
    public void disposeAll() {
        lock.lock();
        try {
            for (AccountBrowserSession session : List.copyOf(sessions.values())) {
                session.close();
            }
            sessions.clear();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock accountLock(String accountId) {
        return accountLocks.computeIfAbsent(accountId, key -> new ReentrantLock());
    }

    static boolean isFatalSessionError(Throwable ex) {
        String message = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        return "TargetClosedError".equals(ex.getClass().getSimpleName())
            || message.contains("target closed")
            || message.contains("has been closed")
            || message.contains("session closed")
            || message.contains("connection closed")
            || message.contains("page crashed");
    }

}
