package fun.fengwk.cpw.core.service.browser.session;

import fun.fengwk.cpw.core.service.scrape.SessionInvalidException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class AccountSessionManagerTest {

    @Mock
    private AccountSessionFactory sessionFactory;

    private AccountSessionManager sessionManager;

    @BeforeEach
    public void setUp() {
        sessionManager = new AccountSessionManager(sessionFactory);
    }

    @Test
    public void shouldReuseHealthySessionWithSameCredential() {
        String fingerprint = CredentialCookies.fingerprint("cred");
        AccountBrowserSession session = mock(AccountBrowserSession.class);
        when(session.getCredentialFingerprint()).thenReturn(fingerprint);
        when(session.isHealthy()).thenReturn(true);
        when(sessionFactory.create("a1", "cred", fingerprint)).thenReturn(session);

        AccountBrowserSession first = sessionManager.getOrCreate("a1", "cred");
        AccountBrowserSession second = sessionManager.getOrCreate("a1", "cred");

        assertThat(second).isSameAs(first);
        verify(sessionFactory, times(1)).create(anyString(), anyString(), anyString());
        verify(session).touch();
    }

    @Test
    public void shouldRebuildSessionWhenCredentialChanges() {
        AccountBrowserSession oldSession = mock(AccountBrowserSession.class);
        AccountBrowserSession newSession = mock(AccountBrowserSession.class);
        when(oldSession.getCredentialFingerprint()).thenReturn(CredentialCookies.fingerprint("old"));
        when(sessionFactory.create(eq("a1"), eq("old"), anyString())).thenReturn(oldSession);
        when(sessionFactory.create(eq("a1"), eq("new"), anyString())).thenReturn(newSession);

        sessionManager.getOrCreate("a1", "old");
        AccountBrowserSession rebuilt = sessionManager.getOrCreate("a1", "new");

        assertThat(rebuilt).isSameAs(newSession);
        verify(oldSession).close();
    }

    @Test
    public void shouldRetryOnceAfterFatalSessionError() {
        AccountBrowserSession dead = mock(AccountBrowserSession.class);
        AccountBrowserSession fresh = mock(AccountBrowserSession.class);
        when(sessionFactory.create(eq("a1"), eq("cred"), anyString())).thenReturn(dead, fresh);
        AtomicInteger calls = new AtomicInteger();

        String result = sessionManager.execute("a1", "cred", session -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("Target closed");
            }
            return session == fresh ? "ok" : "wrong session";
        });

        assertThat(result).isEqualTo("ok");
        verify(dead).close();
    }

    @Test
    public void shouldFailAsSessionInvalidWhenRebuildAlsoDies() {
        AccountBrowserSession dead = mock(AccountBrowserSession.class);
        when(sessionFactory.create(eq("a1"), eq("cred"), anyString())).thenReturn(dead);

        assertThatThrownBy(() -> sessionManager.execute("a1", "cred", session -> {
            throw new IllegalStateException("page crashed");
        })).isInstanceOf(SessionInvalidException.class)
            .hasMessageContaining("page crashed");
        assertThat(sessionManager.hasSession("a1")).isFalse();
    }

    @Test
    public void shouldPropagateOrdinaryTaskErrorsWithoutRebuild() {
        AccountBrowserSession session = mock(AccountBrowserSession.class);
        when(sessionFactory.create(eq("a1"), eq("cred"), anyString())).thenReturn(session);

        assertThatThrownBy(() -> sessionManager.execute("a1", "cred", s -> {
            throw new IllegalArgumentException("bad selector");
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(sessionManager.hasSession("a1")).isTrue();
    }

    @Test
    public void shouldDisposeAllSessions() {
        AccountBrowserSession session = mock(AccountBrowserSession.class);
        when(sessionFactory.create(eq("a1"), eq("cred"), anyString())).thenReturn(session);
        sessionManager.getOrCreate("a1", "cred");

        sessionManager.disposeAll();

        verify(session).close();
        assertThat(sessionManager.listSessionSummaries()).isEmpty();
    }

    @Test
    public void shouldRunTasksOfOneAccountOneAtATime() throws Exception {
        String fingerprint = CredentialCookies.fingerprint("cred");
        AccountBrowserSession session = mock(AccountBrowserSession.class);
        when(session.getCredentialFingerprint()).thenReturn(fingerprint);
        when(session.isHealthy()).thenReturn(true);
        when(sessionFactory.create("a1", "cred", fingerprint)).thenReturn(session);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<String> first = CompletableFuture.supplyAsync(() -> sessionManager.execute("a1", "cred", s -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "first";
        }));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<String> second = CompletableFuture.supplyAsync(() -> sessionManager.execute("a1", "cred", s -> "second"));

        Thread.sleep(200);
        assertThat(second).isNotDone();
        release.countDown();

        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("second");
    }

    @Test
    public void shouldRunOnCurrentSessionWithoutHealthCheck() {
        AccountBrowserSession session = mock(AccountBrowserSession.class);
        when(sessionFactory.create(eq("a1"), eq(""), anyString())).thenReturn(session);
        sessionManager.getOrCreate("a1", "");

        String result = sessionManager.executeOnCurrent("a1", s -> s == session ? "current" : "other");

        assertThat(result).isEqualTo("current");
        verify(session, never()).isHealthy();
    }

    @Test
    public void shouldRejectCurrentSessionTaskWithoutSession() {
        assertThatThrownBy(() -> sessionManager.executeOnCurrent("a1", s -> "never"))
            .isInstanceOf(SessionInvalidException.class)
            .hasMessage("no open session for account a1");
    }

}
