package fun.fengwk.cpw.core.scheduler.action;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.facade.account.model.AccountStatus;
import fun.fengwk.cpw.core.hub.MutableClock;
import fun.fengwk.cpw.core.hub.exception.RemoteCallException;
import fun.fengwk.cpw.core.scheduler.execution.ExecutionRouter;
import fun.fengwk.cpw.core.scheduler.execution.ScrapeExecutor;
import fun.fengwk.cpw.core.service.login.LoginException;
import fun.fengwk.cpw.core.service.login.LoginListener;
import fun.fengwk.cpw.core.service.login.model.LoginResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class LoginCoordinatorTest {

    @Mock
    private AccountStore accountStore;

    @Mock
    private ExecutionRouter executionRouter;

    @Mock
    private ScrapeExecutor scrapeExecutor;

    private final List<Runnable> tasks = new ArrayList<>();
    private MutableClock clock;
    private LoginCoordinator coordinator;
    private AccountRecord account;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(1000L);
        coordinator = new LoginCoordinator(accountStore, executionRouter, tasks::add, clock);
        account = AccountRecord.builder().id("acc1").active(false).status(AccountStatus.LOCKED).build();
    }

    @Test
    public void shouldStoreCredentialOfChallengedAccount() {
        when(accountStore.findAccount("acc1")).thenReturn(Optional.of(account));
        when(executionRouter.route(account)).thenReturn(scrapeExecutor);
        when(scrapeExecutor.describe()).thenReturn("agent:a1");
        when(scrapeExecutor.login(any(AccountRecord.class), any(LoginListener.class))).thenAnswer(invocation -> {
            LoginListener listener = invocation.getArgument(1);
            listener.onScreenshot("first");
            listener.onScreenshot("second");
            return new LoginResult("[{\"name\":\"munb\"}]");
        });

        LoginView started = coordinator.start("acc1");
        assertThat(started.state()).isEqualTo(ActionState.RUNNING);
        assertThat(coordinator.isLoginRunning("acc1")).isTrue();
        clock.advance(500);
        runTasks();

        LoginView finished = coordinator.find("acc1").orElseThrow();
        assertThat(finished.state()).isEqualTo(ActionState.SUCCEEDED);
        assertThat(finished.screenshot()).isEqualTo("second");
        assertThat(finished.screenshots()).isEqualTo(2);
        assertThat(finished.executor()).isEqualTo("agent:a1");
        assertThat(finished.finishedAt()).isEqualTo(1500L);
        verify(accountStore).reportLoggedIn("acc1", "[{\"name\":\"munb\"}]");
    }

    @Test
    public void shouldRejectSecondLoginWhileRunning() {
        when(accountStore.findAccount("acc1")).thenReturn(Optional.of(account));
        when(executionRouter.route(account)).thenReturn(scrapeExecutor);
        when(scrapeExecutor.describe()).thenReturn("local");

        coordinator.start("acc1");

        assertThatThrownBy(() -> coordinator.start("acc1"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("login already running for account acc1");
        assertThat(tasks).hasSize(1);
    }

    @Test
    public void shouldRejectUnknownAccount() {
        when(accountStore.findAccount("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> coordinator.start("ghost"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldCancelRunningLoginOnItsExecutor() {
        when(accountStore.findAccount("acc1")).thenReturn(Optional.of(account));
        when(executionRouter.route(account)).thenReturn(scrapeExecutor);
        when(scrapeExecutor.describe()).thenReturn("agent:a1");
        when(scrapeExecutor.cancelLogin("acc1")).thenReturn(true);
        when(scrapeExecutor.login(any(AccountRecord.class), any(LoginListener.class)))
            .thenThrow(new RemoteCallException("Login cancelled"));

        coordinator.start("acc1");
        assertThat(coordinator.cancel("acc1")).isTrue();
        runTasks();

        assertThat(coordinator.find("acc1").orElseThrow().state()).isEqualTo(ActionState.CANCELLED);
        assertThat(coordinator.cancel("acc1")).isFalse();
        verify(accountStore, never()).reportLoggedIn(anyString(), anyString());
    }

    @Test
    public void shouldRecordFailedLogin() {
        when(accountStore.findAccount("acc1")).thenReturn(Optional.of(account));
        when(executionRouter.route(account)).thenReturn(scrapeExecutor);
        when(scrapeExecutor.describe()).thenReturn("local");
        when(scrapeExecutor.login(any(AccountRecord.class), any(LoginListener.class)))
            .thenThrow(new LoginException("Login timeout"));

        coordinator.start("acc1");
        runTasks();

        LoginView view = coordinator.find("acc1").orElseThrow();
        assertThat(view.state()).isEqualTo(ActionState.FAILED);
        assertThat(view.error()).isEqualTo("Login timeout");
        assertThat(coordinator.isLoginRunning("acc1")).isFalse();
    }

    private void runTasks() {
        List<Runnable> pending = new ArrayList<>(tasks);
        tasks.clear();
        pending.forEach(Runnable::run);
    }

}
