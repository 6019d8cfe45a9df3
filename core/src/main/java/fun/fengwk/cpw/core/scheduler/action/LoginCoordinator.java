package fun.fengwk.cpw.core.scheduler.action;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.scheduler.execution.ExecutionRouter;
import fun.fengwk.cpw.core.scheduler.execution.ScrapeExecutor;
import fun.fengwk.cpw.core.service.login.LoginCancelledException;
import fun.fengwk.cpw.core.service.login.model.LoginResult;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts interactive logins on the account's execution surface and keeps the latest screenshot for
 * the operator. A successful login stores the new credential and puts the account back into rotation.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class LoginCoordinator {

    private static final String CANCELLED_MESSAGE = "Login cancelled";

    private final AccountStore accountStore;
    private final ExecutionRouter executionRouter;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final Clock clock;
    private final Map<String, LoginRun> runs = new ConcurrentHashMap<>();

    @Autowired
    public LoginCoordinator(AccountStore accountStore, ExecutionRouter executionRouter) {
        this(accountStore, executionRouter, Executors.newCachedThreadPool(daemon()), Clock.systemUTC());
    }

    LoginCoordinator(AccountStore accountStore, ExecutionRouter executionRouter, Executor executor, Clock clock) {
        this.accountStore = accountStore;
        this.executionRouter = executionRouter;
        this.executor = executor;
        this.ownedExecutor = executor instanceof ExecutorService service ? service : null;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException when the account is unknown
     * @throws IllegalStateException when a login already runs for the account
     */
    public LoginView start(String accountId) {
        AccountRecord account = accountStore.findAccount(accountId)
            .orElseThrow(() -> new IllegalArgumentException("account not found: " + accountId));
        ScrapeExecutor scrapeExecutor = executionRouter.route(account);
        LoginRun run = new LoginRun(accountId, scrapeExecutor, clock.millis());
        LoginRun previous = runs.compute(accountId, (id, existing) ->
            existing != null && existing.state == ActionState.RUNNING ? existing : run);
        if (previous != run) {
            throw new IllegalStateException("login already running for account " + accountId);
        }
        log.info("login started, accountId={}, executor={}", accountId, scrapeExecutor.describe());
        try {
            executor.execute(() -> runLogin(account, run));
        } catch (RejectedExecutionException ex) {
            run.finish(ActionState.FAILED, "coordinator shutting down", clock.millis());
            throw new IllegalStateException("coordinator shutting down", ex);
        }
        return run.view();
    }

    /**
     * @return whether a running login was asked to stop
     */
    public boolean cancel(String accountId) {
        LoginRun run = runs.get(accountId);
        if (run == null || run.state != ActionState.RUNNING) {
            return false;
        }
        boolean cancelled = run.scrapeExecutor.cancelLogin(accountId);
        log.info("login cancel requested, accountId={}, cancelled={}", accountId, cancelled);
        return cancelled;
    }

    public Optional<LoginView> find(String accountId) {
        LoginRun run = runs.get(accountId);
        return run == null ? Optional.empty() : Optional.of(run.view());
    }

    public boolean isLoginRunning(String accountId) {
        LoginRun run = runs.get(accountId);
        return run != null && run.state == ActionState.RUNNING;
    }

    @PreDestroy
    public void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private void runLogin(AccountRecord account, LoginRun run) {
        try {
            LoginResult result = run.scrapeExecutor.login(account, run::screenshot);
            if (!StringUtils.hasText(result.cookies())) {
                throw new IllegalStateException("login returned no cookies");
            }
            accountStore.reportLoggedIn(account.getId(), result.cookies());
            run.finish(ActionState.SUCCEEDED, null, clock.millis());
            log.info("login finished, credential stored, accountId={}", account.getId());
        } catch (RuntimeException ex) {
            boolean cancelled = ex instanceof LoginCancelledException || CANCELLED_MESSAGE.equals(ex.getMessage());
            String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            run.finish(cancelled ? ActionState.CANCELLED : ActionState.FAILED, error, clock.millis());
            log.warn("login ended without credential, accountId={}, cancelled={}, error={}", account.getId(), cancelled, error);
        }
    }

    private static ThreadFactory daemon() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "cpw-login-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static class LoginRun {

        private final String accountId;
        private final ScrapeExecutor scrapeExecutor;
        private final long startedAt;
        private volatile ActionState state = ActionState.RUNNING;
        private volatile String screenshot;
        private final AtomicInteger screenshots = new AtomicInteger();
        private volatile String error;
        private volatile Long finishedAt;

        LoginRun(String accountId, ScrapeExecutor scrapeExecutor, long startedAt) {
            this.accountId = accountId;
            this.scrapeExecutor = scrapeExecutor;
            this.startedAt = startedAt;
        }

        void screenshot(String image) {
            screenshot = image;
            screenshots.incrementAndGet();
        }

        void finish(ActionState finalState, String finalError, long at) {
            error = finalError;
            finishedAt = at;
            state = finalState;
        }

        LoginView view() {
            return new LoginView(accountId, scrapeExecutor.describe(), state, screenshot, screenshots.get(), error, startedAt, finishedAt);
        }

    }

}
