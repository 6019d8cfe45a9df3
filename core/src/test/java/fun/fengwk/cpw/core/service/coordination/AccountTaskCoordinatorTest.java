package fun.fengwk.cpw.core.service.coordination;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class AccountTaskCoordinatorTest {

    private final AccountTaskCoordinator coordinator = new AccountTaskCoordinator();

    @Test
    public void shouldNotPauseWhenNoBulkOperationRuns() {
        assertThat(coordinator.requestPause("a1", 100)).isFalse();
        assertThat(coordinator.resume("a1")).isFalse();
    }

    @Test
    public void shouldPauseAtSafePointAndResume() throws Exception {
        coordinator.markBulkStart("a1");
        CountDownLatch resumed = new CountDownLatch(1);
        AtomicBoolean stop = new AtomicBoolean();
        Thread bulk = new Thread(() -> {
            try {
                while (!stop.get()) {
                    coordinator.checkpoint("a1");
                    if (!coordinator.isPauseRequested("a1") && resumed.getCount() == 0) {
                        stop.set(true);
                    }
                    Thread.sleep(5);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        });
        bulk.setDaemon(true);
        bulk.start();

        boolean paused = coordinator.requestPause("a1", 5000);
        assertThat(paused).isTrue();
        assertThat(coordinator.requestPause("a1", 10)).isTrue();

        resumed.countDown();
        assertThat(coordinator.resume("a1")).isTrue();
        bulk.join(5000);
        assertThat(bulk.isAlive()).isFalse();
        coordinator.markBulkEnd("a1");
        assertThat(coordinator.isBulkInProgress("a1")).isFalse();
    }

    @Test
    public void shouldGiveUpPauseWhenSafePointIsNotReached() {
        coordinator.markBulkStart("a1");

        boolean paused = coordinator.requestPause("a1", 50);

        assertThat(paused).isFalse();
        assertThat(coordinator.isPauseRequested("a1")).isFalse();
    }

    @Test
    public void shouldReleasePauseRequesterWhenBulkEnds() throws Exception {
        coordinator.markBulkStart("a1");
        CompletableFuture<Boolean> pause = CompletableFuture.supplyAsync(() -> coordinator.requestPause("a1", 5000));
        while (!coordinator.isPauseRequested("a1")) {
            Thread.sleep(5);
        }

        coordinator.markBulkEnd("a1");

        assertThat(pause.get(5, TimeUnit.SECONDS)).isFalse();
    }

    @Test
    public void shouldReturnAtOnceFromWaitWithoutPauseRequest() throws Exception {
        coordinator.markBulkStart("a1");

        coordinator.waitUntilResumed("a1");
        coordinator.checkpoint("a1");

        assertThat(coordinator.isBulkInProgress("a1")).isTrue();
    }

}
