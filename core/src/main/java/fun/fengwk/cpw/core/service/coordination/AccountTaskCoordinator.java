package fun.fengwk.cpw.core.service.coordination;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Rendezvous between a long bulk operation and a short operation that needs the same account session.
 *
 * <p>The short side calls {@link #requestPause} and gets {@code true} once the bulk side reached a
 * safe point and called {@link #notifyPausedAtSafePoint}. After its work it calls {@link #resume},
 * which releases the bulk side blocked in {@link #waitUntilResumed}. Pausing is best-effort: when the
 * bulk side does not reach a safe point in time the short side proceeds without exclusivity.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AccountTaskCoordinator {

    private final Map<String, Control> controls = new ConcurrentHashMap<>();

    public void markBulkStart(String accountId) {
        Control control = controls.computeIfAbsent(accountId, key -> new Control());
        synchronized (control) {
            control.bulkInProgress = true;
            control.pauseRequested = false;
            control.paused = false;
        }
    }

    public void markBulkEnd(String accountId) {
        Control control = controls.remove(accountId);
        if (control == null) {
            return;
        }
        synchronized (control) {
            control.bulkInProgress = false;
            control.pauseRequested = false;
            control.paused = false;
            // Nobody will reach a safe point any more.
            if (control.pauseSignal != null) {
                control.pauseSignal.complete(false);
                control.pauseSignal = null;
                control.pauseWaiters = 0;
            }
            if (control.resumeSignal != null) {
                control.resumeSignal.complete(null);
                control.resumeSignal = null;
            }
        }
    }

    public boolean isBulkInProgress(String accountId) {
        Control control = controls.get(accountId);
        if (control == null) {
            return false;
        }
        synchronized (control) {
            return control.bulkInProgress;
        }
    }

    public boolean isPauseRequested(String accountId) {
        Control control = controls.get(accountId);
        if (control == null) {
            return false;
        }
        synchronized (control) {
            return control.pauseRequested && !control.paused;
        }
    }

    /**
     * Ask the running bulk operation to pause at its next safe point.
     *
     * @return true when the bulk operation is paused, false when none is running or it did not
     * reach a safe point within the timeout
     */
    public boolean requestPause(String accountId, long timeoutMs) {
        Control control = controls.get(accountId);
        if (control == null) {
            return false;
        }
        CompletableFuture<Boolean> signal;
        synchronized (control) {
            if (!control.bulkInProgress) {
                return false;
            }
            if (control.paused) {
                return true;
            }
            control.pauseRequested = true;
            if (control.pauseSignal == null) {
                control.pauseSignal = new CompletableFuture<>();
            }
            control.pauseWaiters++;
            signal = control.pauseSignal;
        }

        try {
            return Boolean.TRUE.equals(signal.get(Math.max(0, timeoutMs), TimeUnit.MILLISECONDS));
        } catch (TimeoutException ex) {
            log.info("pause request timed out, accountId={}, timeoutMs={}", accountId, timeoutMs);
            abandonPauseWait(control, signal);
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abandonPauseWait(control, signal);
            return false;
        } catch (ExecutionException ex) {
            throw new IllegalStateException("pause signal failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Called by the bulk operation between atomic steps. Releases pause requesters if one is pending.
     */
    public void notifyPausedAtSafePoint(String accountId) {
        Control control = controls.get(accountId);
        if (control == null) {
            return;
        }
        synchronized (control) {
            if (!control.bulkInProgress || !control.pauseRequested || control.paused) {
                return;
            }
            control.paused = true;
            if (control.resumeSignal == null) {
                control.resumeSignal = new CompletableFuture<>();
            }
            if (control.pauseSignal != null) {
                control.pauseSignal.complete(true);
                control.pauseSignal = null;
                control.pauseWaiters = 0;
            }
        }
        log.info("bulk operation paused at safe point, accountId={}", accountId);
    }

    /**
     * @return whether a pause had been requested or was active
     */
    public boolean resume(String accountId) {
        Control control = controls.get(accountId);
        if (control == null) {
            return false;
        }
        synchronized (control) {
            boolean wasPaused = control.pauseRequested || control.paused;
            control.pauseRequested = false;
            control.paused = false;
            if (control.resumeSignal != null) {
                control.resumeSignal.complete(null);
                control.resumeSignal = null;
            }
            return wasPaused;
        }
    }

    /**
     * Block the bulk operation until the short operation resumed it. Returns at once when no pause was requested.
     */
    public void waitUntilResumed(String accountId) throws InterruptedException {
        Control control = controls.get(accountId);
        if (control == null) {
            return;
        }
        CompletableFuture<Void> signal;
        synchronized (control) {
            if (!control.pauseRequested && !control.paused) {
                return;
            }
            if (control.resumeSignal == null) {
                control.resumeSignal = new CompletableFuture<>();
            }
            signal = control.resumeSignal;
        }
        try {
            signal.get();
        } catch (ExecutionException ex) {
            throw new IllegalStateException("resume signal failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Safe point for bulk loops: pause here if asked to, then wait for resume.
     *
     * @return whether the bulk operation paused, the page may have been used by someone else meanwhile
     */
    public boolean checkpoint(String accountId) throws InterruptedException {
        if (!isPauseRequested(accountId)) {
            return false;
        }
        notifyPausedAtSafePoint(accountId);
        waitUntilResumed(accountId);
        return true;
    }

    private void abandonPauseWait(Control control, CompletableFuture<Boolean> signal) {
        synchronized (control) {
            if (control.pauseSignal != signal) {
                return;
            }
            control.pauseWaiters = Math.max(0, control.pauseWaiters - 1);
            if (control.pauseWaiters == 0 && !control.paused) {
                control.pauseRequested = false;
                control.pauseSignal = null;
            }
        }
    }

    private static class Control {

        private boolean bulkInProgress;
        private boolean pauseRequested;
        private boolean paused;
        private int pauseWaiters;
        private CompletableFuture<Boolean> pauseSignal;
        private CompletableFuture<Void> resumeSignal;

    }

}
