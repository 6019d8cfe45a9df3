package fun.fengwk.cpw.core.service.login;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation handle of one login attempt. The login loop checks it at every poll and waits on it
 * between polls, so a cancel takes effect without waiting out the poll interval.
 *
 * @author fengwk
 */
public class LoginCancelToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new LoginCancelledException();
        }
    }

    /**
     * @return true when cancelled before the wait elapsed
     */
    public boolean await(long millis) throws InterruptedException {
        return cancelled.await(Math.max(0, millis), TimeUnit.MILLISECONDS);
    }

}
