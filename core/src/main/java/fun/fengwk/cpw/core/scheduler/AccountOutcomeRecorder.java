package fun.fengwk.cpw.core.scheduler;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.facade.account.model.AccountStatus;
import fun.fengwk.cpw.core.facade.alert.OperatorAlertSink;
import fun.fengwk.cpw.core.scheduler.queue.NonRetryableJobException;
import fun.fengwk.cpw.core.service.scrape.NeedsCaptchaException;
import fun.fengwk.cpw.core.service.scrape.NeedsLoginException;
import fun.fengwk.cpw.core.service.scrape.ScrapeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reports job outcomes to the account store, the risk back-off and the operator.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountOutcomeRecorder {

    private final AccountStore accountStore;
    private final OperatorAlertSink operatorAlertSink;
    private final RiskBackoff riskBackoff;
    private final SchedulerProperties schedulerProperties;

    public void recordSuccess(AccountRecord account) {
        accountStore.reportSuccess(account.getId());
        riskBackoff.recordSuccess();
    }

    /**
     * Disable the challenged account, escalate the risk pause and alert.
     *
     * @return the exception that fails the job without retry
     */
    public NonRetryableJobException recordChallenged(AccountRecord account, ScrapeException ex) {
        AccountStatus status = ex instanceof NeedsLoginException ? AccountStatus.LOCKED : AccountStatus.CAPTCHA;
        String title = ex instanceof NeedsLoginException
            ? "account needs re-login, disabled"
            : "account needs captcha, disabled";
        accountStore.reportChallenged(account.getId(), status, ex.getMessage());
        long pauseMs = riskBackoff.recordRiskSignal();
        operatorAlertSink.alert(title, String.join("\n",
            "account=" + account.getName() + "(" + account.getId() + ")",
            "error=" + ex.getMessage(),
            "pauseMs=" + pauseMs));
        log.warn("account challenged, accountId={}, status={}, pauseMs={}", account.getId(), status, pauseMs);
        return new NonRetryableJobException(ex.getCode() + ": " + ex.getMessage(), ex);
    }

    /**
     * Count a failure against the account, cooling it down once the threshold is reached.
     */
    public void recordFailure(AccountRecord account, Exception ex) {
        String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        int errorCount = accountStore.reportFailure(account.getId(), error);
        if (errorCount >= schedulerProperties.getCooldownThreshold()) {
            accountStore.reportCooldown(account.getId());
            log.warn("account cooled down, accountId={}, errorCount={}", account.getId(), errorCount);
        }
    }

    public static boolean isChallenge(Throwable ex) {
        return ex instanceof NeedsCaptchaException || ex instanceof NeedsLoginException;
    }

}
