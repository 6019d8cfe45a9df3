package fun.fengwk.cpw.core.scheduler;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.facade.account.model.AccountStatus;
import fun.fengwk.cpw.core.facade.alert.OperatorAlertSink;
import fun.fengwk.cpw.core.facade.result.ScrapeOutcome;
import fun.fengwk.cpw.core.facade.result.ScrapeResultSink;
import fun.fengwk.cpw.core.scheduler.execution.ExecutionRouter;
import fun.fengwk.cpw.core.scheduler.execution.ScrapeExecutor;
import fun.fengwk.cpw.core.scheduler.queue.JobContext;
import fun.fengwk.cpw.core.scheduler.queue.NonRetryableJobException;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.cart.model.CartLineItem;
import fun.fengwk.cpw.core.service.scrape.NeedsCaptchaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class CartScrapeJobHandlerTest {

    @Mock
    private AccountStore accountStore;

    @Mock
    private ExecutionRouter executionRouter;

    @Mock
    private ScrapeResultSink scrapeResultSink;

    @Mock
    private OperatorAlertSink operatorAlertSink;

    @Mock
    private ScrapeExecutor executor;

    private SchedulerProperties schedulerProperties;
    private RiskBackoff riskBackoff;
    private CartScrapeJobHandler handler;
    private AccountRecord account;
    private List<String> jobLog;

    @BeforeEach
    public void setUp() {
        schedulerProperties = new SchedulerProperties();
        schedulerProperties.setExtraPassDelayMs(0);
        ZoneId zone = ZoneId.of(schedulerProperties.getZoneId());
        Clock clock = Clock.fixed(LocalDateTime.of(2024, 5, 1, 3, 0).atZone(zone).toInstant(), zone);
        riskBackoff = new RiskBackoff(schedulerProperties, clock);
        AccountOutcomeRecorder outcomeRecorder = new AccountOutcomeRecorder(
            accountStore, operatorAlertSink, riskBackoff, schedulerProperties);
        handler = new CartScrapeJobHandler(
            accountStore, executionRouter, scrapeResultSink, outcomeRecorder, schedulerProperties, clock);
        account = AccountRecord.builder()
            .id("acc1")
            .name("main")
            .credential("[]")
            .expectedListingIds(new LinkedHashSet<>(List.of("1001", "1002")))
            .build();
        jobLog = new ArrayList<>();
    }

    @Test
    public void shouldScrapeAndReportSuccess() throws Exception {
        givenRoutedAccount();
        CartCollectResult result = resultWith("1001", "1002");
        when(executor.scrapeCart(account, account.getExpectedListingIds())).thenReturn(result);
        when(scrapeResultSink.acceptCart(account, result)).thenReturn(new ScrapeOutcome(2, 0, 0));

        ScrapeOutcome outcome = handler.handle(context(false));

        assertThat(outcome).isEqualTo(new ScrapeOutcome(2, 0, 0));
        verify(executor, times(1)).scrapeCart(any(), any());
        verify(executor).requestPause("acc1", schedulerProperties.getPauseTimeoutMs());
        verify(executor).resume("acc1");
        verify(accountStore).reportSuccess("acc1");
        assertThat(jobLog).contains("executor=local", "updated=2 missing=0 failed=0");
    }

    @Test
    public void shouldRunExtraPassesAndKeepBestResult() throws Exception {
        CartCollectResult partial = resultWith("1001");
        CartCollectResult full = resultWith("1001", "1002");
        when(executor.scrapeCart(account, account.getExpectedListingIds()))
            .thenReturn(partial)
            .thenThrow(new IllegalStateException("page reload failed"))
            .thenReturn(full);

        CartCollectResult best = handler.collect(context(false), executor, account);

        assertThat(best).isSameAs(full);
        verify(executor, times(3)).scrapeCart(any(), any());
        assertThat(jobLog).contains("pass 2 failed: page reload failed");
    }

    @Test
    public void shouldKeepBestPartialResultWhenPassesRunOut() throws Exception {
        CartCollectResult partial = resultWith("1001");
        when(executor.scrapeCart(account, account.getExpectedListingIds())).thenReturn(partial, resultWith());

        schedulerProperties.setExtraPasses(1);
        CartCollectResult best = handler.collect(context(false), executor, account);

        assertThat(best).isSameAs(partial);
    }

    @Test
    public void shouldRecordFailureWhenEveryPassFails() {
        givenRoutedAccount();
        when(executor.scrapeCart(account, account.getExpectedListingIds())).thenThrow(new IllegalStateException("network"));
        when(accountStore.reportFailure("acc1", "network")).thenReturn(1);

        assertThatThrownBy(() -> handler.handle(context(false)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("network");
        verify(executor, times(3)).scrapeCart(any(), any());
        verify(accountStore, never()).reportCooldown(anyString());
        verify(executor).resume("acc1");
    }

    @Test
    public void shouldCoolDownAccountAtFailureThreshold() {
        givenRoutedAccount();
        when(executor.scrapeCart(account, account.getExpectedListingIds())).thenThrow(new IllegalStateException("network"));
        when(accountStore.reportFailure("acc1", "network")).thenReturn(schedulerProperties.getCooldownThreshold());

        assertThatThrownBy(() -> handler.handle(context(false))).isInstanceOf(IllegalStateException.class);

        verify(accountStore).reportCooldown("acc1");
    }

    @Test
    public void shouldDisableChallengedAccountWithoutRetry() {
        givenRoutedAccount();
        when(executor.scrapeCart(account, account.getExpectedListingIds())).thenThrow(new NeedsCaptchaException("slider"));

        assertThatThrownBy(() -> handler.handle(context(false)))
            .isInstanceOf(NonRetryableJobException.class)
            .hasMessage("NEEDS_CAPTCHA: slider");

        verify(executor, times(1)).scrapeCart(any(), any());
        verify(executor).resume("acc1");
        verify(accountStore).reportChallenged("acc1", AccountStatus.CAPTCHA, "slider");
        verify(operatorAlertSink).alert(eq("account needs captcha, disabled"), anyString());
        assertThat(riskBackoff.isPaused()).isTrue();
    }

    @Test
    public void shouldFailWithoutRetryWhenAccountIsGone() {
        when(accountStore.findActiveAccount("acc1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> handler.handle(context(false)))
            .isInstanceOf(NonRetryableJobException.class);
        verifyNoInteractions(executionRouter);
    }

    @Test
    public void shouldSkipDuringQuietHoursUnlessForced() throws Exception {
        schedulerProperties.setQuietHoursStart("01:00");
        schedulerProperties.setQuietHoursEnd("06:00");

        ScrapeOutcome skipped = handler.handle(context(false));

        assertThat(skipped).isEqualTo(new ScrapeOutcome(0, 0, 0));
        verifyNoInteractions(accountStore, executionRouter);

        givenRoutedAccount();
        CartCollectResult result = resultWith("1001", "1002");
        when(executor.scrapeCart(account, account.getExpectedListingIds())).thenReturn(result);
        when(scrapeResultSink.acceptCart(account, result)).thenReturn(new ScrapeOutcome(2, 0, 0));

        assertThat(handler.handle(context(true))).isEqualTo(new ScrapeOutcome(2, 0, 0));
    }

    private void givenRoutedAccount() {
        when(accountStore.findActiveAccount("acc1")).thenReturn(Optional.of(account));
        when(executionRouter.route(account)).thenReturn(executor);
        when(executor.describe()).thenReturn("local");
    }

    private JobContext context(boolean force) {
        return new JobContext("job1", ScrapeJobs.CART_SCRAPE,
            Map.of(ScrapeJobs.ACCOUNT_ID, "acc1", ScrapeJobs.FORCE, force), 1, jobLog::add);
    }

    private CartCollectResult resultWith(String... listingIds) {
        List<CartLineItem> items = new ArrayList<>();
        Arrays.stream(listingIds).forEach(id -> items.add(CartLineItem.builder().listingId(id).skuId("s" + id).build()));
        return CartCollectResult.builder().items(items).build();
    }

}
