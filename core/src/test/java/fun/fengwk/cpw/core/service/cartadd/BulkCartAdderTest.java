package fun.fengwk.cpw.core.service.cartadd;

import fun.fengwk.cpw.core.service.cartadd.model.BulkAddRequest;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;
import fun.fengwk.cpw.core.service.cartadd.model.SkuAddResult;
import fun.fengwk.cpw.core.service.coordination.AccountTaskCoordinator;
import fun.fengwk.cpw.core.service.scrape.NeedsCaptchaException;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class BulkCartAdderTest {

    private AccountTaskCoordinator coordinator;
    private CartAddProperties cartAddProperties;
    private BulkCartAdder adder;
    private FakeCartAddPage page;

    @BeforeEach
    public void setUp() {
        coordinator = new AccountTaskCoordinator();
        cartAddProperties = new CartAddProperties();
        cartAddProperties.setSkuDelayMinMs(0);
        cartAddProperties.setSkuDelayMaxMs(0);
        cartAddProperties.setLongPauseChance(0);
        adder = new BulkCartAdder(coordinator, cartAddProperties, new Random(3));
        page = new FakeCartAddPage();
        page.variants.add(variant("s1", "颜色:红色;尺码:M"));
        page.variants.add(variant("s2", "颜色:红色;尺码:L"));
        page.variants.add(variant("s3", "颜色:蓝色;尺码:M"));
    }

    @Test
    public void shouldAddEveryVariantAndReportProgress() throws Exception {
        List<String> lines = new ArrayList<>();

        BulkAddResult result = adder.addAll("a1", page, request(Set.of()),
            (total, current, success, failed, line) -> lines.add(current + "/" + total + " " + line));

        assertThat(result.getTotalSkus()).isEqualTo(3);
        assertThat(result.getSuccessCount()).isEqualTo(3);
        assertThat(result.getFailedCount()).isZero();
        assertThat(page.added).containsExactlyInAnyOrder("s1", "s2", "s3");
        assertThat(lines).hasSize(3);
        assertThat(lines.get(2)).startsWith("3/3 added ");
        assertThat(page.pauses).hasSize(2);
        assertThat(coordinator.isBulkInProgress("a1")).isFalse();
    }

    @Test
    public void shouldSkipVariantsAlreadyInCart() throws Exception {
        BulkAddResult result = adder.addAll("a1", page, request(Set.of("尺码：M 颜色：红色")), null);

        assertThat(result.getSkippedCount()).isEqualTo(1);
        assertThat(result.getSuccessCount()).isEqualTo(2);
        assertThat(page.added).containsExactlyInAnyOrder("s2", "s3");
        assertThat(result.getResults()).filteredOn(SkuAddResult::isSkipped)
            .extracting(SkuAddResult::getSkuId).containsExactly("s1");
    }

    @Test
    public void shouldRetryAfterReopeningListing() throws Exception {
        page.failuresLeft.put("s2", 1);
        page.failuresLeft.put("s3", 5);

        BulkAddResult result = adder.addAll("a1", page, request(Set.of()), null);

        assertThat(result.getSuccessCount()).isEqualTo(2);
        assertThat(result.getFailedCount()).isEqualTo(1);
        SkuAddResult failed = result.getResults().stream().filter(r -> !r.isSuccess()).findFirst().orElseThrow();
        assertThat(failed.getSkuId()).isEqualTo("s3");
        assertThat(failed.getAttempts()).isEqualTo(2);
        assertThat(failed.getError()).isEqualTo("add-to-cart not confirmed");
        // initial open plus one reopen per failed attempt that is retried
        assertThat(page.opens).isEqualTo(3);
    }

    @Test
    public void shouldLimitVariants() throws Exception {
        BulkAddResult result = adder.addAll("a1", page,
            BulkAddRequest.builder().listingId("100").existingSkuProperties(Set.of()).maxSkus(2).build(), null);

        assertThat(result.getTotalSkus()).isEqualTo(2);
        assertThat(page.added).hasSize(2);
    }

    @Test
    public void shouldHandPageOverAtSafePointAndReopenListing() throws Exception {
        page.onFirstAdd = () -> {
            CompletableFuture<Boolean> scrape = CompletableFuture.supplyAsync(() -> {
                boolean paused = coordinator.requestPause("a1", 5000);
                page.events.add("scrape paused=" + paused);
                coordinator.resume("a1");
                return paused;
            });
            page.pendingScrape = scrape;
            long deadline = System.currentTimeMillis() + 5000;
            while (!coordinator.isPauseRequested("a1") && System.currentTimeMillis() < deadline) {
                Thread.onSpinWait();
            }
        };

        BulkAddResult result = adder.addAll("a1", page, request(Set.of()), null);

        assertThat(page.pendingScrape.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(result.getPauses()).isEqualTo(1);
        assertThat(result.getSuccessCount()).isEqualTo(3);
        assertThat(page.events.get(0)).isEqualTo("open");
        assertThat(page.events.get(1)).startsWith("add ");
        assertThat(page.events.get(2)).isEqualTo("scrape paused=true");
        assertThat(page.events.get(3)).isEqualTo("open");
        assertThat(page.events.get(4)).startsWith("add ");
    }

    @Test
    public void shouldRejectSecondBulkOperationOnSameAccount() {
        coordinator.markBulkStart("a1");

        assertThatThrownBy(() -> adder.addAll("a1", page, request(Set.of()), null))
            .isInstanceOf(IllegalStateException.class);
        assertThat(page.opens).isZero();
    }

    @Test
    public void shouldAbortOnRiskSignalAndReleaseAccount() {
        page.risk = new NeedsCaptchaException("slider challenge");

        assertThatThrownBy(() -> adder.addAll("a1", page, request(Set.of()), null))
            .isInstanceOf(NeedsCaptchaException.class);
        assertThat(page.added).isEmpty();
        assertThat(coordinator.isBulkInProgress("a1")).isFalse();
    }

    @Test
    public void shouldMatchLabelsRegardlessOfOrderAndSeparator() {
        assertThat(BulkCartAdder.matchKey("颜色:红色;尺码:M"))
            .isEqualTo(BulkCartAdder.matchKey("尺码：M  颜色：红色"))
            .isEqualTo("M;红色");
        assertThat(BulkCartAdder.matchKey("红色；M")).isEqualTo("M;红色");
        assertThat(BulkCartAdder.matchKey(null)).isEmpty();
    }

    private BulkAddRequest request(Set<String> existing) {
        return BulkAddRequest.builder().listingId("100").existingSkuProperties(existing).build();
    }

    private SkuVariant variant(String skuId, String properties) {
        return SkuVariant.builder().skuId(skuId).properties(properties).build();
    }

    private static class FakeCartAddPage implements CartAddPageDriver {

        private final List<SkuVariant> variants = new ArrayList<>();
        private final List<String> added = Collections.synchronizedList(new ArrayList<>());
        private final List<String> events = Collections.synchronizedList(new ArrayList<>());
        private final List<Long> pauses = new ArrayList<>();
        private final Map<String, Integer> failuresLeft = new HashMap<>();
        private RuntimeException risk;
        private Runnable onFirstAdd;
        private CompletableFuture<Boolean> pendingScrape;
        private int opens;

        @Override
        public void openListing(String listingId) {
            opens++;
            events.add("open");
        }

        @Override
        public List<SkuVariant> listVariants(String listingId) {
            return variants;
        }

        @Override
        public void addToCart(SkuVariant variant) {
            if (risk != null) {
                throw risk;
            }
            int failures = failuresLeft.getOrDefault(variant.getSkuId(), 0);
            if (failures > 0) {
                failuresLeft.put(variant.getSkuId(), failures - 1);
                throw new CartAddException("add-to-cart not confirmed");
            }
            added.add(variant.getSkuId());
            events.add("add " + variant.getSkuId());
            if (onFirstAdd != null) {
                Runnable hook = onFirstAdd;
                onFirstAdd = null;
                hook.run();
            }
        }

        @Override
        public void pause(long millis) {
            pauses.add(millis);
        }

    }

}
