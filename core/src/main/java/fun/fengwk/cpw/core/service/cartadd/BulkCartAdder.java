package fun.fengwk.cpw.core.service.cartadd;

import fun.fengwk.cpw.core.service.cartadd.model.BulkAddRequest;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;
import fun.fengwk.cpw.core.service.cartadd.model.SkuAddResult;
import fun.fengwk.cpw.core.service.coordination.AccountTaskCoordinator;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Adds every variant of a listing to the cart, one variant per step.
 *
 * <p>The operation registers itself as the account's bulk operation. Between two variants it
 * offers a safe point, so a scrape of the same account can take the page over and hand it back.
 * After such a pause the listing page is reopened before the next variant.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BulkCartAdder {

    private final AccountTaskCoordinator coordinator;
    private final CartAddProperties cartAddProperties;
    private final Random random;

    @Autowired
    public BulkCartAdder(AccountTaskCoordinator coordinator, CartAddProperties cartAddProperties) {
        this(coordinator, cartAddProperties, ThreadLocalRandom.current());
    }

    BulkCartAdder(AccountTaskCoordinator coordinator, CartAddProperties cartAddProperties, Random random) {
        this.coordinator = coordinator;
        this.cartAddProperties = cartAddProperties;
        this.random = random;
    }

    /**
     * @throws IllegalStateException when a bulk operation already runs for the account
     * @throws InterruptedException when interrupted while paused or between variants
     */
    public BulkAddResult addAll(
        String accountId,
        CartAddPageDriver driver,
        BulkAddRequest request,
        BulkAddListener listener
    ) throws InterruptedException {
        if (coordinator.isBulkInProgress(accountId)) {
            throw new IllegalStateException("bulk cart add already running for account " + accountId);
        }
        String listingId = request.getListingId();
        long startedAt = System.currentTimeMillis();
        coordinator.markBulkStart(accountId);
        try {
            driver.openListing(listingId);
            List<SkuVariant> variants = new ArrayList<>(driver.listVariants(listingId));
            Collections.shuffle(variants, random);
            int limit = request.getMaxSkus() != null ? request.getMaxSkus() : cartAddProperties.getMaxSkus();
            if (limit > 0 && variants.size() > limit) {
                variants = new ArrayList<>(variants.subList(0, limit));
            }
            Set<String> existing = matchKeys(request.getExistingSkuProperties());
            log.info("bulk cart add started, accountId={}, listingId={}, variants={}, existing={}",
                accountId, listingId, variants.size(), existing.size());

            BulkAddResult result = BulkAddResult.builder()
                .listingId(listingId)
                .totalSkus(variants.size())
                .build();
            for (int i = 0; i < variants.size(); i++) {
                if (coordinator.checkpoint(accountId)) {
                    result.setPauses(result.getPauses() + 1);
                    log.info("bulk cart add resumed, reopen listing, accountId={}, listingId={}", accountId, listingId);
                    driver.openListing(listingId);
                }
                SkuVariant variant = variants.get(i);
                SkuAddResult skuResult = existing.contains(matchKey(variant.getProperties()))
                    ? SkuAddResult.builder().skuId(variant.getSkuId()).properties(variant.getProperties()).skipped(true).build()
                    : addWithRetry(driver, listingId, variant);
                result.getResults().add(skuResult);
                if (skuResult.isSkipped()) {
                    result.setSkippedCount(result.getSkippedCount() + 1);
                } else if (skuResult.isSuccess()) {
                    result.setSuccessCount(result.getSuccessCount() + 1);
                } else {
                    result.setFailedCount(result.getFailedCount() + 1);
                }
                notifyProgress(accountId, listener, result, i + 1, describe(skuResult));
                if (i < variants.size() - 1 && !skuResult.isSkipped()) {
                    driver.pause(nextDelay());
                }
            }
            result.setDurationMs(System.currentTimeMillis() - startedAt);
            log.info("bulk cart add finished, accountId={}, listingId={}, success={}, failed={}, skipped={}, pauses={}",
                accountId, listingId, result.getSuccessCount(), result.getFailedCount(), result.getSkippedCount(), result.getPauses());
            return result;
        } finally {
            coordinator.markBulkEnd(accountId);
        }
    }

    /**
     * Order-independent key of a variant label, so {@code 颜色:红色;尺码:M} from the listing page
     * matches {@code 尺码：M 颜色：红色} from a cart row.
     */
    public static String matchKey(String properties) {
        if (properties == null) {
            return "";
        }
        return Arrays.stream(properties.trim().split("[;；\\s]+"))
            .map(BulkCartAdder::stripName)
            .filter(token -> !token.isEmpty())
            .sorted()
            .collect(Collectors.joining(";"));
    }

    private static String stripName(String token) {
        int ascii = token.indexOf(':');
        int wide = token.indexOf('：');
        int separator = ascii < 0 ? wide : wide < 0 ? ascii : Math.min(ascii, wide);
        return separator < 0 ? token : token.substring(separator + 1).trim();
    }

    private Set<String> matchKeys(Collection<String> properties) {
        Set<String> keys = new HashSet<>();
        if (properties != null) {
            for (String value : properties) {
                String key = matchKey(value);
                if (!key.isEmpty()) {
                    keys.add(key);
                }
            }
        }
        return keys;
    }

    private SkuAddResult addWithRetry(CartAddPageDriver driver, String listingId, SkuVariant variant) {
        int maxAttempts = Math.max(1, cartAddProperties.getMaxAttempts());
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                driver.addToCart(variant);
                return SkuAddResult.builder()
                    .skuId(variant.getSkuId())
                    .properties(variant.getProperties())
                    .success(true)
                    .attempts(attempt)
                    .build();
            } catch (CartAddException ex) {
                lastError = ex.getMessage();
                log.info("add to cart failed, listingId={}, skuId={}, attempt={}, error={}",
                    listingId, variant.getSkuId(), attempt, lastError);
                if (attempt < maxAttempts) {
                    driver.openListing(listingId);
                }
            }
        }
        return SkuAddResult.builder()
            .skuId(variant.getSkuId())
            .properties(variant.getProperties())
            .attempts(maxAttempts)
            .error(lastError)
            .build();
    }

    long nextDelay() {
        long delay = between(cartAddProperties.getSkuDelayMinMs(), cartAddProperties.getSkuDelayMaxMs());
        if (random.nextDouble() < cartAddProperties.getLongPauseChance()) {
            delay += between(cartAddProperties.getLongPauseMinMs(), cartAddProperties.getLongPauseMaxMs());
        }
        return delay;
    }

    private long between(long min, long max) {
        long lower = Math.max(0, Math.min(min, max));
        long upper = Math.max(lower, max);
        return upper == lower ? lower : lower + (long) (random.nextDouble() * (upper - lower + 1));
    }

    private String describe(SkuAddResult skuResult) {
        String label = skuResult.getProperties() != null ? skuResult.getProperties() : skuResult.getSkuId();
        if (skuResult.isSkipped()) {
            return "skipped " + label + ", already in cart";
        }
        if (skuResult.isSuccess()) {
            return "added " + label;
        }
        return "failed " + label + ": " + skuResult.getError();
    }

    private void notifyProgress(String accountId, BulkAddListener listener, BulkAddResult result, int current, String line) {
        if (listener == null) {
            return;
        }
        try {
            listener.onProgress(result.getTotalSkus(), current, result.getSuccessCount(), result.getFailedCount(), line);
        } catch (RuntimeException ex) {
            log.warn("bulk cart add listener failed, accountId={}, error={}", accountId, ex.getMessage());
        }
    }

}
