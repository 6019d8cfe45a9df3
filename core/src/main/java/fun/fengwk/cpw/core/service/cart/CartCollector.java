package fun.fengwk.cpw.core.service.cart;

import fun.fengwk.cpw.core.service.cart.model.CartCollectRequest;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.cart.model.CartLineItem;
import fun.fengwk.cpw.core.service.cart.model.CollectStopReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Scrolls a virtualized cart list until it converges and returns every distinct line item.
 *
 * <p>Each round extracts the rendered rows, merges them into a de-duplicated map, reads the
 * page total hint and scrolls one step. The loop stops when the expected listings are all seen,
 * the total hint is reached, or the list bottomed out with nothing new. When the list stops
 * moving while expectations are still open it bounces up and retries a bounded number of times.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CartCollector {

    private final CartProperties cartProperties;

    public CartCollectResult collect(CartPageDriver driver, CartCollectRequest request) {
        Set<String> expected = request.getExpectedListingIds() == null ? Set.of() : request.getExpectedListingIds();
        Map<String, CartLineItem> merged = new LinkedHashMap<>();
        Integer totalHint = null;
        int round = 0;
        int bounces = 0;
        int idleRounds = 0;
        int stuckRounds = 0;
        long lastPosition = -1;
        CollectStopReason stopReason = CollectStopReason.ROUND_CAP;

        while (round < cartProperties.getMaxRounds()) {
            round++;
            int added = merge(merged, driver.extractVisibleItems());
            Integer hint = driver.readTotalHint();
            if (hint != null) {
                totalHint = hint;
            }
            idleRounds = added > 0 ? 0 : idleRounds + 1;

            boolean expectedPending = !expected.isEmpty() && !containsAll(merged, expected);
            boolean hintPending = totalHint != null && cumulativeQuantity(merged) < totalHint;
            if (!expected.isEmpty() && !expectedPending) {
                stopReason = CollectStopReason.EXPECTED_SATISFIED;
                break;
            }
            // The hint may count lines rather than quantity, it never overrides open expectations.
            if (totalHint != null && !hintPending && !expectedPending) {
                stopReason = CollectStopReason.TOTAL_HINT_REACHED;
                break;
            }

            ScrollMetrics metrics = driver.readScrollMetrics();
            stuckRounds = metrics.position() == lastPosition ? stuckRounds + 1 : 0;
            lastPosition = metrics.position();
            boolean atBottom = metrics.isAtBottom(cartProperties.getBottomTolerancePx());
            boolean stuck = stuckRounds >= cartProperties.getStuckRounds();

            if (atBottom || stuck) {
                if (!expectedPending && !hintPending) {
                    if (idleRounds > 0) {
                        stopReason = atBottom ? CollectStopReason.BOTTOM_REACHED : CollectStopReason.NO_NEW_ITEMS;
                        break;
                    }
                    // Last round still merged rows, look once more before stopping.
                    driver.pause(randomSettleMs());
                    continue;
                }
                if (bounces >= cartProperties.getMaxBounces()) {
                    stopReason = CollectStopReason.GAVE_UP;
                    break;
                }
                bounces++;
                log.debug(
                    "cart list stalled with open expectations, bounce={}, atBottom={}, stuckRounds={}, merged={}",
                    bounces,
                    atBottom,
                    stuckRounds,
                    merged.size()
                );
                driver.scrollBy(-cartProperties.getBounceDistancePx());
                driver.pause(cartProperties.getBounceWaitMs());
                stuckRounds = 0;
                lastPosition = -1;
                continue;
            }

            driver.scrollBy(resolveStep(metrics));
            driver.pause(randomSettleMs());
        }

        List<String> missing = new ArrayList<>();
        for (String listingId : expected) {
            if (!containsListing(merged, listingId)) {
                missing.add(listingId);
            }
        }
        String diagnosis = stopReason.isConverged() ? "" : diagnose(driver.readTrailingText());
        if (!stopReason.isConverged()) {
            log.info(
                "cart collection stopped without converging, reason={}, rounds={}, items={}, totalHint={}, missing={}, diagnosis={}",
                stopReason,
                round,
                merged.size(),
                totalHint,
                missing.size(),
                diagnosis
            );
        }
        return CartCollectResult.builder()
            .items(new ArrayList<>(merged.values()))
            .uiTotalCount(totalHint)
            .stopReason(stopReason)
            .diagnosis(diagnosis)
            .rounds(round)
            .missingExpectedIds(missing)
            .build();
    }

    /**
     * Merge fresh sightings. Returns the number of new keys.
     */
    int merge(Map<String, CartLineItem> merged, List<CartLineItem> visible) {
        int added = 0;
        if (visible == null) {
            return 0;
        }
        for (CartLineItem item : visible) {
            if (item == null || !StringUtils.hasText(item.getListingId())) {
                continue;
            }
            CartLineItem existing = merged.get(item.mergeKey());
            if (existing == null) {
                merged.put(item.mergeKey(), copyOf(item));
                added++;
            } else {
                fillMissing(existing, item);
            }
        }
        return added;
    }

    String diagnose(String trailingText) {
        String text = trailingText == null ? "" : trailingText.toLowerCase();
        for (String marker : cartProperties.getEndMarkers()) {
            if (text.contains(marker.toLowerCase())) {
                return "end of list marker seen: " + marker;
            }
        }
        for (String marker : cartProperties.getRecommendationMarkers()) {
            if (text.contains(marker.toLowerCase())) {
                return "recommendation section reached: " + marker;
            }
        }
        return "no trailing marker recognized";
    }

    private void fillMissing(CartLineItem target, CartLineItem source) {
        if (!StringUtils.hasText(target.getTitle()) && StringUtils.hasText(source.getTitle())) {
            target.setTitle(source.getTitle());
        }
        if (!StringUtils.hasText(target.getImageUrl()) && StringUtils.hasText(source.getImageUrl())) {
            target.setImageUrl(source.getImageUrl());
        }
        if (!StringUtils.hasText(target.getSkuProperties()) && StringUtils.hasText(source.getSkuProperties())) {
            target.setSkuProperties(source.getSkuProperties());
        }
        if (target.getFinalPrice() == null && source.getFinalPrice() != null) {
            target.setFinalPrice(source.getFinalPrice());
        }
        if (target.getOriginalPrice() == null && source.getOriginalPrice() != null) {
            target.setOriginalPrice(source.getOriginalPrice());
        }
        if (target.getQuantity() == null && source.getQuantity() != null) {
            target.setQuantity(source.getQuantity());
        }
    }

    private CartLineItem copyOf(CartLineItem item) {
        return CartLineItem.builder()
            .listingId(item.getListingId())
            .skuId(item.getSkuId())
            .skuProperties(item.getSkuProperties())
            .title(item.getTitle())
            .imageUrl(item.getImageUrl())
            .finalPrice(item.getFinalPrice())
            .originalPrice(item.getOriginalPrice())
            .quantity(item.getQuantity())
            .build();
    }

    private boolean containsAll(Map<String, CartLineItem> merged, Set<String> expected) {
        for (String listingId : expected) {
            if (!containsListing(merged, listingId)) {
                return false;
            }
        }
        return true;
    }

    private boolean containsListing(Map<String, CartLineItem> merged, String listingId) {
        for (CartLineItem item : merged.values()) {
            if (listingId.equals(item.getListingId())) {
                return true;
            }
        }
        return false;
    }

    private int cumulativeQuantity(Map<String, CartLineItem> merged) {
        int total = 0;
        for (CartLineItem item : merged.values()) {
            total += item.getQuantity() == null ? 1 : item.getQuantity();
        }
        return total;
    }

    private long resolveStep(ScrollMetrics metrics) {
        long step = Math.round(metrics.viewportHeight() * cartProperties.getStepViewportRatio());
        return Math.max(cartProperties.getMinStepPx(), step);
    }

    private long randomSettleMs() {
        long min = Math.max(0, cartProperties.getSettleMinMs());
        long max = Math.max(min, cartProperties.getSettleMaxMs());
        return min == max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
    }

}
