package fun.fengwk.cpw.core.service.variant;

import fun.fengwk.cpw.core.service.variant.model.OptionGroup;
import fun.fengwk.cpw.core.service.variant.model.OptionSelection;
import fun.fengwk.cpw.core.service.variant.model.PriceQuote;
import fun.fengwk.cpw.core.service.variant.model.SkuVariant;
import fun.fengwk.cpw.core.service.variant.model.VariantOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Enumerates every sellable option combination of a listing by driving its selector UI depth first.
 *
 * <p>The traversal only decides which option to pick next, all page access goes through
 * {@link VariantPageDriver}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VariantEnumerator {

    private final VariantProperties variantProperties;

    public List<SkuVariant> enumerate(VariantPageDriver driver, String listingId) {
        List<OptionGroup> groups = driver.listGroups();
        if (groups == null || groups.isEmpty()) {
            return enumerateSingle(driver, listingId);
        }

        Map<String, SkuVariant> results = new LinkedHashMap<>();
        walk(driver, groups, 0, new ArrayList<>(), results);
        log.info("variant enumeration finished, listingId={}, groups={}, variants={}", listingId, groups.size(), results.size());
        return new ArrayList<>(results.values());
    }

    private void walk(
        VariantPageDriver driver,
        List<OptionGroup> groups,
        int depth,
        List<OptionSelection> path,
        Map<String, SkuVariant> results
    ) {
        if (isFull(results)) {
            return;
        }
        if (depth == groups.size()) {
            recordLeaf(driver, path, results);
            return;
        }
        OptionGroup group = groups.get(depth);
        List<VariantOption> options = driver.listEnabledOptions(group);
        for (VariantOption option : options) {
            if (isFull(results)) {
                log.info("variant cap reached, max={}", variantProperties.getMaxVariants());
                return;
            }
            if (!driver.select(group, option)) {
                log.debug("option did not become selected, group={}, option={}", group.id(), option.id());
                continue;
            }
            path.add(new OptionSelection(group.id(), group.name(), option.id(), option.label()));
            walk(driver, groups, depth + 1, path, results);
            path.remove(path.size() - 1);
        }
    }

    private void recordLeaf(VariantPageDriver driver, List<OptionSelection> path, Map<String, SkuVariant> results) {
        PriceQuote quote = awaitStablePrice(driver);
        if (quote == null || quote.finalPrice() == null) {
            log.debug("variant leaf without price dropped, path={}", describe(path));
            return;
        }
        String key = driver.resolveVariantKey();
        if (!StringUtils.hasText(key)) {
            log.debug("variant leaf without key dropped, path={}", describe(path));
            return;
        }
        results.putIfAbsent(key, SkuVariant.builder()
            .skuId(key)
            .skuKey(path.stream().map(s -> s.groupId() + ":" + s.optionId()).collect(Collectors.joining(";")))
            .properties(describe(path))
            .selections(List.copyOf(path))
            .finalPrice(quote.finalPrice())
            .originalPrice(quote.originalPrice())
            .thumbnail(driver.readThumbnail())
            .build());
    }

    private List<SkuVariant> enumerateSingle(VariantPageDriver driver, String listingId) {
        PriceQuote quote = awaitStablePrice(driver);
        String key = driver.resolveVariantKey();
        SkuVariant variant = SkuVariant.builder()
            .skuId(StringUtils.hasText(key) ? key : listingId)
            .skuKey("default")
            .properties("默认")
            .finalPrice(quote == null ? null : quote.finalPrice())
            .originalPrice(quote == null ? null : quote.originalPrice())
            .thumbnail(driver.readThumbnail())
            .build();
        log.info("listing has no option groups, recorded as single variant, listingId={}", listingId);
        return List.of(variant);
    }

    /**
     * Poll the displayed price until the token repeats for the configured number of reads.
     * Falls back to the last non-empty read when the read budget runs out.
     */
    PriceQuote awaitStablePrice(VariantPageDriver driver) {
        PriceQuote last = null;
        int equalReads = 0;
        int requiredReads = Math.max(1, variantProperties.getPriceStableReads());
        for (int i = 0; i < variantProperties.getPriceMaxReads(); i++) {
            PriceQuote current = driver.readPrice();
            if (current != null && current.finalPrice() != null) {
                if (last != null && Objects.equals(last.token(), current.token())) {
                    equalReads++;
                } else {
                    equalReads = 1;
                }
                last = current;
                if (equalReads >= requiredReads) {
                    return current;
                }
            }
            driver.pause(variantProperties.getPricePollIntervalMs());
        }
        if (last != null) {
            log.debug("price did not settle, using last read, token={}", last.token());
        }
        return last;
    }

    private boolean isFull(Map<String, SkuVariant> results) {
        return results.size() >= variantProperties.getMaxVariants();
    }

    private String describe(List<OptionSelection> path) {
        return path.stream()
            .map(s -> s.groupName() + ":" + s.optionLabel())
            .collect(Collectors.joining(";"));
    }

}
