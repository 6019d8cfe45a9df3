package fun.fengwk.cpw.core.service.variant;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Variant enumeration configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.variant")
public class VariantProperties {

    /**
     * Listing page url, {@code %s} is replaced by the listing id.
     */
    private String itemUrlTemplate = "https://item.taobao.com/item.htm?id=%s";

    /**
     * Upper bound of recorded variants per listing.
     */
    private int maxVariants = 200;

    private long selectTimeoutMs = 3000;

    private long selectPollIntervalMs = 100;

    /**
     * Consecutive equal reads before a price counts as settled.
     */
    private int priceStableReads = 2;

    private long pricePollIntervalMs = 80;

    private int priceMaxReads = 15;

    private String panelSelector = "[id*=\"SkuPanel\"]";

    private List<String> groupSelectors = List.of(
        "[class*=\"propItem\"]",
        "[class*=\"Property\"]",
        "[class*=\"skuItem\"]",
        "[class*=\"skuLine\"]"
    );

    private List<String> priceSelectors = List.of(".price", ".final-price", "[class*=\"Price\"]");

}
