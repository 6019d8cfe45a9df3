package fun.fengwk.cpw.core.service.cartadd;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bulk add-to-cart configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.cart-add")
public class CartAddProperties {

    /**
     * Upper bound of variants added per listing, zero adds all.
     */
    private int maxSkus = 0;

    /**
     * Attempts per variant, the listing is reopened between attempts.
     */
    private int maxAttempts = 2;

    private long skuDelayMinMs = 900;

    private long skuDelayMaxMs = 2200;

    /**
     * Chance of an extra long pause between two variants.
     */
    private double longPauseChance = 0.08;

    private long longPauseMinMs = 2000;

    private long longPauseMaxMs = 5000;

    /**
     * Chance of a random scroll before looking for the add button.
     */
    private double randomScrollChance = 0.15;

    private long clickTimeoutMs = 5000;

    private long successTimeoutMs = 8000;

    private long successPollIntervalMs = 200;

    /**
     * Tried in order, the first visible match is the add-to-cart button.
     */
    private List<String> addButtonSelectors = List.of(
        "[class*=\"btnItem\"]:has([class*=\"icon-taobaojiarugouwuche\"])",
        "button:has-text(\"加入购物车\")",
        "a:has-text(\"加入购物车\")",
        ".addcart-btn",
        ".add-cart-btn",
        "button[class*=\"AddCart\"]"
    );

    private List<String> miniCartCountSelectors = List.of("#J_MiniCartNum", "[id*=\"MiniCartNum\"]");

    private String successTextPattern = "(成功(加入|添加|放入).{0,6}购物车|已(加入|添加|放入).{0,6}购物车|加入购物车成功|已放入购物车)";

}
