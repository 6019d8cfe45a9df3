package fun.fengwk.cpw.core.service.cart;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Cart collection configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.cart")
public class CartProperties {

    /**
     * Cart page url.
     */
    private String cartUrl = "https://cart.taobao.com/cart.htm";

    /**
     * Hard cap of extract/scroll rounds.
     */
    private int maxRounds = 60;

    /**
     * Bounce-back retries allowed once the list stops moving with expectations unmet.
     */
    private int maxBounces = 3;

    /**
     * Upward scroll distance of one bounce.
     */
    private long bounceDistancePx = 600;

    /**
     * Wait after a bounce before extracting again.
     */
    private long bounceWaitMs = 900;

    /**
     * Scroll step as a fraction of the viewport height.
     */
    private double stepViewportRatio = 0.85;

    /**
     * Lower bound of one scroll step.
     */
    private long minStepPx = 200;

    /**
     * Random settle wait after each scroll, lower bound.
     */
    private long settleMinMs = 600;

    /**
     * Random settle wait after each scroll, upper bound.
     */
    private long settleMaxMs = 1200;

    /**
     * Consecutive rounds with unchanged scroll position before the list is treated as stuck.
     */
    private int stuckRounds = 2;

    /**
     * Pixel tolerance when deciding the list reached bottom.
     */
    private long bottomTolerancePx = 8;

    /**
     * Regex with one group capturing the cart total from the page text.
     */
    private String totalHintPattern = "(?:全部商品|购物车)\\s*[（(]?\\s*(\\d+)";

    /**
     * Trailing texts meaning the list has no more items.
     */
    private List<String> endMarkers = List.of("没有更多", "已经到底", "到底了", "no more items");

    /**
     * Trailing texts meaning the page switched to recommendations below the cart.
     */
    private List<String> recommendationMarkers = List.of("为你推荐", "猜你喜欢", "recommended for you");

}
