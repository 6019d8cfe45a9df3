package fun.fengwk.cpw.core.service.cart;

import fun.fengwk.cpw.core.service.cart.model.CartLineItem;

import java.util.List;

/**
 * Page capabilities the cart collector needs, kept narrow so the algorithm can run against a fake.
 *
 * @author fengwk
 */
public interface CartPageDriver {

    /**
     * Items currently rendered by the virtualized list.
     */
    List<CartLineItem> extractVisibleItems();

    /**
     * Total item count exposed by the page, null when absent.
     */
    Integer readTotalHint();

    ScrollMetrics readScrollMetrics();

    void scrollBy(long deltaPx);

    void pause(long millis);

    /**
     * Text at the tail of the list, used to explain why collection stopped.
     */
    String readTrailingText();

}
