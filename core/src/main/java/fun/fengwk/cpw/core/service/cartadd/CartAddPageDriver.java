package fun.fengwk.cpw.core.service.cartadd;

import fun.fengwk.cpw.core.service.variant.model.SkuVariant;

import java.util.List;

/**
 * Page capabilities the bulk adder drives. Each call is one atomic step, the account page is free
 * between calls.
 *
 * @author fengwk
 */
public interface CartAddPageDriver {

    void openListing(String listingId);

    List<SkuVariant> listVariants(String listingId);

    /**
     * Select the variant options and press add-to-cart.
     *
     * @throws CartAddException when the page did not confirm the add
     */
    void addToCart(SkuVariant variant);

    void pause(long millis) throws InterruptedException;

}
