package fun.fengwk.cpw.core.service.cart;

/**
 * Scroll state of the cart list.
 *
 * @author fengwk
 */
public record ScrollMetrics(long position, long viewportHeight, long scrollHeight) {

    public boolean isAtBottom(long tolerance) {
        return position + viewportHeight >= scrollHeight - tolerance;
    }

}
