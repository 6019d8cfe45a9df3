package fun.fengwk.cpw.core.service.cartadd;

/**
 * Adding one variant failed, the bulk operation records it and moves on.
 *
 * @author fengwk
 */
public class CartAddException extends RuntimeException {

    public CartAddException(String message) {
        super(message);
    }

}
