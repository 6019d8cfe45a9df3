package fun.fengwk.cpw.core.service.cart.model;

/**
 * Why the cart collection loop stopped.
 *
 * @author fengwk
 */
public enum CollectStopReason {

    EXPECTED_SATISFIED(true),
    TOTAL_HINT_REACHED(true),
    BOTTOM_REACHED(true),
    NO_NEW_ITEMS(true),
    GAVE_UP(false),
    ROUND_CAP(false);

    private final boolean converged;

    CollectStopReason(boolean converged) {
        this.converged = converged;
    }

    public boolean isConverged() {
        return converged;
    }

}
