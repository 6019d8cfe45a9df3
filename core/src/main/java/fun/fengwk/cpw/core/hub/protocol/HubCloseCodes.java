package fun.fengwk.cpw.core.hub.protocol;

/**
 * WebSocket close codes used on the agent connection.
 *
 * @author fengwk
 */
public final class HubCloseCodes {

    public static final int GOING_AWAY = 1001;

    /**
     * Missing or rejected credential.
     */
    public static final int POLICY_VIOLATION = 1008;

    public static final int INTERNAL_ERROR = 1011;

    /**
     * A newer connection took over the agent identity. The losing side must not reconnect.
     */
    public static final int REPLACED = 1012;

    public static final String REPLACED_REASON = "Replaced by new connection";

    private HubCloseCodes() {
    }

}
