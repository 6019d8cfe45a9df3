package fun.fengwk.cpw.core.hub.exception;

/**
 * Base exception of the agent RPC hub.
 *
 * @author fengwk
 */
public class HubException extends RuntimeException {

    public HubException(String message) {
        super(message);
    }

    public HubException(String message, Throwable cause) {
        super(message, cause);
    }

}
