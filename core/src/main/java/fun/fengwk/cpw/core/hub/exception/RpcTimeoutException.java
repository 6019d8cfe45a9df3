package fun.fengwk.cpw.core.hub.exception;

/**
 * The call budget elapsed before a result arrived. The remote side may still be working.
 *
 * @author fengwk
 */
public class RpcTimeoutException extends HubException {

    public static final String DEFAULT_MESSAGE = "rpc call timed out";

    public RpcTimeoutException() {
        super(DEFAULT_MESSAGE);
    }

    public RpcTimeoutException(String message) {
        super(message);
    }

}
