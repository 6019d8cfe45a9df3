package fun.fengwk.cpw.core.hub.exception;

/**
 * The agent answered with {@code ok=false}.
 *
 * @author fengwk
 */
public class RemoteCallException extends HubException {

    public static final String DEFAULT_MESSAGE = "remote call failed";

    public RemoteCallException() {
        super(DEFAULT_MESSAGE);
    }

    public RemoteCallException(String message) {
        super(message);
    }

}
