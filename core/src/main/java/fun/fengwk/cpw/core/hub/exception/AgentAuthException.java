package fun.fengwk.cpw.core.hub.exception;

/**
 * Missing or rejected agent credential, or an expired pairing code.
 *
 * @author fengwk
 */
public class AgentAuthException extends HubException {

    public static final String DEFAULT_MESSAGE = "agent authentication failed";

    public AgentAuthException() {
        super(DEFAULT_MESSAGE);
    }

    public AgentAuthException(String message) {
        super(message);
    }

}
