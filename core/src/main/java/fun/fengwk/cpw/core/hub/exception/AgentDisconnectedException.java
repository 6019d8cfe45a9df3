package fun.fengwk.cpw.core.hub.exception;

/**
 * The agent connection owning the call went away before a result arrived.
 *
 * @author fengwk
 */
public class AgentDisconnectedException extends HubException {

    public static final String DEFAULT_MESSAGE = "agent disconnected";

    public AgentDisconnectedException() {
        super(DEFAULT_MESSAGE);
    }

    public AgentDisconnectedException(String message) {
        super(message);
    }

}
