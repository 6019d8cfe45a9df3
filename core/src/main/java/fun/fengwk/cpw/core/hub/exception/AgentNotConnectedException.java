package fun.fengwk.cpw.core.hub.exception;

/**
 * No live connection for the target agent.
 *
 * @author fengwk
 */
public class AgentNotConnectedException extends HubException {

    public static final String DEFAULT_MESSAGE = "agent not connected";

    public AgentNotConnectedException() {
        super(DEFAULT_MESSAGE);
    }

    public AgentNotConnectedException(String message) {
        super(message);
    }

}
