package fun.fengwk.cpw.core.hub;

import java.io.IOException;

/**
 * Transport handle of one agent connection.
 *
 * @author fengwk
 */
public interface AgentConnection {

    String id();

    void send(String text) throws IOException;

    void close(int code, String reason);

    boolean isOpen();

}
