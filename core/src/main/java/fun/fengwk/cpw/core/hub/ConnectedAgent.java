package fun.fengwk.cpw.core.hub;

import java.util.Map;

/**
 * Registry entry of one live agent connection.
 *
 * @author fengwk
 */
public class ConnectedAgent {

    private final String agentId;
    private final String userId;
    private final AgentConnection connection;
    private final long connectedAt;
    private volatile long lastSeenAt;
    private volatile String name;
    private volatile String version;
    private volatile Map<String, Object> capabilities = Map.of();

    ConnectedAgent(String agentId, String userId, AgentConnection connection, long connectedAt) {
        this.agentId = agentId;
        this.userId = userId;
        this.connection = connection;
        this.connectedAt = connectedAt;
        this.lastSeenAt = connectedAt;
    }

    public String getAgentId() {
        return agentId;
    }

    /**
     * Owning user, null for shared agents.
     */
    public String getUserId() {
        return userId;
    }

    public AgentConnection getConnection() {
        return connection;
    }

    public long getConnectedAt() {
        return connectedAt;
    }

    public long getLastSeenAt() {
        return lastSeenAt;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public Map<String, Object> getCapabilities() {
        return capabilities;
    }

    void touch(long now) {
        lastSeenAt = now;
    }

    void describe(String name, String version, Map<String, Object> capabilities) {
        if (name != null) {
            this.name = name;
        }
        if (version != null) {
            this.version = version;
        }
        if (capabilities != null) {
            this.capabilities = Map.copyOf(capabilities);
        }
    }

}
