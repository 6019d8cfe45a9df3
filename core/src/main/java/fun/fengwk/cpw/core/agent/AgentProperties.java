package fun.fengwk.cpw.core.agent;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Remote agent configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.agent")
public class AgentProperties {

    /**
     * Hub websocket url, e.g. {@code ws://127.0.0.1:8080/ws/agent}. Falls back to the stored identity.
     */
    private String hubUrl = "";

    /**
     * Pairing endpoint, derived from the hub url when empty.
     */
    private String pairUrl = "";

    /**
     * Agent id, the stored identity or a random id when empty.
     */
    private String agentId = "";

    /**
     * Static token, takes precedence over the stored one.
     */
    private String token = "";

    /**
     * Single-use pairing code redeemed at start-up when no token is available.
     */
    private String pairCode = "";

    private String name = "cpw-agent";

    private String version = "1.0.0";

    /**
     * Identity file, {@code ~} expands to the user home.
     */
    private String identityFile = "~/.cpw-agent/identity.json";

    private long reconnectMinDelayMs = 2000;

    private long reconnectMaxDelayMs = 5000;

    /**
     * Pong interval while a browser call runs, keeps the connection from looking stale.
     */
    private long heartbeatIntervalMs = 10000;

    /**
     * Default wait of {@code pauseAddForScrape} when the caller sends none.
     */
    private long pauseTimeoutMs = 20000;

    private long pairTimeoutMs = 15000;

    /**
     * Largest websocket frame the client accepts, rpc params carry the account cookies.
     */
    private int maxMessageBytes = 16 * 1024 * 1024;

}
