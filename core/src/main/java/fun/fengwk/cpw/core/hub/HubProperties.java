package fun.fengwk.cpw.core.hub;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Agent hub configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.hub")
public class HubProperties {

    /**
     * Websocket endpoint path agents connect to.
     */
    private String path = "/ws/agent";

    /**
     * Static token accepted for every agent id. Agents using it are shared, empty disables it.
     */
    private String sharedToken = "";

    /**
     * Interval between hub pings.
     */
    private long pingIntervalMs = 25000;

    /**
     * Floor of the ping interval.
     */
    private long minPingIntervalMs = 5000;

    /**
     * Floor of the stale threshold, the effective threshold is max(4 x ping interval, this).
     */
    private long minStaleAfterMs = 120000;

    private long defaultCallTimeoutMs = 120000;

    private long minCallTimeoutMs = 3000;

    /**
     * Lifetime of a pairing code.
     */
    private long pairCodeTtlMs = 120000;

    private int pairCodeLength = 8;

    /**
     * Largest websocket frame the endpoint accepts. Cart results and cookie params exceed the container default of 8 KB.
     */
    private int maxMessageBytes = 16 * 1024 * 1024;

    public long resolvePingIntervalMs() {
        return Math.max(minPingIntervalMs, pingIntervalMs);
    }

    public long resolveStaleAfterMs() {
        return Math.max(resolvePingIntervalMs() * 4, minStaleAfterMs);
    }

}
