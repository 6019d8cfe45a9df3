package fun.fengwk.cpw.core.hub;

import java.util.Map;

/**
 * @author fengwk
 */
public record AgentSummary(
    String agentId,
    String userId,
    String name,
    String version,
    Map<String, Object> capabilities,
    long connectedAt,
    long lastSeenAt,
    int pendingCalls
) {
}
