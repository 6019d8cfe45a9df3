package fun.fengwk.cpw.core.hub.auth;

/**
 * Authenticated agent identity. {@code userId} is null for shared agents.
 *
 * @author fengwk
 */
public record AgentPrincipal(String agentId, String userId) {
}
