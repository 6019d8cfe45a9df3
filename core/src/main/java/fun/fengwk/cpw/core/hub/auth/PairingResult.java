package fun.fengwk.cpw.core.hub.auth;

/**
 * Outcome of redeeming a pairing code.
 *
 * @author fengwk
 */
public record PairingResult(String agentId, String userId, String token, boolean setAsDefault) {
}
