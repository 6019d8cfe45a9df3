package fun.fengwk.cpw.core.hub.auth;

/**
 * @author fengwk
 */
public record PairCodeGrant(String code, String userId, boolean setAsDefault, long expiresAt) {
}
