package fun.fengwk.cpw.core.service.login.model;

/**
 * @param cookies credential material of the logged-in session, a JSON array of cookies
 * @author fengwk
 */
public record LoginResult(String cookies) {
}
