package fun.fengwk.cpw.core.service.login;

/**
 * A login attempt ended without a logged-in session.
 *
 * @author fengwk
 */
public class LoginException extends RuntimeException {

    public LoginException(String message) {
        super(message);
    }

    public LoginException(String message, Throwable cause) {
        super(message, cause);
    }

}
