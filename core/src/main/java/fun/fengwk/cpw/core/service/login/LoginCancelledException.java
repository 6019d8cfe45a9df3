package fun.fengwk.cpw.core.service.login;

/**
 * @author fengwk
 */
public class LoginCancelledException extends LoginException {

    public LoginCancelledException() {
        super("Login cancelled");
    }

}
