package fun.fengwk.cpw.core.service.login;

import fun.fengwk.cpw.core.service.login.model.LoginSnapshot;

/**
 * Page capabilities the login loop polls.
 *
 * @author fengwk
 */
public interface LoginPageDriver {

    /**
     * Start from a fresh session showing the login form.
     */
    void open();

    LoginSnapshot capture();

}
