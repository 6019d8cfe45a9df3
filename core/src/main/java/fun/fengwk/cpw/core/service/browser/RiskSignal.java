package fun.fengwk.cpw.core.service.browser;

/**
 * Challenge signals a target page can raise against a session.
 *
 * @author fengwk
 */
public enum RiskSignal {

    NONE,
    LOGIN_REQUIRED,
    CAPTCHA,
    ACCESS_DENIED

}
