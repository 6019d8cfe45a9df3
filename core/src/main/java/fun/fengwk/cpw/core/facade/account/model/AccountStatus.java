package fun.fengwk.cpw.core.facade.account.model;

/**
 * @author fengwk
 */
public enum AccountStatus {

    IDLE,
    RUNNING,
    CAPTCHA,
    LOCKED,
    COOLDOWN

}
