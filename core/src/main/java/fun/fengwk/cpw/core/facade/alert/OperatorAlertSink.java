package fun.fengwk.cpw.core.facade.alert;

/**
 * Operator facing alerts, e.g. an account that needs manual re-login.
 *
 * @author fengwk
 */
public interface OperatorAlertSink {

    void alert(String title, String detail);

}
