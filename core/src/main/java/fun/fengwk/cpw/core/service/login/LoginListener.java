package fun.fengwk.cpw.core.service.login;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface LoginListener {

    /**
     * Latest view of the login page, base64 jpeg.
     */
    void onScreenshot(String image);

}
