package fun.fengwk.cpw.core.service.scrape;

/**
 * @author fengwk
 */
public class NeedsCaptchaException extends ScrapeException {

    public static final String DEFAULT_MESSAGE = "captcha required";

    public NeedsCaptchaException() {
        this(DEFAULT_MESSAGE);
    }

    public NeedsCaptchaException(String message) {
        super(ScrapeErrorCode.NEEDS_CAPTCHA, message);
    }

    public NeedsCaptchaException(String message, Throwable cause) {
        super(ScrapeErrorCode.NEEDS_CAPTCHA, message, cause);
    }

}
