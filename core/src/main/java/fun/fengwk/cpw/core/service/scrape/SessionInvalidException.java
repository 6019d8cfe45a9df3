package fun.fengwk.cpw.core.service.scrape;

/**
 * @author fengwk
 */
public class SessionInvalidException extends ScrapeException {

    public static final String DEFAULT_MESSAGE = "browser session is no longer usable";

    public SessionInvalidException() {
        this(DEFAULT_MESSAGE);
    }

    public SessionInvalidException(String message) {
        super(ScrapeErrorCode.SESSION_INVALID, message);
    }

    public SessionInvalidException(String message, Throwable cause) {
        super(ScrapeErrorCode.SESSION_INVALID, message, cause);
    }

}
