package fun.fengwk.cpw.core.service.scrape;

/**
 * @author fengwk
 */
public class NeedsLoginException extends ScrapeException {

    public static final String DEFAULT_MESSAGE = "login required";

    public NeedsLoginException() {
        this(DEFAULT_MESSAGE);
    }

    public NeedsLoginException(String message) {
        super(ScrapeErrorCode.NEEDS_LOGIN, message);
    }

    public NeedsLoginException(String message, Throwable cause) {
        super(ScrapeErrorCode.NEEDS_LOGIN, message, cause);
    }

}
