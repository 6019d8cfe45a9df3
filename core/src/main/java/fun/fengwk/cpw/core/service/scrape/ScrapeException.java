package fun.fengwk.cpw.core.service.scrape;

/**
 * Base exception for failures raised while driving a target site page.
 *
 * @author fengwk
 */
public class ScrapeException extends RuntimeException {

    private final ScrapeErrorCode code;

    public ScrapeException(ScrapeErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ScrapeException(ScrapeErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ScrapeErrorCode getCode() {
        return code;
    }

}
