package fun.fengwk.cpw.core.service.scrape;

/**
 * @author fengwk
 */
public class ConvergenceGiveUpException extends ScrapeException {

    public static final String DEFAULT_MESSAGE = "collection gave up before converging";

    public ConvergenceGiveUpException() {
        this(DEFAULT_MESSAGE);
    }

    public ConvergenceGiveUpException(String message) {
        super(ScrapeErrorCode.CONVERGENCE_GIVE_UP, message);
    }

    public ConvergenceGiveUpException(String message, Throwable cause) {
        super(ScrapeErrorCode.CONVERGENCE_GIVE_UP, message, cause);
    }

}
