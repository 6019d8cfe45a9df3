package fun.fengwk.cpw.core.service.scrape;

import java.util.Optional;

/**
 * Stable error codes, also used to carry scrape failures across the agent wire.
 *
 * @author fengwk
 */
public enum ScrapeErrorCode {

    NEEDS_LOGIN,
    NEEDS_CAPTCHA,
    SESSION_INVALID,
    CONVERGENCE_GIVE_UP;

    private static final String SEPARATOR = ": ";

    /**
     * Render an exception as a wire error string, e.g. {@code NEEDS_CAPTCHA: slider detected}.
     */
    public static String encode(ScrapeException ex) {
        return ex.getCode().name() + SEPARATOR + ex.getMessage();
    }

    /**
     * Rebuild a typed exception from a wire error string, empty when the string carries no code.
     */
    public static Optional<ScrapeException> decode(String error) {
        if (error == null) {
            return Optional.empty();
        }
        int idx = error.indexOf(SEPARATOR);
        if (idx <= 0) {
            return Optional.empty();
        }
        ScrapeErrorCode code;
        try {
            code = ScrapeErrorCode.valueOf(error.substring(0, idx));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
        String message = error.substring(idx + SEPARATOR.length());
        return Optional.of(code.toException(message));
    }

    public ScrapeException toException(String message) {
        return switch (this) {
            case NEEDS_LOGIN -> new NeedsLoginException(message);
            case NEEDS_CAPTCHA -> new NeedsCaptchaException(message);
            case SESSION_INVALID -> new SessionInvalidException(message);
            case CONVERGENCE_GIVE_UP -> new ConvergenceGiveUpException(message);
        };
    }

}
