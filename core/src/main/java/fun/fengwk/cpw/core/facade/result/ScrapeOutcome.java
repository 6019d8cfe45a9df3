package fun.fengwk.cpw.core.facade.result;

/**
 * Per-scrape counts reported by the result sink.
 *
 * @author fengwk
 */
public record ScrapeOutcome(int updated, int missing, int failed) {
}
