package fun.fengwk.cpw.core.scheduler;

/**
 * Job types, payload keys and job id conventions.
 *
 * @author fengwk
 */
public final class ScrapeJobs {

    public static final String CART_SCRAPE = "cart-scrape";
    public static final String VARIANT_SCRAPE = "variant-scrape";

    public static final String ACCOUNT_ID = "accountId";
    public static final String LISTING_ID = "listingId";
    public static final String FORCE = "force";

    private ScrapeJobs() {
    }

    /**
     * Jobs in the same time bucket collapse into one.
     */
    public static String cartScrapeJobId(String accountId, long now, long intervalMs) {
        return "cart_scrape_" + accountId + "_" + bucket(now, intervalMs);
    }

    public static String manualCartScrapeJobId(String accountId, long now) {
        return "cart_scrape_" + accountId + "_manual_" + now;
    }

    public static String variantScrapeJobId(String accountId, String listingId, long now, long intervalMs) {
        return "variant_scrape_" + accountId + "_" + listingId + "_" + bucket(now, intervalMs);
    }

    static long bucket(long now, long intervalMs) {
        return Math.floorDiv(now, Math.max(1, intervalMs));
    }

}
