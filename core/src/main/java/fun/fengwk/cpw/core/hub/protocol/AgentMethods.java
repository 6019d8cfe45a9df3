package fun.fengwk.cpw.core.hub.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Set;

/**
 * RPC methods served by agents and their parameter shapes.
 *
 * @author fengwk
 */
public final class AgentMethods {

    public static final String SCRAPE_CART = "scrapeCart";
    public static final String ENUMERATE_VARIANTS = "enumerateVariants";
    public static final String PAUSE_ADD_FOR_SCRAPE = "pauseAddForScrape";
    public static final String RESUME_ADD_FOR_SCRAPE = "resumeAddForScrape";
    public static final String GET_BROWSER_STATUS = "getBrowserStatus";
    public static final String ADD_ALL_SKUS_TO_CART = "addAllSkusToCart";
    public static final String LOGIN_ACCOUNT = "loginAccount";
    public static final String CANCEL_LOGIN = "cancelLogin";

    /**
     * Progress log type of login screenshots, the log carries {@code {"type":"screenshot","image":"<base64 jpeg>"}}.
     */
    public static final String SCREENSHOT_LOG_TYPE = "screenshot";

    private AgentMethods() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScrapeCartParams(String accountId, String credential, Set<String> expectedListingIds) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EnumerateVariantsParams(String accountId, String credential, String listingId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PauseParams(String accountId, Long timeoutMs) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PauseResult(boolean paused) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResumeResult(boolean wasPaused) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AddAllSkusParams(
        String accountId,
        String credential,
        String listingId,
        Set<String> existingSkuProperties,
        Integer maxSkus
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LoginParams(String accountId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CancelLoginResult(boolean cancelled) {
    }

}
