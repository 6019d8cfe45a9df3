package fun.fengwk.cpw.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * Browser runtime shared configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.browser")
public class BrowserProperties {

    /**
     * Whether account sessions run in headless mode.
     */
    private boolean headless = true;

    /**
     * Optional fixed user agent for browser context.
     */
    private String userAgent = "";

    /**
     * User agent pool for random rotation.
     */
    private List<String> userAgents = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/123.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15"
    );

    /**
     * Viewport width of account sessions.
     */
    private int viewportWidth = 1920;

    /**
     * Viewport height of account sessions.
     */
    private int viewportHeight = 1080;

    /**
     * Locale for browser context.
     */
    private String locale = "zh-CN";

    /**
     * Timezone id for browser context.
     */
    private String timezoneId = "Asia/Shanghai";

    /**
     * Optional Accept-Language header value.
     */
    private String acceptLanguage = "zh-CN,zh;q=0.9";

    /**
     * Extra headers for browser context.
     */
    private Map<String, String> extraHeaders = Map.of();

    /**
     * Domain applied to stored cookies that carry neither domain nor url.
     */
    private String cookieDefaultDomain = ".taobao.com";

    /**
     * Proxy server, for example http://proxy:8080.
     */
    private String proxyServer = "";

    private String proxyUsername = "";

    private String proxyPassword = "";

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of();

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    /**
     * Navigation timeout for page loads.
     */
    private long navigateTimeoutMs = 30000;

    /**
     * Whether to enable stealth script.
     */
    private boolean stealthEnabled = true;

    /**
     * Optional stealth script, empty uses default.
     */
    private String stealthScript = "";

    public String resolveStealthScript() {
        if (!stealthEnabled) {
            return "";
        }
        if (StringUtils.hasText(stealthScript)) {
            return stealthScript;
        }
        return BrowserStealthSupport.DEFAULT_STEALTH_SCRIPT;
    }

}
