package fun.fengwk.cpw.core.service.login;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Interactive login configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.login")
public class LoginProperties {

    private String loginUrl = "https://login.taobao.com/member/login.jhtml";

    /**
     * How long the operator has to scan the code or type the password.
     */
    private long timeoutMs = 10 * 60 * 1000;

    private long pollIntervalMs = 1500;

    private int screenshotQuality = 85;

    private long screenshotTimeoutMs = 15000;

    /**
     * Hosts that mean the page still shows the login form.
     */
    private List<String> loginHosts = List.of("login.taobao.com", "login.tmall.com");

    /**
     * Any of these cookies on a site domain proves the login went through.
     */
    private List<String> authCookieNames = List.of("_m_h5_tk", "_m_h5_tk_enc", "login", "munb", "lgc", "tracknick");

    private List<String> authCookieDomains = List.of("taobao.com", "tmall.com", "alicdn.com");

}
