package fun.fengwk.cpw.core.service.browser.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import fun.fengwk.cpw.core.service.browser.BrowserProperties;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class CredentialCookiesTest {

    private static final String COOKIES = """
        [
          {"name": "_tb_token_", "value": "abc", "domain": ".taobao.com", "path": "/", "httpOnly": true,
           "secure": true, "sameSite": "no_restriction", "expirationDate": 1900000000},
          {"name": "cna", "value": "xyz"},
          {"name": "", "value": "ignored"},
          {"name": "t", "value": "1", "url": "https://cart.taobao.com"}
        ]
        """;

    private final CredentialCookies credentialCookies = new CredentialCookies(new BrowserProperties(), new ObjectMapper());

    @Test
    public void shouldParseRawJsonCookies() {
        List<Cookie> cookies = credentialCookies.parse(COOKIES);

        assertThat(cookies).hasSize(3);
        Cookie token = cookies.get(0);
        assertThat(token.name).isEqualTo("_tb_token_");
        assertThat(token.domain).isEqualTo(".taobao.com");
        assertThat(token.httpOnly).isTrue();
        assertThat(token.sameSite).isEqualTo(SameSiteAttribute.NONE);
        assertThat(token.expires).isEqualTo(1900000000d);
        assertThat(cookies.get(1).domain).isEqualTo(".taobao.com");
        assertThat(cookies.get(1).path).isEqualTo("/");
        assertThat(cookies.get(2).url).isEqualTo("https://cart.taobao.com");
    }

    @Test
    public void shouldParseBase64Cookies() {
        String encoded = Base64.getEncoder().encodeToString(COOKIES.getBytes(StandardCharsets.UTF_8));

        assertThat(credentialCookies.parse(encoded)).hasSize(3);
    }

    @Test
    public void shouldReturnEmptyForBlankCredential() {
        assertThat(credentialCookies.parse("  ")).isEmpty();
        assertThat(credentialCookies.parse(null)).isEmpty();
    }

    @Test
    public void shouldRejectNonArrayCredential() {
        assertThatThrownBy(() -> credentialCookies.parse("[}"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("invalid credential cookies");
        assertThatThrownBy(() -> credentialCookies.parse(Base64.getEncoder().encodeToString("{}".getBytes(StandardCharsets.UTF_8))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("expected json array");
    }

    @Test
    public void shouldFingerprintStably() {
        String first = CredentialCookies.fingerprint("cred");

        assertThat(first).isEqualTo(CredentialCookies.fingerprint("cred"));
        assertThat(first).startsWith("4:").hasSize(18);
        assertThat(first).isNotEqualTo(CredentialCookies.fingerprint("cred2"));
    }

}
