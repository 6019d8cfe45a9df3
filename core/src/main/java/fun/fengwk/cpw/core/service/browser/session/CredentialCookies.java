package fun.fengwk.cpw.core.service.browser.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import fun.fengwk.cpw.core.service.browser.BrowserProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Parses stored account credential material into browser cookies.
 *
 * <p>Credential material is a JSON array of cookie objects, either raw or base64 encoded.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class CredentialCookies {

    private final BrowserProperties browserProperties;
    private final ObjectMapper objectMapper;

    /**
     * Short stable fingerprint of credential material, {@code {length}:{sha256 prefix}}.
     */
    public static String fingerprint(String credential) {
        String value = credential == null ? "" : credential;
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return value.length() + ":" + HexFormat.of().formatHex(digest).substring(0, 16);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("sha-256 not available", ex);
        }
    }

    public List<Cookie> parse(String credential) {
        if (!StringUtils.hasText(credential)) {
            return List.of();
        }
        JsonNode root = readTree(credential.trim());
        if (!root.isArray()) {
            throw new IllegalArgumentException("invalid credential cookies: expected json array");
        }
        List<Cookie> cookies = new ArrayList<>();
        for (JsonNode node : root) {
            Cookie cookie = toCookie(node);
            if (cookie != null) {
                cookies.add(cookie);
            }
        }
        return cookies;
    }

    private JsonNode readTree(String credential) {
        String json = credential.startsWith("[") ? credential : decodeBase64(credential);
        try {
            return objectMapper.readTree(json);
        } catch (Exception ex) {
            throw new IllegalArgumentException("invalid credential cookies: " + ex.getMessage(), ex);
        }
    }

    private String decodeBase64(String credential) {
        try {
            return new String(Base64.getDecoder().decode(credential), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            try {
                return new String(Base64.getUrlDecoder().decode(credential), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException urlEx) {
                throw new IllegalArgumentException("invalid credential cookies: neither json nor base64", urlEx);
            }
        }
    }

    private Cookie toCookie(JsonNode node) {
        String name = node.path("name").asText("");
        if (!StringUtils.hasText(name)) {
            return null;
        }
        Cookie cookie = new Cookie(name, node.path("value").asText(""));
        String url = node.path("url").asText("");
        String domain = node.path("domain").asText("");
        if (StringUtils.hasText(url) && !StringUtils.hasText(domain)) {
            cookie.setUrl(url);
        } else {
            cookie.setDomain(StringUtils.hasText(domain) ? domain : browserProperties.getCookieDefaultDomain());
            cookie.setPath(node.path("path").asText("/"));
        }
        double expires = node.has("expires") ? node.path("expires").asDouble(-1)
            : node.path("expirationDate").asDouble(-1);
        if (expires > 0) {
            cookie.setExpires(expires);
        }
        if (node.has("httpOnly")) {
            cookie.setHttpOnly(node.path("httpOnly").asBoolean());
        }
        if (node.has("secure")) {
            cookie.setSecure(node.path("secure").asBoolean());
        }
        SameSiteAttribute sameSite = parseSameSite(node.path("sameSite").asText(""));
        if (sameSite != null) {
            cookie.setSameSite(sameSite);
        }
        return cookie;
    }

    private SameSiteAttribute parseSameSite(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "strict" -> SameSiteAttribute.STRICT;
            case "lax" -> SameSiteAttribute.LAX;
            case "none", "no_restriction" -> SameSiteAttribute.NONE;
            default -> null;
        };
    }

}
