package fun.fengwk.cpw.core.hub.auth;

import fun.fengwk.cpw.core.hub.HubProperties;
import fun.fengwk.cpw.core.hub.exception.AgentAuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent credentials: a static shared token, or per-agent tokens obtained through single-use pairing codes.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AgentAuthService {

    static final String PAIR_CODE_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

    private static final int TOKEN_BYTES = 24;

    private final HubProperties hubProperties;
    private final Clock clock;
    private final SecureRandom random;
    private final Map<String, PairCodeGrant> pairCodes = new ConcurrentHashMap<>();
    private final Map<String, TokenRecord> tokens = new ConcurrentHashMap<>();

    @Autowired
    public AgentAuthService(HubProperties hubProperties) {
        this(hubProperties, Clock.systemUTC(), new SecureRandom());
    }

    AgentAuthService(HubProperties hubProperties, Clock clock, SecureRandom random) {
        this.hubProperties = hubProperties;
        this.clock = clock;
        this.random = random;
    }

    public PairCodeGrant createPairCode(String userId, boolean setAsDefault) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId is required");
        }
        purgeExpiredCodes();
        String code;
        do {
            code = randomCode(Math.max(4, hubProperties.getPairCodeLength()));
        } while (pairCodes.containsKey(code));
        PairCodeGrant grant = new PairCodeGrant(code, userId, setAsDefault, clock.millis() + hubProperties.getPairCodeTtlMs());
        pairCodes.put(code, grant);
        log.info("pair code created, userId={}, expiresAt={}", userId, grant.expiresAt());
        return grant;
    }

    /**
     * Consume a pairing code and issue a token bound to the code's user and the given agent.
     */
    public PairingResult redeemPairCode(String code, String agentId) {
        if (!StringUtils.hasText(code) || !StringUtils.hasText(agentId)) {
            throw new AgentAuthException("pair code and agentId are required");
        }
        PairCodeGrant grant = pairCodes.remove(code.trim().toUpperCase(Locale.ROOT));
        if (grant == null) {
            throw new AgentAuthException("invalid pair code");
        }
        if (grant.expiresAt() < clock.millis()) {
            throw new AgentAuthException("pair code expired");
        }
        String token = randomToken();
        long now = clock.millis();
        tokens.put(token, new TokenRecord(grant.userId(), agentId, now, now));
        log.info("agent paired, agentId={}, userId={}", agentId, grant.userId());
        return new PairingResult(agentId, grant.userId(), token, grant.setAsDefault());
    }

    public AgentPrincipal verifyToken(String agentId, String token) {
        if (!StringUtils.hasText(agentId) || !StringUtils.hasText(token)) {
            throw new AgentAuthException("missing agentId or token");
        }
        String sharedToken = hubProperties.getSharedToken();
        if (StringUtils.hasText(sharedToken) && constantTimeEquals(sharedToken, token)) {
            return new AgentPrincipal(agentId, null);
        }
        TokenRecord record = tokens.get(token);
        if (record == null || !record.agentId().equals(agentId)) {
            throw new AgentAuthException("invalid agent token");
        }
        tokens.computeIfPresent(token, (key, value) -> value.withLastUsedAt(clock.millis()));
        return new AgentPrincipal(agentId, record.userId());
    }

    public void revokeAgent(String agentId) {
        tokens.values().removeIf(record -> record.agentId().equals(agentId));
    }

    private void purgeExpiredCodes() {
        long now = clock.millis();
        pairCodes.values().removeIf(grant -> grant.expiresAt() < now);
    }

    private String randomCode(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(PAIR_CODE_ALPHABET.charAt(random.nextInt(PAIR_CODE_ALPHABET.length())));
        }
        return builder.toString();
    }

    private String randomToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private boolean constantTimeEquals(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }

    private record TokenRecord(String userId, String agentId, long createdAt, long lastUsedAt) {

        TokenRecord withLastUsedAt(long time) {
            return new TokenRecord(userId, agentId, createdAt, time);
        }

    }

}
