package fun.fengwk.cpw.core.agent;

import fun.fengwk.cpw.core.hub.auth.PairingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the agent identity at start-up, pairing first when needed, then connects to the hub.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentBootstrap implements ApplicationRunner {

    private final AgentProperties agentProperties;
    private final AgentIdentityStore identityStore;
    private final AgentPairingClient pairingClient;
    private final AgentClient agentClient;

    @Override
    public void run(ApplicationArguments args) {
        agentClient.start(resolveIdentity());
    }

    AgentIdentity resolveIdentity() {
        Optional<AgentIdentity> stored = identityStore.load();
        String hubUrl = firstText(agentProperties.getHubUrl(), stored.map(AgentIdentity::hubUrl).orElse(null));
        if (hubUrl == null) {
            throw new IllegalStateException("hub url missing, configure cpw.agent.hub-url");
        }
        String agentId = firstText(agentProperties.getAgentId(), stored.map(AgentIdentity::agentId).orElse(null));
        if (agentId == null) {
            agentId = "agent-" + UUID.randomUUID();
        }
        // A stored token is bound to the agent id it was issued for.
        String resolvedAgentId = agentId;
        String storedToken = stored
            .filter(identity -> resolvedAgentId.equals(identity.agentId()))
            .map(AgentIdentity::token)
            .orElse(null);
        String token = firstText(agentProperties.getToken(), storedToken);

        if (token == null) {
            if (!StringUtils.hasText(agentProperties.getPairCode())) {
                throw new IllegalStateException("agent token missing, configure cpw.agent.token or cpw.agent.pair-code");
            }
            String pairUrl = firstText(agentProperties.getPairUrl(), AgentPairingClient.derivePairUrl(hubUrl));
            PairingResult result = pairingClient.pair(pairUrl, agentProperties.getPairCode().trim(), agentId);
            token = result.token();
        }

        AgentIdentity identity = new AgentIdentity(agentId, token, hubUrl);
        if (!identity.equals(stored.orElse(null))) {
            identityStore.save(identity);
        }
        log.info("agent identity resolved, agentId={}, hubUrl={}", agentId, hubUrl);
        return identity;
    }

    private static String firstText(String first, String second) {
        if (StringUtils.hasText(first)) {
            return first.trim();
        }
        return StringUtils.hasText(second) ? second.trim() : null;
    }

}
