package fun.fengwk.cpw.core.scheduler.execution;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.hub.AgentHub;
import fun.fengwk.cpw.core.hub.protocol.HubMessageCodec;
import fun.fengwk.cpw.core.scheduler.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * Picks the execution surface of an account.
 *
 * <ol>
 *     <li>An assigned agent is used only when it is connected, otherwise the job runs locally.</li>
 *     <li>Accounts with an owner use the owner's preferred agent, then any connected agent the owner
 *     owns, then a shared agent.</li>
 *     <li>Ownerless accounts use the system preferred agent or any shared agent.</li>
 *     <li>Everything else runs locally.</li>
 * </ol>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionRouter {

    private final AgentHub agentHub;
    private final AccountStore accountStore;
    private final LocalScrapeExecutor localScrapeExecutor;
    private final HubMessageCodec hubMessageCodec;
    private final SchedulerProperties schedulerProperties;

    public ScrapeExecutor route(AccountRecord account) {
        String agentId = resolveAgentId(account);
        if (agentId == null) {
            return localScrapeExecutor;
        }
        return new RemoteScrapeExecutor(agentHub, hubMessageCodec.getObjectMapper(), schedulerProperties, agentId);
    }

    String resolveAgentId(AccountRecord account) {
        String assigned = account.getAssignedAgentId();
        if (StringUtils.hasText(assigned)) {
            if (agentHub.isConnected(assigned)) {
                return assigned;
            }
            log.warn("assigned agent offline, running locally, accountId={}, agentId={}", account.getId(), assigned);
            return null;
        }

        String userId = StringUtils.hasText(account.getUserId()) ? account.getUserId() : null;
        Optional<String> preferred = accountStore.findPreferredAgent(userId);
        if (preferred.isPresent() && agentHub.isConnected(preferred.get()) && agentHub.isOwnedBy(preferred.get(), userId)) {
            return preferred.get();
        }
        if (userId != null) {
            List<String> owned = agentHub.findAgentsOwnedBy(userId);
            if (!owned.isEmpty()) {
                return owned.get(0);
            }
        }
        List<String> shared = agentHub.findSharedAgents();
        return shared.isEmpty() ? null : shared.get(0);
    }

}
