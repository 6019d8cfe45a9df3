package fun.fengwk.cpw.core.scheduler.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.hub.AgentHub;
import fun.fengwk.cpw.core.hub.protocol.HubMessageCodec;
import fun.fengwk.cpw.core.scheduler.SchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class ExecutionRouterTest {

    @Mock
    private AgentHub agentHub;

    @Mock
    private AccountStore accountStore;

    @Mock
    private LocalScrapeExecutor localScrapeExecutor;

    private ExecutionRouter executionRouter;

    @BeforeEach
    public void setUp() {
        executionRouter = new ExecutionRouter(
            agentHub, accountStore, localScrapeExecutor, new HubMessageCodec(new ObjectMapper()), new SchedulerProperties());
    }

    @Test
    public void shouldUseConnectedAssignedAgent() {
        AccountRecord account = AccountRecord.builder().id("acc1").userId("u1").assignedAgentId("a1").build();
        when(agentHub.isConnected("a1")).thenReturn(true);

        ScrapeExecutor executor = executionRouter.route(account);

        assertThat(executor).isInstanceOf(RemoteScrapeExecutor.class);
        assertThat(executor.describe()).isEqualTo("agent:a1");
    }

    @Test
    public void shouldRunLocallyWhenAssignedAgentIsOffline() {
        AccountRecord account = AccountRecord.builder().id("acc1").userId("u1").assignedAgentId("a1").build();
        when(agentHub.isConnected("a1")).thenReturn(false);

        assertThat(executionRouter.route(account)).isSameAs(localScrapeExecutor);
        verify(accountStore, never()).findPreferredAgent(any());
        verify(agentHub, never()).findSharedAgents();
    }

    @Test
    public void shouldPreferOwnersDefaultAgent() {
        AccountRecord account = AccountRecord.builder().id("acc1").userId("u1").build();
        when(accountStore.findPreferredAgent("u1")).thenReturn(Optional.of("p1"));
        when(agentHub.isConnected("p1")).thenReturn(true);
        when(agentHub.isOwnedBy("p1", "u1")).thenReturn(true);

        assertThat(executionRouter.resolveAgentId(account)).isEqualTo("p1");
    }

    @Test
    public void shouldFallBackToAnyOwnedAgent() {
        AccountRecord account = AccountRecord.builder().id("acc1").userId("u1").build();
        when(accountStore.findPreferredAgent("u1")).thenReturn(Optional.of("p1"));
        when(agentHub.isConnected("p1")).thenReturn(false);
        when(agentHub.findAgentsOwnedBy("u1")).thenReturn(List.of("o1", "o2"));

        assertThat(executionRouter.resolveAgentId(account)).isEqualTo("o1");
    }

    @Test
    public void shouldIgnoreDefaultAgentOwnedBySomeoneElse() {
        AccountRecord account = AccountRecord.builder().id("acc1").userId("u1").build();
        when(accountStore.findPreferredAgent("u1")).thenReturn(Optional.of("p1"));
        when(agentHub.isConnected("p1")).thenReturn(true);
        when(agentHub.isOwnedBy("p1", "u1")).thenReturn(false);
        when(agentHub.findAgentsOwnedBy("u1")).thenReturn(List.of());
        when(agentHub.findSharedAgents()).thenReturn(List.of("s1"));

        assertThat(executionRouter.resolveAgentId(account)).isEqualTo("s1");
    }

    @Test
    public void shouldRouteOwnerlessAccountToSystemAgent() {
        AccountRecord account = AccountRecord.builder().id("acc1").build();
        when(accountStore.findPreferredAgent(null)).thenReturn(Optional.of("sys"));
        when(agentHub.isConnected("sys")).thenReturn(true);
        when(agentHub.isOwnedBy("sys", null)).thenReturn(true);

        assertThat(executionRouter.resolveAgentId(account)).isEqualTo("sys");
        verify(agentHub, never()).findAgentsOwnedBy(any());
    }

    @Test
    public void shouldRunLocallyWithoutAnyAgent() {
        AccountRecord account = AccountRecord.builder().id("acc1").build();
        when(accountStore.findPreferredAgent(null)).thenReturn(Optional.empty());
        when(agentHub.findSharedAgents()).thenReturn(List.of());

        assertThat(executionRouter.route(account)).isSameAs(localScrapeExecutor);
    }

}
