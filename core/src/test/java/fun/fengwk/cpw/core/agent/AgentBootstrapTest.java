package fun.fengwk.cpw.core.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.cpw.core.hub.auth.PairingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class AgentBootstrapTest {

    @TempDir
    Path tempDir;

    @Mock
    private AgentPairingClient pairingClient;

    @Mock
    private AgentClient agentClient;

    private AgentProperties agentProperties;
    private AgentIdentityStore identityStore;
    private AgentBootstrap bootstrap;

    @BeforeEach
    public void setUp() {
        agentProperties = new AgentProperties();
        identityStore = new AgentIdentityStore(new ObjectMapper(), tempDir.resolve("identity.json"));
        bootstrap = new AgentBootstrap(agentProperties, identityStore, pairingClient, agentClient);
    }

    @Test
    public void shouldUseConfiguredCredentialAndPersistIt() {
        agentProperties.setHubUrl("ws://hub:8080/ws/agent");
        agentProperties.setAgentId("a1");
        agentProperties.setToken("secret");

        AgentIdentity identity = bootstrap.resolveIdentity();

        assertThat(identity).isEqualTo(new AgentIdentity("a1", "secret", "ws://hub:8080/ws/agent"));
        assertThat(identityStore.load()).contains(identity);
        verify(pairingClient, never()).pair(anyString(), anyString(), anyString());
    }

    @Test
    public void shouldReuseStoredIdentity() {
        AgentIdentity stored = new AgentIdentity("a1", "stored-token", "ws://hub:8080/ws/agent");
        identityStore.save(stored);

        assertThat(bootstrap.resolveIdentity()).isEqualTo(stored);
    }

    @Test
    public void shouldPairWithCodeWhenNoTokenIsKnown() {
        agentProperties.setHubUrl("wss://hub.example.com/ws/agent");
        agentProperties.setAgentId("a1");
        agentProperties.setPairCode(" ABCD2345 ");
        when(pairingClient.pair("https://hub.example.com/api/agents/pair", "ABCD2345", "a1"))
            .thenReturn(new PairingResult("a1", "u1", "paired-token", false));

        AgentIdentity identity = bootstrap.resolveIdentity();

        assertThat(identity.token()).isEqualTo("paired-token");
        assertThat(identityStore.load()).contains(identity);
    }

    @Test
    public void shouldNotReuseTokenIssuedForAnotherAgentId() {
        identityStore.save(new AgentIdentity("old", "old-token", "ws://hub:8080/ws/agent"));
        agentProperties.setAgentId("new");

        assertThatThrownBy(() -> bootstrap.resolveIdentity())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageStartingWith("agent token missing");
    }

    @Test
    public void shouldGenerateAgentIdWhenNoneIsKnown() {
        agentProperties.setHubUrl("ws://hub:8080/ws/agent");
        agentProperties.setPairCode("CODE");
        when(pairingClient.pair(anyString(), anyString(), anyString()))
            .thenAnswer(invocation -> new PairingResult(invocation.getArgument(2), null, "t", false));

        AgentIdentity identity = bootstrap.resolveIdentity();

        assertThat(identity.agentId()).startsWith("agent-");
    }

    @Test
    public void shouldRequireHubUrl() {
        assertThatThrownBy(() -> bootstrap.resolveIdentity())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageStartingWith("hub url missing");
    }

    @Test
    public void shouldDerivePairUrlFromHubUrl() {
        assertThat(AgentPairingClient.derivePairUrl("ws://localhost:8080/ws/agent"))
            .isEqualTo("http://localhost:8080/api/agents/pair");
        assertThat(AgentPairingClient.derivePairUrl("wss://hub.example.com/ws/agent?x=1"))
            .isEqualTo("https://hub.example.com/api/agents/pair");
    }

}
