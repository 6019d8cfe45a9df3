package fun.fengwk.cpw.core.hub.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.cpw.core.agent.AgentClient;
import fun.fengwk.cpw.core.agent.AgentIdentity;
import fun.fengwk.cpw.core.agent.AgentProperties;
import fun.fengwk.cpw.core.agent.AgentRpcDispatcher;
import fun.fengwk.cpw.core.hub.AgentHub;
import fun.fengwk.cpw.core.hub.CallOptions;
import fun.fengwk.cpw.core.hub.HubProperties;
import fun.fengwk.cpw.core.hub.auth.AgentAuthService;
import fun.fengwk.cpw.core.hub.protocol.AgentMethods;
import fun.fengwk.cpw.core.hub.protocol.HubMessage;
import fun.fengwk.cpw.core.hub.protocol.HubMessageCodec;
import fun.fengwk.cpw.core.hub.protocol.RpcMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcResultMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;

import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

/**
 * Hub and agent talking over a real websocket on a random port.
 *
 * @author fengwk
 */
@SpringBootTest(
    classes = HubWebSocketRoundTripTest.HubTestApplication.class,
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "cpw.hub.shared-token=shared-secret"
)
public class HubWebSocketRoundTripTest {

    private static final int LARGE_SIZE = 64 * 1024;

    @LocalServerPort
    private int port;

    @Autowired
    private AgentHub agentHub;

    @Autowired
    private HubMessageCodec codec;

    private AgentClient agentClient;

    @AfterEach
    public void tearDown() {
        if (agentClient != null) {
            agentClient.stop();
        }
    }

    @Test
    public void shouldCarryFramesLargerThanContainerDefault() throws Exception {
        AtomicReference<RpcMessage> received = new AtomicReference<>();
        AgentRpcDispatcher dispatcher = mock(AgentRpcDispatcher.class);
        doAnswer(invocation -> {
            RpcMessage rpc = invocation.getArgument(0);
            Consumer<HubMessage> sender = invocation.getArgument(1);
            received.set(rpc);
            sender.accept(RpcResultMessage.success(rpc.requestId(), largeCart()));
            return null;
        }).when(dispatcher).dispatch(any(), any());

        agentClient = new AgentClient(new AgentProperties(), codec, dispatcher);
        agentClient.start(new AgentIdentity("a1", "shared-secret", "ws://127.0.0.1:" + port + "/ws/agent"));
        awaitConnected("a1");

        String credential = "x".repeat(LARGE_SIZE);
        JsonNode result = agentHub.call(
            "a1",
            AgentMethods.SCRAPE_CART,
            Map.of("accountId", "acc1", "credential", credential),
            CallOptions.builder().timeoutMs(10_000L).build()
        ).get(15, TimeUnit.SECONDS);

        assertThat(received.get().params().path("credential").asText()).hasSize(LARGE_SIZE);
        assertThat(result.path("items").size()).isEqualTo(500);
        assertThat(codec.getObjectMapper().writeValueAsString(result).length()).isGreaterThan(LARGE_SIZE);
        assertThat(agentHub.isConnected("a1")).isTrue();
    }

    private JsonNode largeCart() {
        ObjectNode cart = JsonNodeFactory.instance.objectNode();
        ArrayNode items = cart.putArray("items");
        for (int i = 0; i < 500; i++) {
            items.addObject()
                .put("listingId", String.valueOf(600000000000L + i))
                .put("skuId", "sku-" + i)
                .put("title", "line item number " + i + " with a reasonably long product title")
                .put("finalPrice", "19.90");
        }
        cart.put("stopReason", "BOTTOM_REACHED");
        return cart;
    }

    private void awaitConnected(String agentId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!agentHub.isConnected(agentId) && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(agentHub.isConnected(agentId)).isTrue();
    }

    @SpringBootConfiguration
    @EnableAutoConfiguration
    @Import({HubProperties.class, AgentAuthService.class, HubMessageCodec.class, AgentHub.class, HubWebSocketConfiguration.class})
    static class HubTestApplication {
    }

}
