package fun.fengwk.cpw.core.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fun.fengwk.cpw.core.hub.protocol.AgentMethods;
import fun.fengwk.cpw.core.hub.protocol.HubMessage;
import fun.fengwk.cpw.core.hub.protocol.HubMessageCodec;
import fun.fengwk.cpw.core.hub.protocol.RpcMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcProgressMessage;
import fun.fengwk.cpw.core.hub.protocol.RpcResultMessage;
import fun.fengwk.cpw.core.service.browser.session.AccountSessionManager;
import fun.fengwk.cpw.core.service.cart.CartScrapeService;
import fun.fengwk.cpw.core.service.cart.model.CartCollectResult;
import fun.fengwk.cpw.core.service.cart.model.CartLineItem;
import fun.fengwk.cpw.core.service.cart.model.CollectStopReason;
import fun.fengwk.cpw.core.service.cartadd.BulkAddListener;
import fun.fengwk.cpw.core.service.cartadd.BulkCartAddService;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddRequest;
import fun.fengwk.cpw.core.service.cartadd.model.BulkAddResult;
import fun.fengwk.cpw.core.service.coordination.AccountTaskCoordinator;
import fun.fengwk.cpw.core.service.login.AccountLoginService;
import fun.fengwk.cpw.core.service.login.LoginListener;
import fun.fengwk.cpw.core.service.login.model.LoginResult;
import fun.fengwk.cpw.core.service.scrape.NeedsCaptchaException;
import fun.fengwk.cpw.core.service.variant.VariantScrapeService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class AgentRpcDispatcherTest {

    @Mock
    private CartScrapeService cartScrapeService;

    @Mock
    private VariantScrapeService variantScrapeService;

    @Mock
    private AccountSessionManager accountSessionManager;

    @Mock
    private BulkCartAddService bulkCartAddService;

    @Mock
    private AccountLoginService accountLoginService;

    private ObjectMapper objectMapper;
    private AgentRpcDispatcher dispatcher;

    @BeforeEach
    public void setUp() {
        objectMapper = new ObjectMapper();
        dispatcher = new AgentRpcDispatcher(
            cartScrapeService,
            variantScrapeService,
            new AccountTaskCoordinator(),
            accountSessionManager,
            bulkCartAddService,
            accountLoginService,
            new HubMessageCodec(objectMapper),
            new AgentProperties()
        );
    }

    @AfterEach
    public void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    public void shouldRejectUnknownMethod() {
        assertThatThrownBy(() -> dispatcher.invoke("r1", "dropTables", params("acc1"), message -> {
        }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unknown method: dropTables");
    }

    @Test
    public void shouldValidateParams() {
        assertThatThrownBy(() -> dispatcher.invoke("r1", AgentMethods.SCRAPE_CART, objectMapper.createArrayNode(), message -> {
        }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("params must be an object");
        assertThatThrownBy(() -> dispatcher.invoke("r1", AgentMethods.PAUSE_ADD_FOR_SCRAPE, objectMapper.createObjectNode(), message -> {
        }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("accountId is required");
    }

    @Test
    public void shouldScrapeCartAndReportProgress() {
        CartCollectResult result = CartCollectResult.builder()
            .items(List.of(CartLineItem.builder().listingId("1001").skuId("s1").build()))
            .stopReason(CollectStopReason.EXPECTED_SATISFIED)
            .build();
        when(cartScrapeService.scrapeCart("acc1", "cookies", Set.of("1001"))).thenReturn(result);
        ObjectNode params = params("acc1");
        params.put("credential", "cookies");
        params.putArray("expectedListingIds").add("1001");
        List<HubMessage> sent = new ArrayList<>();

        JsonNode node = dispatcher.invoke("r1", AgentMethods.SCRAPE_CART, params, sent::add);

        assertThat(node.path("items").get(0).path("listingId").asText()).isEqualTo("1001");
        assertThat(node.path("stopReason").asText()).isEqualTo("EXPECTED_SATISFIED");
        assertThat(sent).hasSize(2).allMatch(message -> message instanceof RpcProgressMessage);
        RpcProgressMessage finished = (RpcProgressMessage) sent.get(1);
        assertThat(finished.progress().path("current").asInt()).isEqualTo(1);
        assertThat(finished.log()).isEqualTo("cart scrape finished, reason=EXPECTED_SATISFIED");
    }

    @Test
    public void shouldAnswerPauseAndResumeWithoutBulkOperation() {
        JsonNode paused = dispatcher.invoke("r1", AgentMethods.PAUSE_ADD_FOR_SCRAPE, params("acc1").put("timeoutMs", 10), m -> {
        });
        JsonNode resumed = dispatcher.invoke("r2", AgentMethods.RESUME_ADD_FOR_SCRAPE, params("acc1"), m -> {
        });

        assertThat(paused.path("paused").asBoolean(true)).isFalse();
        assertThat(resumed.path("wasPaused").asBoolean(true)).isFalse();
    }

    @Test
    public void shouldReportBrowserStatus() {
        when(accountSessionManager.listSessionSummaries()).thenReturn(List.of());

        JsonNode status = dispatcher.invoke("r1", AgentMethods.GET_BROWSER_STATUS, null, m -> {
        });

        assertThat(status.path("busy").asBoolean(true)).isFalse();
        assertThat(status.path("sessions").isArray()).isTrue();
    }

    @Test
    public void shouldEncodeScrapeErrorsInResult() throws Exception {
        when(variantScrapeService.enumerateVariants(anyString(), any(), anyString()))
            .thenThrow(new NeedsCaptchaException("slider"));
        BlockingQueue<HubMessage> sent = new LinkedBlockingQueue<>();
        ObjectNode params = params("acc1").put("listingId", "1001");

        dispatcher.dispatch(new RpcMessage("r1", AgentMethods.ENUMERATE_VARIANTS, params), sent::add);

        HubMessage message = sent.poll(5, TimeUnit.SECONDS);
        assertThat(message).isEqualTo(RpcResultMessage.failure("r1", "NEEDS_CAPTCHA: slider"));
    }

    @Test
    public void shouldAnswerUnknownMethodWithFailure() throws Exception {
        BlockingQueue<HubMessage> sent = new LinkedBlockingQueue<>();

        dispatcher.dispatch(new RpcMessage("r1", "nope", params("acc1")), sent::add);

        HubMessage message = sent.poll(5, TimeUnit.SECONDS);
        assertThat(message).isEqualTo(RpcResultMessage.failure("r1", "Unknown method: nope"));
    }

    @Test
    public void shouldForwardBulkCartAddProgress() throws Exception {
        when(bulkCartAddService.addAllVariants(eq("acc1"), eq("cookies"), any(BulkAddRequest.class), any(BulkAddListener.class)))
            .thenAnswer(invocation -> {
                BulkAddListener listener = invocation.getArgument(3);
                listener.onProgress(2, 1, 1, 0, "added 颜色:红色");
                return BulkAddResult.builder().listingId("1001").totalSkus(2).successCount(2).build();
            });
        ObjectNode params = params("acc1").put("credential", "cookies").put("listingId", "1001").put("maxSkus", 2);
        params.putArray("existingSkuProperties").add("红色 M");
        List<HubMessage> sent = new ArrayList<>();

        JsonNode node = dispatcher.invoke("r1", AgentMethods.ADD_ALL_SKUS_TO_CART, params, sent::add);

        assertThat(node.path("successCount").asInt()).isEqualTo(2);
        RpcProgressMessage progress = (RpcProgressMessage) sent.get(0);
        assertThat(progress.progress().path("total").asInt()).isEqualTo(2);
        assertThat(progress.log()).isEqualTo("added 颜色:红色");
        ArgumentCaptor<BulkAddRequest> request = ArgumentCaptor.forClass(BulkAddRequest.class);
        verify(bulkCartAddService).addAllVariants(eq("acc1"), eq("cookies"), request.capture(), any(BulkAddListener.class));
        assertThat(request.getValue().getExistingSkuProperties()).containsExactly("红色 M");
        assertThat(request.getValue().getMaxSkus()).isEqualTo(2);
    }

    @Test
    public void shouldStreamLoginScreenshotsAsProgressLog() throws Exception {
        when(accountLoginService.login(eq("acc1"), any(LoginListener.class))).thenAnswer(invocation -> {
            LoginListener listener = invocation.getArgument(1);
            listener.onScreenshot("aW1n");
            return new LoginResult("[]");
        });
        List<HubMessage> sent = new ArrayList<>();

        JsonNode node = dispatcher.invoke("r1", AgentMethods.LOGIN_ACCOUNT, params("acc1"), sent::add);

        assertThat(node.path("cookies").asText()).isEqualTo("[]");
        RpcProgressMessage progress = (RpcProgressMessage) sent.get(0);
        JsonNode screenshot = objectMapper.readTree(progress.log());
        assertThat(screenshot.path("type").asText()).isEqualTo("screenshot");
        assertThat(screenshot.path("image").asText()).isEqualTo("aW1n");
    }

    @Test
    public void shouldCancelLoginWhileBrowserThreadIsBusy() throws Exception {
        CountDownLatch scrapeRunning = new CountDownLatch(1);
        CountDownLatch releaseScrape = new CountDownLatch(1);
        doAnswer(invocation -> {
            scrapeRunning.countDown();
            releaseScrape.await(5, TimeUnit.SECONDS);
            return List.of();
        }).when(variantScrapeService).enumerateVariants(anyString(), any(), anyString());
        when(accountLoginService.cancel("acc1")).thenReturn(true);
        BlockingQueue<HubMessage> sent = new LinkedBlockingQueue<>();

        dispatcher.dispatch(new RpcMessage("r1", AgentMethods.ENUMERATE_VARIANTS, params("acc1").put("listingId", "1001")), sent::add);
        assertThat(scrapeRunning.await(5, TimeUnit.SECONDS)).isTrue();
        dispatcher.dispatch(new RpcMessage("r2", AgentMethods.CANCEL_LOGIN, params("acc1")), sent::add);

        HubMessage message = sent.poll(5, TimeUnit.SECONDS);
        while (message != null && !(message instanceof RpcResultMessage)) {
            message = sent.poll(5, TimeUnit.SECONDS);
        }
        releaseScrape.countDown();
        assertThat(message).isInstanceOf(RpcResultMessage.class);
        RpcResultMessage result = (RpcResultMessage) message;
        assertThat(result.requestId()).isEqualTo("r2");
        assertThat(result.result().path("cancelled").asBoolean()).isTrue();
    }

    private ObjectNode params(String accountId) {
        return objectMapper.createObjectNode().put("accountId", accountId);
    }

}
