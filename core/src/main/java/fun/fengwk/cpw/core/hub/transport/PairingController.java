package fun.fengwk.cpw.core.hub.transport;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.hub.AgentHub;
import fun.fengwk.cpw.core.hub.AgentSummary;
import fun.fengwk.cpw.core.hub.auth.AgentAuthService;
import fun.fengwk.cpw.core.hub.auth.PairCodeGrant;
import fun.fengwk.cpw.core.hub.auth.PairingResult;
import fun.fengwk.cpw.core.hub.exception.AgentAuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Agent pairing and listing endpoints.
 *
 * @author fengwk
 */
@Slf4j
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class PairingController {

    private final AgentAuthService agentAuthService;
    private final AgentHub agentHub;
    private final AccountStore accountStore;

    @PostMapping("/pair-codes")
    public PairCodeGrant createPairCode(@RequestBody PairCodeRequest request) {
        return agentAuthService.createPairCode(request.userId(), Boolean.TRUE.equals(request.setAsDefault()));
    }

    /**
     * Called by agents at startup, the returned token authenticates the websocket.
     */
    @PostMapping("/pair")
    public PairingResult pair(@RequestBody PairRequest request) {
        PairingResult result = agentAuthService.redeemPairCode(request.code(), request.agentId());
        if (result.setAsDefault()) {
            accountStore.setPreferredAgent(result.userId(), result.agentId());
            log.info("preferred agent updated, userId={}, agentId={}", result.userId(), result.agentId());
        }
        return result;
    }

    @GetMapping
    public List<AgentSummary> listAgents() {
        return agentHub.listConnectedAgents();
    }

    @ExceptionHandler({AgentAuthException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    public record PairCodeRequest(String userId, Boolean setAsDefault) {
    }

    public record PairRequest(String code, String agentId) {
    }

}
