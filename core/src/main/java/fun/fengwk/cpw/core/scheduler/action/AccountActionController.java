package fun.fengwk.cpw.core.scheduler.action;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator actions on an account: interactive login and bulk cart add.
 *
 * @author fengwk
 */
@RestController
@RequiredArgsConstructor
public class AccountActionController {

    private final LoginCoordinator loginCoordinator;
    private final CartAddCoordinator cartAddCoordinator;

    @PostMapping("/api/accounts/{accountId}/login")
    public LoginView startLogin(@PathVariable String accountId) {
        return loginCoordinator.start(accountId);
    }

    @GetMapping("/api/accounts/{accountId}/login")
    public ResponseEntity<LoginView> getLogin(@PathVariable String accountId) {
        return loginCoordinator.find(accountId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/api/accounts/{accountId}/login/cancel")
    public Map<String, Boolean> cancelLogin(@PathVariable String accountId) {
        return Map.of("cancelled", loginCoordinator.cancel(accountId));
    }

    @PostMapping("/api/accounts/{accountId}/cart-add/{listingId}")
    public CartAddView startCartAdd(
        @PathVariable String accountId,
        @PathVariable String listingId,
        @RequestParam(required = false) Integer maxSkus
    ) {
        return cartAddCoordinator.start(accountId, listingId, maxSkus);
    }

    @GetMapping("/api/accounts/{accountId}/cart-add")
    public ResponseEntity<CartAddView> getCartAdd(@PathVariable String accountId) {
        return cartAddCoordinator.find(accountId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleConflict(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", String.valueOf(ex.getMessage())));
    }

}
