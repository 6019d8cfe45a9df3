package fun.fengwk.cpw.core.facade.account.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Read view of a tracked account.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AccountRecord {

    private String id;

    private String name;

    /**
     * Owning user, null for system accounts.
     */
    private String userId;

    /**
     * Cookie material, JSON array or its base64 form.
     */
    private String credential;

    /**
     * Agent explicitly bound to this account, null when unbound.
     */
    private String assignedAgentId;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private AccountStatus status = AccountStatus.IDLE;

    private int errorCount;

    private String lastError;

    /**
     * Listings monitored through this account cart.
     */
    @Builder.Default
    private Set<String> expectedListingIds = new LinkedHashSet<>();

}
