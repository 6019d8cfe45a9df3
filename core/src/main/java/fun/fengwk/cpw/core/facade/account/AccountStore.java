package fun.fengwk.cpw.core.facade.account;

import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.facade.account.model.AccountStatus;

import java.util.List;
import java.util.Optional;

/**
 * Account and credential store. The core reads accounts and reports scrape outcomes, the store
 * decides how those outcomes change its records.
 *
 * @author fengwk
 */
public interface AccountStore {

    Optional<AccountRecord> findActiveAccount(String accountId);

    /**
     * Any account regardless of status, login may revive a challenged one.
     */
    Optional<AccountRecord> findAccount(String accountId);

    List<AccountRecord> listActiveAccounts();

    /**
     * Preferred agent of a user, or of the system when {@code userId} is null.
     */
    Optional<String> findPreferredAgent(String userId);

    void setPreferredAgent(String userId, String agentId);

    void reportSuccess(String accountId);

    /**
     * The site challenged the account, it must stop being scheduled.
     */
    void reportChallenged(String accountId, AccountStatus status, String reason);

    /**
     * @return consecutive failure count after this failure
     */
    int reportFailure(String accountId, String error);

    void reportCooldown(String accountId);

    /**
     * Store the credential of a successful login and put the account back into rotation.
     */
    void reportLoggedIn(String accountId, String credential);

}
