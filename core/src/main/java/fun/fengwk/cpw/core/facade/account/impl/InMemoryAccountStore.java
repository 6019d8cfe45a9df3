package fun.fengwk.cpw.core.facade.account.impl;

import fun.fengwk.cpw.core.facade.account.AccountStore;
import fun.fengwk.cpw.core.facade.account.AccountsProperties;
import fun.fengwk.cpw.core.facade.account.model.AccountRecord;
import fun.fengwk.cpw.core.facade.account.model.AccountStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local account store seeded from configuration.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class InMemoryAccountStore implements AccountStore {

    private static final String SYSTEM_USER = "";

    private final Map<String, AccountRecord> accounts = new ConcurrentHashMap<>();
    private final Map<String, String> preferredAgents = new ConcurrentHashMap<>();

    @Autowired
    public InMemoryAccountStore(AccountsProperties properties) {
        for (AccountsProperties.Item item : properties.getItems()) {
            if (!StringUtils.hasText(item.getId())) {
                continue;
            }
            save(AccountRecord.builder()
                .id(item.getId())
                .name(StringUtils.hasText(item.getName()) ? item.getName() : item.getId())
                .userId(StringUtils.hasText(item.getUserId()) ? item.getUserId() : null)
                .credential(item.getCredential())
                .assignedAgentId(StringUtils.hasText(item.getAssignedAgentId()) ? item.getAssignedAgentId() : null)
                .expectedListingIds(new LinkedHashSet<>(item.getExpectedListingIds()))
                .build());
        }
        properties.getPreferredAgents().forEach((userId, agentId) -> {
            if (StringUtils.hasText(agentId)) {
                preferredAgents.put(userId, agentId);
            }
        });
        if (StringUtils.hasText(properties.getSystemPreferredAgent())) {
            preferredAgents.put(SYSTEM_USER, properties.getSystemPreferredAgent());
        }
        log.info("account store loaded, accounts={}", accounts.size());
    }

    public void save(AccountRecord account) {
        accounts.put(account.getId(), account);
    }

    @Override
    public Optional<AccountRecord> findActiveAccount(String accountId) {
        AccountRecord account = accountId == null ? null : accounts.get(accountId);
        if (account == null || !account.isActive()) {
            return Optional.empty();
        }
        return Optional.of(account.toBuilder().build());
    }

    @Override
    public Optional<AccountRecord> findAccount(String accountId) {
        AccountRecord account = accountId == null ? null : accounts.get(accountId);
        return account == null ? Optional.empty() : Optional.of(account.toBuilder().build());
    }

    @Override
    public List<AccountRecord> listActiveAccounts() {
        List<AccountRecord> active = new ArrayList<>();
        for (AccountRecord account : accounts.values()) {
            if (account.isActive() && account.getStatus() != AccountStatus.COOLDOWN) {
                active.add(account.toBuilder().build());
            }
        }
        return active;
    }

    @Override
    public Optional<String> findPreferredAgent(String userId) {
        return Optional.ofNullable(preferredAgents.get(userId == null ? SYSTEM_USER : userId));
    }

    @Override
    public void setPreferredAgent(String userId, String agentId) {
        preferredAgents.put(userId == null ? SYSTEM_USER : userId, agentId);
    }

    @Override
    public void reportSuccess(String accountId) {
        accounts.computeIfPresent(accountId, (id, account) -> {
            account.setStatus(AccountStatus.IDLE);
            account.setErrorCount(0);
            account.setLastError(null);
            return account;
        });
    }

    @Override
    public void reportChallenged(String accountId, AccountStatus status, String reason) {
        accounts.computeIfPresent(accountId, (id, account) -> {
            account.setStatus(status);
            account.setActive(false);
            account.setLastError(reason);
            return account;
        });
    }

    @Override
    public int reportFailure(String accountId, String error) {
        AccountRecord updated = accounts.computeIfPresent(accountId, (id, account) -> {
            account.setErrorCount(account.getErrorCount() + 1);
            account.setLastError(error);
            account.setStatus(AccountStatus.IDLE);
            return account;
        });
        return updated == null ? 0 : updated.getErrorCount();
    }

    @Override
    public void reportCooldown(String accountId) {
        accounts.computeIfPresent(accountId, (id, account) -> {
            account.setStatus(AccountStatus.COOLDOWN);
            return account;
        });
    }

    @Override
    public void reportLoggedIn(String accountId, String credential) {
        accounts.computeIfPresent(accountId, (id, account) -> {
            account.setCredential(credential);
            account.setActive(true);
            account.setStatus(AccountStatus.IDLE);
            account.setErrorCount(0);
            account.setLastError(null);
            return account;
        });
    }

}
