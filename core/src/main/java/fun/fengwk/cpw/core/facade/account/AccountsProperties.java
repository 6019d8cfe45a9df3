package fun.fengwk.cpw.core.facade.account;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Accounts seeded into the in-memory account store.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "cpw.accounts")
public class AccountsProperties {

    private List<Item> items = new ArrayList<>();

    /**
     * Preferred agent per user id.
     */
    private Map<String, String> preferredAgents = new HashMap<>();

    /**
     * Preferred agent for accounts without owner.
     */
    private String systemPreferredAgent = "";

    @Data
    public static class Item {

        private String id;

        private String name;

        private String userId;

        private String credential;

        private String assignedAgentId;

        private List<String> expectedListingIds = new ArrayList<>();

    }

}
