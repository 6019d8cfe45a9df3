package fun.fengwk.cpw.core.hub.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Sent by the agent right after connecting.
 *
 * @author fengwk
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record HelloMessage(String agentId, String name, String version, Map<String, Object> capabilities)
    implements HubMessage {
}
