package fun.fengwk.cpw.core.hub.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Intermediate progress of a running call. {@code progress} stays raw until the hub validated it.
 *
 * @author fengwk
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RpcProgressMessage(String requestId, JsonNode progress, String log) implements HubMessage {

    public static RpcProgressMessage of(String requestId, RpcProgress progress, String log) {
        return new RpcProgressMessage(requestId, progress.toJson(), log);
    }

}
