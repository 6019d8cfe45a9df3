package fun.fengwk.cpw.core.hub.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Terminal answer of a call, exactly one per request id.
 *
 * @author fengwk
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RpcResultMessage(String requestId, boolean ok, JsonNode result, String error) implements HubMessage {

    public static RpcResultMessage success(String requestId, JsonNode result) {
        return new RpcResultMessage(requestId, true, result, null);
    }

    public static RpcResultMessage failure(String requestId, String error) {
        return new RpcResultMessage(requestId, false, null, error);
    }

}
