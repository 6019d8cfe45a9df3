package fun.fengwk.cpw.core.hub.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Progress counters of a long running call.
 *
 * @author fengwk
 */
public record RpcProgress(int total, int current, int success, int failed) {

    /**
     * Parse raw progress. Returns null unless all four counters are numbers.
     */
    public static RpcProgress from(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode total = node.get("total");
        JsonNode current = node.get("current");
        JsonNode success = node.get("success");
        JsonNode failed = node.get("failed");
        if (!isNumber(total) || !isNumber(current) || !isNumber(success) || !isNumber(failed)) {
            return null;
        }
        return new RpcProgress(total.asInt(), current.asInt(), success.asInt(), failed.asInt());
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("total", total);
        node.put("current", current);
        node.put("success", success);
        node.put("failed", failed);
        return node;
    }

    private static boolean isNumber(JsonNode node) {
        return node != null && node.isNumber();
    }

}
