package fun.fengwk.cpw.core.hub;

import fun.fengwk.cpw.core.hub.protocol.RpcProgress;
import lombok.Builder;
import lombok.Data;

import java.util.function.BiConsumer;

/**
 * @author fengwk
 */
@Data
@Builder
public class CallOptions {

    /**
     * Call budget, null uses the hub default.
     */
    private Long timeoutMs;

    /**
     * Receives progress counters and the optional log line of each progress message.
     */
    private BiConsumer<RpcProgress, String> onProgress;

    public static CallOptions defaults() {
        return CallOptions.builder().build();
    }

}
