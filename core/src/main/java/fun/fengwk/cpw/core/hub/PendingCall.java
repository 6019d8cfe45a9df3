package fun.fengwk.cpw.core.hub;

import com.fasterxml.jackson.databind.JsonNode;
import fun.fengwk.cpw.core.hub.protocol.RpcProgress;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.BiConsumer;

/**
 * One in-flight call, owned by the connection it was sent on.
 *
 * @author fengwk
 */
class PendingCall {

    final String requestId;
    final String method;
    final ConnectedAgent owner;
    final CompletableFuture<JsonNode> future = new CompletableFuture<>();
    final BiConsumer<RpcProgress, String> onProgress;
    volatile ScheduledFuture<?> timeoutTask;

    PendingCall(String requestId, String method, ConnectedAgent owner, BiConsumer<RpcProgress, String> onProgress) {
        this.requestId = requestId;
        this.method = method;
        this.owner = owner;
        this.onProgress = onProgress;
    }

    void cancelTimeout() {
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
    }

}
