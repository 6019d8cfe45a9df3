package fun.fengwk.cpw.core.hub.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Closed set of messages exchanged between hub and agent, discriminated by {@code type}.
 *
 * @author fengwk
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = HelloMessage.class, name = "hello"),
    @JsonSubTypes.Type(value = RpcMessage.class, name = "rpc"),
    @JsonSubTypes.Type(value = RpcProgressMessage.class, name = "rpc_progress"),
    @JsonSubTypes.Type(value = RpcResultMessage.class, name = "rpc_result"),
    @JsonSubTypes.Type(value = PingMessage.class, name = "ping"),
    @JsonSubTypes.Type(value = PongMessage.class, name = "pong")
})
public interface HubMessage {
}
