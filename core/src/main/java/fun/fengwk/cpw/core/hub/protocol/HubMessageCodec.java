package fun.fengwk.cpw.core.hub.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decodes wire text into typed hub messages once at the connection boundary.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class HubMessageCodec {

    private final ObjectMapper objectMapper;

    public String encode(HubMessage message) {
        try {
            return objectMapper.writerFor(HubMessage.class).writeValueAsString(message);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to encode hub message: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * @throws IllegalArgumentException when the text is not a known hub message
     */
    public HubMessage decode(String text) {
        try {
            HubMessage message = objectMapper.readValue(text, HubMessage.class);
            if (message == null) {
                throw new IllegalArgumentException("invalid hub message: empty payload");
            }
            return message;
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("invalid hub message: " + ex.getOriginalMessage(), ex);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

}
