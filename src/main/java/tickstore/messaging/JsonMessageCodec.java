package tickstore.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

public final class JsonMessageCodec implements MessageCodec {

    private final ObjectMapper objectMapper;

    public JsonMessageCodec() {
        this.objectMapper = createConfiguredObjectMapper();
    }

    /**
     * Creates an ObjectMapper for serializing payload records.
     * Jackson automatically handles byte[] fields as Base64 in JSON.
     * Unknown properties are rejected so that a payload written by a different
     * message schema fails loudly instead of decoding into a partial value.
     */
    public static ObjectMapper createConfiguredObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    @Override
    public byte[] encode(Object obj) {
        if (obj == null) {
            throw new MessageCodecException("Cannot encode null object");
        }
        try {
            return objectMapper.writeValueAsBytes(obj);
        } catch (JsonProcessingException e) {
            throw new MessageCodecException("Failed to encode " + obj.getClass().getSimpleName(), e);
        }
    }

    @Override
    public <T> T decode(byte[] data, Class<T> type) {
        if (data == null) {
            throw new MessageCodecException("Cannot decode null data to " + type.getSimpleName());
        }
        try {
            return objectMapper.readValue(data, type);
        } catch (IOException e) {
            throw new MessageCodecException("Failed to decode to " + type.getSimpleName(), e);
        }
    }
}
