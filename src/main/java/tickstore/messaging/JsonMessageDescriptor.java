package tickstore.messaging;

import java.util.Objects;

/**
 * {@link MessageDescriptor} whose payloads are JSON encoded with a {@link MessageCodec}.
 */
public final class JsonMessageDescriptor<T> implements MessageDescriptor<T> {

    private final String id;
    private final Class<T> payloadType;
    private final MessageCodec codec;

    public JsonMessageDescriptor(String id, Class<T> payloadType) {
        this(id, payloadType, new JsonMessageCodec());
    }

    public JsonMessageDescriptor(String id, Class<T> payloadType, MessageCodec codec) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Message type id cannot be null or blank");
        }
        this.id = id;
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public Class<T> payloadType() {
        return payloadType;
    }

    @Override
    public byte[] encode(T payload) {
        return codec.encode(payload);
    }

    @Override
    public T decode(byte[] data) {
        return codec.decode(data, payloadType);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JsonMessageDescriptor<?> other)) return false;
        return id.equals(other.id) && payloadType.equals(other.payloadType);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
