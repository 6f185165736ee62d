package tickstore.messaging;

/**
 * Describes one kind of transaction message the simulation accepts: the identifier
 * transactions are classified by, and how its payload is turned into bytes and back.
 * <p>
 * Descriptors are resolved by identifier through a {@link MessageRegistry}, never by
 * inspecting the runtime type of a payload.
 *
 * @param <T> payload type carried by messages of this kind
 */
public interface MessageDescriptor<T> {

    /**
     * Returns the unique identifier for this message type.
     * It must stay stable across restarts, since journals refer to it.
     *
     * @return unique string identifier
     */
    String getId();

    Class<T> payloadType();

    /**
     * @throws MessageCodecException if the payload cannot be encoded
     */
    byte[] encode(T payload);

    /**
     * @throws MessageCodecException if the bytes are not a valid payload of this type
     */
    T decode(byte[] data);

    /**
     * Encodes a payload held without its static type, checking it belongs to this descriptor.
     *
     * @throws MessageCodecException if the payload is not an instance of {@link #payloadType()}
     *                               or cannot be encoded
     */
    default byte[] encodeUnchecked(Object payload) {
        if (!payloadType().isInstance(payload)) {
            String actual = payload == null ? "null" : payload.getClass().getName();
            throw new MessageCodecException("Message type " + getId() + " expects payload of type "
                    + payloadType().getName() + " but got " + actual);
        }
        return encode(payloadType().cast(payload));
    }
}
