package tickstore.messaging;

public interface MessageCodec {

    /**
     * Encodes any object into a byte array for transmission or storage.
     *
     * @param obj the object to encode
     * @return the encoded object as bytes
     * @throws MessageCodecException if encoding fails or obj is null
     */
    byte[] encode(Object obj);

    /**
     * Decodes a byte array back into an object of the specified type.
     *
     * @param data the encoded bytes
     * @param type the target class type
     * @return the decoded object
     * @throws MessageCodecException if decoding fails
     */
    <T> T decode(byte[] data, Class<T> type);
}
