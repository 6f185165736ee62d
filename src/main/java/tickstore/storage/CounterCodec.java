package tickstore.storage;

import java.nio.charset.StandardCharsets;

/**
 * Encoding of unsigned 64-bit counters as decimal strings, the representation
 * {@link StorageBatch#increment(byte[])} reads and writes.
 */
public final class CounterCodec {

    private CounterCodec() {}

    public static byte[] encode(long unsignedValue) {
        return Long.toUnsignedString(unsignedValue).getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * @throws StorageException if the bytes are not an unsigned decimal counter
     */
    public static long decode(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.US_ASCII);
        try {
            return Long.parseUnsignedLong(text);
        } catch (NumberFormatException e) {
            throw new StorageException("Value is not an unsigned 64-bit counter: '" + text + "'", e);
        }
    }

    /**
     * Returns the counter value following {@code current}; an absent value counts as zero.
     *
     * @throws StorageException if the current value is not a counter or is already at its maximum
     */
    public static long next(VersionedValue current) {
        long value = current == null ? 0L : decode(current.value());
        if (value == -1L) {
            throw new StorageException("Counter overflow: value is already " + Long.toUnsignedString(value));
        }
        return value + 1;
    }
}
