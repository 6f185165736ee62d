package tickstore.storage;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Content-compared wrapper around a byte array so it can be used as a map key.
 * The array is copied on the way in and on the way out.
 */
public record BytesKey(byte[] bytes) {

    public BytesKey {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        bytes = bytes.clone();
    }

    public static BytesKey of(String key) {
        return new BytesKey(key.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BytesKey other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "BytesKey" + Arrays.toString(bytes);
    }
}
