package tickstore.storage;

import java.util.Arrays;
import java.util.Objects;

/**
 * A stored value together with the timestamp at which it was written.
 */
public record VersionedValue(byte[] value, long timestamp) {

    public VersionedValue {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        VersionedValue other = (VersionedValue) obj;
        return timestamp == other.timestamp && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(value), timestamp);
    }

    @Override
    public String toString() {
        return "VersionedValue{value=" + value.length + " bytes, timestamp=" + timestamp + '}';
    }
}
