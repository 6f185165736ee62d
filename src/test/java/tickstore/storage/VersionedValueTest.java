package tickstore.storage;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VersionedValueTest {

    @Test
    void shouldCompareValueContentAndTimestamp() {
        // Given
        VersionedValue value = new VersionedValue("42".getBytes(), 10L);

        // Then
        assertEquals(new VersionedValue("42".getBytes(), 10L), value);
        assertEquals(new VersionedValue("42".getBytes(), 10L).hashCode(), value.hashCode());
        assertNotEquals(new VersionedValue("42".getBytes(), 11L), value);
        assertNotEquals(new VersionedValue("43".getBytes(), 10L), value);
    }

    @Test
    void shouldRejectNullValue() {
        assertThrows(IllegalArgumentException.class, () -> new VersionedValue(null, 1L));
    }

    @Test
    void shouldAllowEmptyValue() {
        // When
        VersionedValue value = new VersionedValue(new byte[0], 0L);

        // Then
        assertEquals(0, value.value().length);
        assertTrue(value.toString().contains("0 bytes"));
    }
}
