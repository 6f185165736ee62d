package tickstore.messaging;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonMessageDescriptorTest {

    record Attack(String attacker, String target, int damage) {}

    private final JsonMessageDescriptor<Attack> descriptor = new JsonMessageDescriptor<>("attack", Attack.class);

    @Test
    void shouldEncodeAndDecodePayload() {
        // Given
        Attack attack = new Attack("orc", "elf", 12);

        // When
        Attack decoded = descriptor.decode(descriptor.encode(attack));

        // Then
        assertEquals(attack, decoded);
    }

    @Test
    void shouldEncodeUntypedPayloadOfMatchingType() {
        // Given
        Object payload = new Attack("orc", "elf", 3);

        // When
        byte[] data = descriptor.encodeUnchecked(payload);

        // Then
        assertEquals(payload, descriptor.decode(data));
    }

    @Test
    void shouldRejectPayloadOfOtherType() {
        // When
        MessageCodecException error = assertThrows(MessageCodecException.class,
                () -> descriptor.encodeUnchecked("not an attack"));

        // Then
        assertTrue(error.getMessage().contains("attack"));
        assertTrue(error.getMessage().contains("java.lang.String"));
    }

    @Test
    void shouldRejectBlankId() {
        assertThrows(IllegalArgumentException.class, () -> new JsonMessageDescriptor<>(" ", Attack.class));
        assertThrows(NullPointerException.class, () -> new JsonMessageDescriptor<>("attack", null));
    }

    @Test
    void shouldBeEqualByIdAndPayloadType() {
        assertEquals(descriptor, new JsonMessageDescriptor<>("attack", Attack.class));
        assertNotEquals(descriptor, new JsonMessageDescriptor<>("attack-v2", Attack.class));
        assertEquals("attack", descriptor.toString());
    }
}
