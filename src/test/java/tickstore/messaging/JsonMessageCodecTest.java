package tickstore.messaging;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsonMessageCodecTest {

    record MovePlayer(String player, int dx, int dy) {}

    record Blob(String name, byte[] bytes) {}

    private final JsonMessageCodec codec = new JsonMessageCodec();

    @Test
    void shouldEncodeRecordAsJson() {
        // When
        String json = new String(codec.encode(new MovePlayer("alice", 1, -2)), StandardCharsets.UTF_8);

        // Then
        assertEquals("{\"player\":\"alice\",\"dx\":1,\"dy\":-2}", json);
    }

    @Test
    void shouldDecodeRecord() {
        // Given
        byte[] json = "{\"player\":\"bob\",\"dx\":0,\"dy\":3}".getBytes(StandardCharsets.UTF_8);

        // When
        MovePlayer move = codec.decode(json, MovePlayer.class);

        // Then
        assertEquals(new MovePlayer("bob", 0, 3), move);
    }

    @Test
    void shouldCarryBinaryFieldsAsBase64() {
        // Given
        Blob blob = new Blob("b", new byte[]{0, 1, 2, (byte) 255});

        // When
        String json = new String(codec.encode(blob), StandardCharsets.UTF_8);
        Blob decoded = codec.decode(json.getBytes(StandardCharsets.UTF_8), Blob.class);

        // Then
        assertTrue(json.contains("\"AAEC/w==\""));
        assertArrayEquals(blob.bytes(), decoded.bytes());
    }

    @Test
    void shouldRejectUnknownProperties() {
        // Given
        byte[] json = "{\"player\":\"bob\",\"dx\":0,\"dy\":3,\"dz\":1}".getBytes(StandardCharsets.UTF_8);

        // When & Then
        assertThrows(MessageCodecException.class, () -> codec.decode(json, MovePlayer.class));
    }

    @Test
    void shouldWrapMalformedInput() {
        // When
        MessageCodecException error = assertThrows(MessageCodecException.class,
                () -> codec.decode("{not json".getBytes(StandardCharsets.UTF_8), MovePlayer.class));

        // Then
        assertNotNull(error.getCause());
    }

    @Test
    void shouldRejectNulls() {
        assertThrows(MessageCodecException.class, () -> codec.encode(null));
        assertThrows(MessageCodecException.class, () -> codec.decode(null, MovePlayer.class));
    }
}
