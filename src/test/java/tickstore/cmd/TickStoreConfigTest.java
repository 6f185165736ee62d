package tickstore.cmd;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TickStoreConfigTest {

    @Test
    void shouldUseDefaultsWithoutArguments() {
        // When
        TickStoreConfig config = TickStoreConfig.fromArgs(new String[0]);

        // Then
        assertEquals(TickStoreConfig.defaults(), config);
        assertEquals("data/tickstore", config.storagePath());
        assertEquals(0, config.maxTicks());
    }

    @Test
    void shouldParseAllArguments() {
        // When
        TickStoreConfig config = TickStoreConfig.fromArgs(new String[]{
                "--storage=/tmp/ticks", "--tick-interval-ms=25", "--max-ticks=10", "--status-every=5"});

        // Then
        assertEquals(new TickStoreConfig("/tmp/ticks", 25, 10, 5), config);
    }

    @Test
    void shouldRejectUnknownArgument() {
        assertThrows(IllegalArgumentException.class, () -> TickStoreConfig.fromArgs(new String[]{"--port=9000"}));
    }

    @Test
    void shouldRejectMalformedOrOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> TickStoreConfig.fromArgs(new String[]{"--max-ticks=many"}));
        assertThrows(IllegalArgumentException.class, () -> TickStoreConfig.fromArgs(new String[]{"--tick-interval-ms=-1"}));
        assertThrows(IllegalArgumentException.class, () -> TickStoreConfig.fromArgs(new String[]{"--storage="}));
        assertThrows(IllegalArgumentException.class, () -> new TickStoreConfig("data", 1, 0, 0));
    }
}
