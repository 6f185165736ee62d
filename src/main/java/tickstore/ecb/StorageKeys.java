package tickstore.ecb;

import java.nio.charset.StandardCharsets;

/**
 * Keys owned by the entity command buffer. They must stay stable across restarts and
 * no other component may write them.
 */
final class StorageKeys {

    private StorageKeys() {}

    static byte[] startTickKey() {
        return bytes("ECB:START-TICK");
    }

    static byte[] endTickKey() {
        return bytes("ECB:END-TICK");
    }

    static byte[] pendingTransactionKey() {
        return bytes("ECB:PENDING-TRANSACTIONS");
    }

    static byte[] nextEntityIdKey() {
        return bytes("ECB:NEXT-ENTITY-ID");
    }

    static byte[] archetypesKey() {
        return bytes("ECB:ARCHETYPES");
    }

    static byte[] entityArchetypeKey(long entityId) {
        return bytes("ECB:ARCHETYPE-ID:ENTITY-ID-" + entityId);
    }

    static byte[] componentValueKey(String componentTypeId, long entityId) {
        return bytes("ECB:COMPONENT-VALUE:TYPE-ID-" + componentTypeId + ":ENTITY-ID-" + entityId);
    }

    private static byte[] bytes(String key) {
        return key.getBytes(StandardCharsets.UTF_8);
    }
}
