package tickstore.ecb;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Entity and component changes recorded while the current tick is simulated.
 * Later changes to the same component replace earlier ones.
 */
final class PendingMutations {

    record ComponentKey(long entityId, String componentTypeId) {
    }

    private final Map<Long, Integer> createdEntities = new LinkedHashMap<>();
    private final Map<ComponentKey, byte[]> componentWrites = new LinkedHashMap<>();
    private final Set<ComponentKey> componentDeletes = new LinkedHashSet<>();
    private final Set<Long> removedEntities = new LinkedHashSet<>();

    void createEntity(long entityId, int archetypeId) {
        createdEntities.put(entityId, archetypeId);
    }

    void setComponent(ComponentKey key, byte[] value) {
        componentDeletes.remove(key);
        componentWrites.put(key, value);
    }

    void removeComponent(ComponentKey key) {
        componentWrites.remove(key);
        componentDeletes.add(key);
    }

    /**
     * Drops every change to the entity. An entity created in this tick simply disappears,
     * an existing one is scheduled for removal.
     */
    void removeEntity(long entityId) {
        componentWrites.keySet().removeIf(key -> key.entityId() == entityId);
        componentDeletes.removeIf(key -> key.entityId() == entityId);
        if (createdEntities.remove(entityId) == null) {
            removedEntities.add(entityId);
        }
    }

    boolean isRemoved(long entityId) {
        return removedEntities.contains(entityId);
    }

    boolean isDeleted(ComponentKey key) {
        return componentDeletes.contains(key);
    }

    byte[] pendingValue(ComponentKey key) {
        return componentWrites.get(key);
    }

    Integer createdArchetype(long entityId) {
        return createdEntities.get(entityId);
    }

    Map<Long, Integer> createdEntities() {
        return createdEntities;
    }

    Map<ComponentKey, byte[]> componentWrites() {
        return componentWrites;
    }

    Set<ComponentKey> componentDeletes() {
        return componentDeletes;
    }

    Set<Long> removedEntities() {
        return removedEntities;
    }

    int size() {
        return createdEntities.size() + componentWrites.size() + componentDeletes.size() + removedEntities.size();
    }

    boolean isEmpty() {
        return size() == 0;
    }

    void clear() {
        createdEntities.clear();
        componentWrites.clear();
        componentDeletes.clear();
        removedEntities.clear();
    }
}
