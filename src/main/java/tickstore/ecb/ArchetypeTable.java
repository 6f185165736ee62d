package tickstore.ecb;

import java.util.ArrayList;
import java.util.List;

/**
 * Archetype ids in use: an archetype is the sorted set of component types an entity was created
 * with, its id is its position in the table.
 * <p>
 * Archetypes first seen during the current tick are pending until the tick is finalized; a
 * discarded tick forgets them so their ids are handed out again.
 */
final class ArchetypeTable {

    private final List<List<String>> committed = new ArrayList<>();
    private final List<List<String>> pending = new ArrayList<>();

    void load(List<List<String>> archetypes) {
        committed.clear();
        pending.clear();
        archetypes.forEach(components -> committed.add(List.copyOf(components)));
    }

    int findOrRegister(List<String> sortedComponentTypes) {
        int index = committed.indexOf(sortedComponentTypes);
        if (index >= 0) {
            return index;
        }
        index = pending.indexOf(sortedComponentTypes);
        if (index >= 0) {
            return committed.size() + index;
        }
        pending.add(List.copyOf(sortedComponentTypes));
        return committed.size() + pending.size() - 1;
    }

    /**
     * @throws IllegalArgumentException if no archetype has the given id
     */
    List<String> componentTypesOf(int archetypeId) {
        if (archetypeId >= 0 && archetypeId < committed.size()) {
            return committed.get(archetypeId);
        }
        int pendingIndex = archetypeId - committed.size();
        if (pendingIndex >= 0 && pendingIndex < pending.size()) {
            return pending.get(pendingIndex);
        }
        throw new IllegalArgumentException("Unknown archetype id: " + archetypeId);
    }

    boolean hasPending() {
        return !pending.isEmpty();
    }

    List<List<String>> all() {
        List<List<String>> all = new ArrayList<>(committed);
        all.addAll(pending);
        return all;
    }

    void commitPending() {
        committed.addAll(pending);
        pending.clear();
    }

    void discardPending() {
        pending.clear();
    }

    int size() {
        return committed.size() + pending.size();
    }
}
