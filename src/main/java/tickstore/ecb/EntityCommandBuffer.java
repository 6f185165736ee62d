package tickstore.ecb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickstore.future.ListenableFuture;
import tickstore.messaging.JsonMessageCodec;
import tickstore.messaging.MessageCodec;
import tickstore.messaging.MessageCodecException;
import tickstore.messaging.MessageDescriptor;
import tickstore.messaging.MessageRegistry;
import tickstore.messaging.UnknownMessageTypeException;
import tickstore.storage.CounterCodec;
import tickstore.storage.Storage;
import tickstore.storage.StorageBatch;
import tickstore.storage.VersionedValue;
import tickstore.txpool.TransactionPool;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Buffers the entity and component changes of the tick being simulated and makes each tick
 * durable through the two step {@link TickStorage} protocol.
 * <p>
 * Responsibilities
 * <ul>
 *   <li>Own the tick counters, the pending transaction journal and every entity key in the
 *       injected {@link Storage}.</li>
 *   <li>Record mutations ({@link #createEntity}, {@link #setComponent}, {@link #removeComponent},
 *       {@link #removeEntity}) in memory; nothing reaches storage before {@link #finalizeTick()}.</li>
 *   <li>Write the journal together with the start counter, and the mutations together with the
 *       end counter, each as one {@link StorageBatch}.</li>
 * </ul>
 * <p>
 * The buffer keeps its own view of the counters once it has read or advanced them, and refuses
 * to start a tick while that view shows one in flight, or to finalize when none is. A start or
 * finalize issued while the previous one has not resolved yet is refused as well.
 * <p>
 * Not thread-safe: all calls come from the tick loop, one protocol step at a time.
 */
public class EntityCommandBuffer implements TickStorage {

    private static final Logger log = LoggerFactory.getLogger(EntityCommandBuffer.class);

    private final Storage storage;
    private final MessageCodec codec;
    private final PendingTransactionJournal journal;

    private final PendingMutations pending = new PendingMutations();
    private final ArchetypeTable archetypes = new ArchetypeTable();
    private long committedNextEntityId;
    private long nextEntityId;
    private boolean loaded;

    // In-process view of the durable counters; null until first read or written.
    private TickNumbers knownTickNumbers;
    // Set from the moment a start or finalize is issued until its future resolves.
    private String stepInFlight;

    public EntityCommandBuffer(Storage storage) {
        this(storage, new JsonMessageCodec());
    }

    public EntityCommandBuffer(Storage storage, MessageCodec codec) {
        if (storage == null || codec == null) {
            throw new IllegalArgumentException("Storage and MessageCodec must be provided and non-null");
        }
        this.storage = storage;
        this.codec = codec;
        this.journal = new PendingTransactionJournal(codec);
    }

    /**
     * Loads the entity id counter and the archetype table. Must complete before entities are
     * created; the tick protocol itself does not need it.
     */
    public ListenableFuture<Void> load() {
        return storage.get(StorageKeys.nextEntityIdKey())
                .flatMap(idValue -> storage.get(StorageKeys.archetypesKey()).map(archetypeValue -> {
                    long next = idValue == null ? 0L : CounterCodec.decode(idValue.value());
                    List<List<String>> table = new ArrayList<>();
                    if (archetypeValue != null) {
                        for (String[] components : codec.decode(archetypeValue.value(), String[][].class)) {
                            table.add(List.of(components));
                        }
                    }
                    archetypes.load(table);
                    committedNextEntityId = next;
                    nextEntityId = next;
                    pending.clear();
                    loaded = true;
                    log.info("Loaded entity state: nextEntityId={}, archetypes={}", next, table.size());
                    return (Void) null;
                }))
                .mapFailure(e -> new TickStorageException("failed to load entity state", e));
    }

    // ===== TickStorage =====================================================

    @Override
    public ListenableFuture<TickNumbers> getTickNumbers() {
        return readCounter(StorageKeys.startTickKey(), "start")
                .flatMap(start -> readCounter(StorageKeys.endTickKey(), "end").map(end -> {
                    TickNumbers numbers = new TickNumbers(start, end);
                    if (!numbers.isConsistent()) {
                        throw new TickStorageException("tick counters are inconsistent: " + numbers);
                    }
                    knownTickNumbers = numbers;
                    return numbers;
                }));
    }

    private ListenableFuture<Long> readCounter(byte[] key, String name) {
        return storage.get(key)
                .map(value -> value == null ? 0L : CounterCodec.decode(value.value()))
                .mapFailure(e -> new TickStorageException("failed to get " + name + " tick", e));
    }

    private ListenableFuture<TickNumbers> currentTickNumbers() {
        return knownTickNumbers != null ? ListenableFuture.completed(knownTickNumbers) : getTickNumbers();
    }

    @Override
    public ListenableFuture<Void> startNextTick(List<MessageDescriptor<?>> descriptors, TransactionPool pool) {
        if (descriptors == null || pool == null) {
            throw new IllegalArgumentException("Descriptors and pool cannot be null");
        }
        return this.<Void>exclusiveStep("start", () -> currentTickNumbers().flatMap(numbers -> {
            if (numbers.isTickInFlight()) {
                return ListenableFuture.failed(new IllegalStateException("Tick " + Long.toUnsignedString(numbers.start())
                        + " was started but not finalized; recover and finalize it before starting a new tick"));
            }

            StorageBatch batch = new StorageBatch();
            try {
                addPendingTransactionsToBatch(batch, descriptors, pool);
            } catch (MessageCodecException | UnknownMessageTypeException | IllegalArgumentException e) {
                return ListenableFuture.failed(new TickStorageException("failed to add pending transactions to batch", e));
            }
            batch.increment(StorageKeys.startTickKey());

            return storage.commit(batch)
                    .mapFailure(e -> new TickStorageException("failed to commit start of tick "
                            + Long.toUnsignedString(numbers.start() + 1), e))
                    .map(committed -> {
                        knownTickNumbers = numbers.afterStart();
                        log.debug("Started tick {} with {} pending transactions", Long.toUnsignedString(knownTickNumbers.start()), pool.size());
                        return null;
                    });
        }));
    }

    /**
     * Runs a counter-advancing step, refusing it while another one has not resolved. The flag is
     * cleared before any callback a caller registers on the returned future runs.
     */
    private <T> ListenableFuture<T> exclusiveStep(String step, Supplier<ListenableFuture<T>> body) {
        if (stepInFlight != null) {
            return ListenableFuture.failed(new IllegalStateException("Cannot " + step
                    + " a tick while the previous " + stepInFlight + " has not completed"));
        }
        stepInFlight = step;
        ListenableFuture<T> result;
        try {
            result = body.get();
        } catch (RuntimeException e) {
            stepInFlight = null;
            throw e;
        }
        return result.onSuccess(value -> stepInFlight = null).onFailure(error -> stepInFlight = null);
    }

    private void addPendingTransactionsToBatch(StorageBatch batch, List<MessageDescriptor<?>> descriptors,
                                               TransactionPool pool) {
        List<PendingTransaction> pendingTransactions = journal.toPendingTransactions(descriptors, pool);
        byte[] encoded = journal.encode(pendingTransactions);
        batch.set(StorageKeys.pendingTransactionKey(), new VersionedValue(encoded, System.currentTimeMillis()));
    }

    @Override
    public ListenableFuture<Void> finalizeTick() {
        return this.<Void>exclusiveStep("finalize", () -> currentTickNumbers().flatMap(numbers -> {
            if (!numbers.isTickInFlight()) {
                return ListenableFuture.failed(new IllegalStateException("No tick in flight (" + numbers
                        + "); a tick must be started before it is finalized"));
            }
            return resolveStoredEntityComponents()
                    .mapFailure(e -> new TickStorageException("failed to read archetypes of changed entities", e))
                    .flatMap(storedComponents -> commitFinalizeBatch(numbers, storedComponents));
        }));
    }

    private ListenableFuture<Void> commitFinalizeBatch(TickNumbers numbers, Map<Long, List<String>> storedComponents) {
        StorageBatch batch;
        try {
            batch = makeBatchOfCommands(storedComponents);
        } catch (MessageCodecException | IllegalArgumentException e) {
            return ListenableFuture.failed(new TickStorageException("failed to make storage command batch", e));
        }
        batch.increment(StorageKeys.endTickKey());
        int mutationCount = pending.size();

        return storage.commit(batch)
                .mapFailure(e -> new TickStorageException("failed to commit end of tick "
                        + Long.toUnsignedString(numbers.start()), e))
                .map(committed -> {
                    archetypes.commitPending();
                    committedNextEntityId = nextEntityId;
                    pending.clear();
                    knownTickNumbers = numbers.afterFinalize();
                    log.debug("Finalized tick {} with {} mutations", Long.toUnsignedString(knownTickNumbers.end()), mutationCount);
                    return null;
                });
    }

    /**
     * Reads the archetype of every entity that existed before this tick and was changed or
     * removed in it. Entities without a stored archetype are left out of the result.
     */
    private ListenableFuture<Map<Long, List<String>>> resolveStoredEntityComponents() {
        Set<Long> entityIds = new LinkedHashSet<>(pending.removedEntities());
        pending.componentWrites().keySet().forEach(key -> entityIds.add(key.entityId()));
        pending.componentDeletes().forEach(key -> entityIds.add(key.entityId()));
        entityIds.removeAll(pending.createdEntities().keySet());

        ListenableFuture<Map<Long, List<String>>> chain = ListenableFuture.completed(new LinkedHashMap<>());
        for (Long entityId : entityIds) {
            chain = chain.flatMap(resolved -> storage.get(StorageKeys.entityArchetypeKey(entityId)).map(value -> {
                if (value != null) {
                    int archetypeId = (int) CounterCodec.decode(value.value());
                    resolved.put(entityId, archetypes.componentTypesOf(archetypeId));
                }
                return resolved;
            }));
        }
        return chain;
    }

    /**
     * @throws IllegalArgumentException if a component change targets an entity that does not
     *                                   exist or a type outside the entity's archetype
     */
    private StorageBatch makeBatchOfCommands(Map<Long, List<String>> storedComponents) {
        pending.componentWrites().keySet().forEach(key -> checkStoredComponent(key, storedComponents));
        pending.componentDeletes().forEach(key -> checkStoredComponent(key, storedComponents));

        long timestamp = System.currentTimeMillis();
        StorageBatch batch = new StorageBatch();

        pending.createdEntities().forEach((entityId, archetypeId) ->
                batch.set(StorageKeys.entityArchetypeKey(entityId),
                        new VersionedValue(CounterCodec.encode(archetypeId), timestamp)));

        pending.componentWrites().forEach((key, value) ->
                batch.set(StorageKeys.componentValueKey(key.componentTypeId(), key.entityId()),
                        new VersionedValue(value, timestamp)));

        pending.componentDeletes().forEach(key ->
                batch.delete(StorageKeys.componentValueKey(key.componentTypeId(), key.entityId())));

        for (Long entityId : pending.removedEntities()) {
            for (String componentTypeId : storedComponents.getOrDefault(entityId, List.of())) {
                batch.delete(StorageKeys.componentValueKey(componentTypeId, entityId));
            }
            batch.delete(StorageKeys.entityArchetypeKey(entityId));
        }

        if (archetypes.hasPending()) {
            batch.set(StorageKeys.archetypesKey(), new VersionedValue(codec.encode(archetypes.all()), timestamp));
        }
        if (nextEntityId != committedNextEntityId) {
            batch.set(StorageKeys.nextEntityIdKey(), new VersionedValue(CounterCodec.encode(nextEntityId), timestamp));
        }
        return batch;
    }

    private void checkStoredComponent(PendingMutations.ComponentKey key, Map<Long, List<String>> storedComponents) {
        if (pending.createdArchetype(key.entityId()) != null) {
            return;
        }
        List<String> componentTypes = storedComponents.get(key.entityId());
        if (componentTypes == null) {
            throw new IllegalArgumentException("Entity " + key.entityId() + " does not exist");
        }
        if (!componentTypes.contains(key.componentTypeId())) {
            throw new IllegalArgumentException("Entity " + key.entityId() + " has no component type "
                    + key.componentTypeId());
        }
    }

    /**
     * Rebuilds the pool journaled by the last {@link #startNextTick} call. Mutations still
     * buffered in memory are discarded, since the recovered tick is simulated again from its
     * inputs. A store where no journal was ever written recovers an empty pool.
     */
    @Override
    public ListenableFuture<TransactionPool> recover(List<MessageDescriptor<?>> descriptors) {
        if (descriptors == null) {
            throw new IllegalArgumentException("Descriptors cannot be null");
        }
        MessageRegistry registry = MessageRegistry.of(descriptors);
        if (knownTickNumbers != null && !knownTickNumbers.isTickInFlight()) {
            log.warn("Recovering while no tick is in flight ({}); the journal belongs to a finalized tick", knownTickNumbers);
        }
        return storage.get(StorageKeys.pendingTransactionKey())
                .mapFailure(e -> new TickStorageException("failed to read pending transactions", e))
                .flatMap(value -> {
                    if (value == null) {
                        log.info("No pending transactions were journaled; recovering an empty pool");
                        discardPending();
                        return ListenableFuture.completed(new TransactionPool());
                    }
                    TransactionPool pool;
                    try {
                        pool = journal.rebuildPool(journal.decode(value.value()), registry);
                    } catch (MessageCodecException | UnknownMessageTypeException | IllegalArgumentException e) {
                        return ListenableFuture.failed(new TickStorageException("failed to recover pending transactions", e));
                    }
                    discardPending();
                    log.info("Recovered {} pending transactions of {} message types", pool.size(), pool.messageTypeIds().size());
                    return ListenableFuture.completed(pool);
                });
    }

    // ===== Mutation recording ==============================================

    /**
     * Allocates a new entity with the given component types. Component values are set
     * separately with {@link #setComponent}.
     *
     * @return the new entity id
     * @throws IllegalStateException if {@link #load()} has not completed
     */
    public long createEntity(String... componentTypeIds) {
        return createEntity(Arrays.asList(componentTypeIds));
    }

    public long createEntity(List<String> componentTypeIds) {
        if (!loaded) {
            throw new IllegalStateException("Entity state not loaded; call load() first");
        }
        if (componentTypeIds == null || componentTypeIds.isEmpty()) {
            throw new IllegalArgumentException("An entity needs at least one component type");
        }
        int archetypeId = archetypes.findOrRegister(List.copyOf(new TreeSet<>(componentTypeIds)));
        long entityId = nextEntityId++;
        pending.createEntity(entityId, archetypeId);
        return entityId;
    }

    /**
     * Sets a component value of an existing entity. An entity created in this tick is checked
     * against its archetype right away; one created earlier is checked when the tick is finalized.
     *
     * @throws IllegalArgumentException if the entity id was never allocated, or the entity was
     *                                  created in this tick without the component type
     * @throws IllegalStateException    if the entity was removed in this tick
     * @throws MessageCodecException    if the component value cannot be encoded
     */
    public void setComponent(long entityId, String componentTypeId, Object value) {
        if (componentTypeId == null || value == null) {
            throw new IllegalArgumentException("Component type id and value cannot be null");
        }
        checkChangeable(entityId, componentTypeId);
        pending.setComponent(new PendingMutations.ComponentKey(entityId, componentTypeId), codec.encode(value));
    }

    /**
     * Deletes a component value. Entities are checked the same way as by {@link #setComponent}.
     */
    public void removeComponent(long entityId, String componentTypeId) {
        if (componentTypeId == null) {
            throw new IllegalArgumentException("Component type id cannot be null");
        }
        checkChangeable(entityId, componentTypeId);
        pending.removeComponent(new PendingMutations.ComponentKey(entityId, componentTypeId));
    }

    /**
     * @throws IllegalStateException    if {@link #load()} has not completed
     * @throws IllegalArgumentException if the entity id was never allocated
     */
    public void removeEntity(long entityId) {
        if (!loaded) {
            throw new IllegalStateException("Entity state not loaded; call load() first");
        }
        if (entityId < 0 || entityId >= nextEntityId) {
            throw new IllegalArgumentException("Entity " + entityId + " does not exist");
        }
        pending.removeEntity(entityId);
    }

    private void checkChangeable(long entityId, String componentTypeId) {
        if (!loaded) {
            throw new IllegalStateException("Entity state not loaded; call load() first");
        }
        if (entityId < 0 || entityId >= nextEntityId) {
            throw new IllegalArgumentException("Entity " + entityId + " does not exist");
        }
        if (pending.isRemoved(entityId)) {
            throw new IllegalStateException("Entity " + entityId + " was removed in this tick");
        }
        Integer createdArchetype = pending.createdArchetype(entityId);
        if (createdArchetype != null && !archetypes.componentTypesOf(createdArchetype).contains(componentTypeId)) {
            throw new IllegalArgumentException("Entity " + entityId + " has no component type " + componentTypeId);
        }
    }

    /**
     * Reads a component value, seeing this tick's buffered changes first.
     *
     * @return a future with the decoded value, or null if the component has no value
     */
    public <T> ListenableFuture<T> getComponent(long entityId, String componentTypeId, Class<T> type) {
        PendingMutations.ComponentKey key = new PendingMutations.ComponentKey(entityId, componentTypeId);
        if (pending.isRemoved(entityId) || pending.isDeleted(key)) {
            return ListenableFuture.completed(null);
        }
        byte[] buffered = pending.pendingValue(key);
        if (buffered != null) {
            try {
                return ListenableFuture.completed(codec.decode(buffered, type));
            } catch (MessageCodecException e) {
                return ListenableFuture.failed(e);
            }
        }
        if (pending.createdArchetype(entityId) != null) {
            return ListenableFuture.completed(null);
        }
        return storage.get(StorageKeys.componentValueKey(componentTypeId, entityId))
                .map(value -> value == null ? null : codec.decode(value.value(), type));
    }

    /**
     * Drops every buffered mutation and the archetypes first seen in this tick.
     */
    public void discardPending() {
        pending.clear();
        archetypes.discardPending();
        nextEntityId = committedNextEntityId;
    }

    public boolean hasPendingMutations() {
        return !pending.isEmpty();
    }

    /**
     * The counters as last read or written by this buffer, or null if it has not touched them yet.
     */
    public TickNumbers getKnownTickNumbers() {
        return knownTickNumbers;
    }

    int getArchetypeCount() {
        return archetypes.size();
    }
}
