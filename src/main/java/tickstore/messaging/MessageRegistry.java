package tickstore.messaging;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps message type identifiers to their {@link MessageDescriptor}.
 * <p>
 * Registration order is kept and is the order in which per-type transaction lists are
 * journaled. One registry belongs to one simulation; there is no global instance.
 */
public final class MessageRegistry {

    private final Map<String, MessageDescriptor<?>> descriptors = new LinkedHashMap<>();

    public static MessageRegistry of(Collection<? extends MessageDescriptor<?>> descriptors) {
        MessageRegistry registry = new MessageRegistry();
        descriptors.forEach(registry::register);
        return registry;
    }

    public static MessageRegistry of(MessageDescriptor<?>... descriptors) {
        return of(List.of(descriptors));
    }

    /**
     * Registers a descriptor. Registering the same descriptor twice is a no-op.
     *
     * @throws IllegalArgumentException if a different descriptor already uses the same id
     */
    public MessageRegistry register(MessageDescriptor<?> descriptor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("Descriptor cannot be null");
        }
        MessageDescriptor<?> existing = descriptors.putIfAbsent(descriptor.getId(), descriptor);
        if (existing != null && !existing.equals(descriptor)) {
            throw new IllegalArgumentException("Message type id already registered: " + descriptor.getId());
        }
        return this;
    }

    /**
     * @throws UnknownMessageTypeException if no descriptor is registered under the id
     */
    public MessageDescriptor<?> get(String id) {
        MessageDescriptor<?> descriptor = descriptors.get(id);
        if (descriptor == null) {
            throw new UnknownMessageTypeException(id);
        }
        return descriptor;
    }

    public boolean contains(String id) {
        return descriptors.containsKey(id);
    }

    public List<MessageDescriptor<?>> descriptors() {
        return List.copyOf(descriptors.values());
    }

    public int size() {
        return descriptors.size();
    }

    @Override
    public String toString() {
        return "MessageRegistry" + new ArrayList<>(descriptors.keySet());
    }
}
