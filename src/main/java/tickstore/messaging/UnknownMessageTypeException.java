package tickstore.messaging;

/**
 * A message type identifier has no descriptor in the registry consulted.
 * <p>
 * During recovery this means the journal was written by a process that knew message types the
 * recovering process does not (a type was removed or renamed in between). The journaled
 * transaction cannot be replayed, so recovery cannot proceed.
 */
public class UnknownMessageTypeException extends RuntimeException {

    private final String messageTypeId;

    public UnknownMessageTypeException(String messageTypeId) {
        super("Message descriptor not found for type id: " + messageTypeId);
        this.messageTypeId = messageTypeId;
    }

    public String getMessageTypeId() {
        return messageTypeId;
    }
}
