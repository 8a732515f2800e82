package ch.doodleduel.roomcore.repository;

/**
 * Raised by {@link RoomStore#create} when the key is taken.
 */
public class RecordAlreadyExistsException extends RuntimeException {

    public RecordAlreadyExistsException(String key) {
        super("Record already exists: " + key);
    }
}
