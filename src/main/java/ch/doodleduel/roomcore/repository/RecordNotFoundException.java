package ch.doodleduel.roomcore.repository;

/**
 * Raised by {@link RoomStore#patch} when the record to merge into does not exist.
 */
public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String key) {
        super("Record not found: " + key);
    }
}
