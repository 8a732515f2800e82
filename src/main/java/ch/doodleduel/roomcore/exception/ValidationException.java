package ch.doodleduel.roomcore.exception;

/**
 * Malformed settings or input. Raised before anything is written to the store.
 */
public class ValidationException extends RoomException {

    public ValidationException(String message) {
        super(message);
    }
}
