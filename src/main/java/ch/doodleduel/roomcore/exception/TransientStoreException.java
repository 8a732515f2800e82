package ch.doodleduel.roomcore.exception;

/**
 * The shared store is unreachable. The next subscription push or an explicit user retry
 * recovers; the UI only shows a non-blocking offline indicator.
 */
public class TransientStoreException extends RoomException {

    public TransientStoreException(String message) {
        super(message);
    }
}
