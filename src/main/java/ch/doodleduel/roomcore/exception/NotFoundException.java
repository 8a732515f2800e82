package ch.doodleduel.roomcore.exception;

/**
 * A room or a player that an operation refers to does not exist.
 */
public abstract class NotFoundException extends RoomException {

    protected NotFoundException(String message) {
        super(message);
    }
}
