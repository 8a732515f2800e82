package ch.doodleduel.roomcore.exception;

/**
 * Base type of all errors raised by the room subsystem.
 *
 * <p>All room errors are unchecked. Callers in the client shell catch {@code RoomException}
 * and map it to a message or to a "waiting"/"offline" state; nothing here is allowed to
 * crash the host application.
 */
public abstract class RoomException extends RuntimeException {

    protected RoomException(String message) {
        super(message);
    }
}
