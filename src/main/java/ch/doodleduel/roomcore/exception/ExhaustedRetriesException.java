package ch.doodleduel.roomcore.exception;

/**
 * Room code generation collided on every attempt. Fatal to the create operation only.
 */
public class ExhaustedRetriesException extends RoomException {

    public ExhaustedRetriesException(int attempts) {
        super("Could not find a free room code after " + attempts + " attempts");
    }
}
