package ch.doodleduel.roomcore.exception;

/**
 * The operation is not allowed from the room's current phase.
 *
 * <p>A repeated attempt of a transition that already happened is <em>not</em> reported with this
 * exception; see {@code TransitionOutcome.ALREADY_APPLIED}.
 */
public class InvalidTransitionException extends RoomException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
