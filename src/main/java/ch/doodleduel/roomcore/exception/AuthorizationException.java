package ch.doodleduel.roomcore.exception;

/**
 * A player other than the host attempted a host-only transition.
 */
public class AuthorizationException extends RoomException {

    public AuthorizationException(String message) {
        super(message);
    }
}
