package ch.doodleduel.roomcore.exception;

import ch.doodleduel.roomcore.domain.enums.RoomStatus;

/**
 * Players can only be added while the room is in the lobby.
 */
public class RoomNotJoinableException extends RoomException {

    public RoomNotJoinableException(String roomCode, RoomStatus status) {
        super("Room " + roomCode + " cannot be joined in status " + status.getWireName());
    }
}
