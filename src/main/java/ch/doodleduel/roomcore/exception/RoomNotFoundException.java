package ch.doodleduel.roomcore.exception;

public class RoomNotFoundException extends NotFoundException {

    public RoomNotFoundException(String roomCode) {
        super("Room not found: " + roomCode);
    }
}
