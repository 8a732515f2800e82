package ch.doodleduel.roomcore.exception;

public class PlayerNotFoundException extends NotFoundException {

    public PlayerNotFoundException(String roomCode, String playerId) {
        super("Player " + playerId + " does not belong to room " + roomCode);
    }
}
