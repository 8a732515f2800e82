package ch.doodleduel.roomcore.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle phase of a room.
 *
 * <p>Declaration order is the order of the phases inside one round:
 * {@code LOBBY -> DRAWING -> RATING -> RESULTS}, after which the room either loops back to
 * {@code DRAWING} for the next round or ends in {@code FINISHED}.
 * The wire names are lower case so that every client version reads the same record.
 */
public enum RoomStatus {
    LOBBY("lobby"),
    /**
     * Players draw the current topic until everybody submitted or the time limit passed.
     */
    DRAWING("drawing"),
    /**
     * Players rate each other's drawings of the current round.
     */
    RATING("rating"),
    /**
     * Round scores are frozen and shown; the host continues to the next round.
     */
    RESULTS("results"),
    FINISHED("finished");

    private final String wireName;

    RoomStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static RoomStatus fromWireName(String value) {
        for (RoomStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown room status: " + value);
    }
}
