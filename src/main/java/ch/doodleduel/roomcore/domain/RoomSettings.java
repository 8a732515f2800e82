package ch.doodleduel.roomcore.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Host-chosen settings of a room, stored as the {@code settings} node of the room record.
 *
 * <p>Ranges are checked by {@code RoomValidator} before a room is written.
 */
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomSettings {

    public static final int MIN_ROUNDS = 1;
    public static final int MAX_ROUNDS = 10;
    public static final int MIN_TIME_LIMIT_SECONDS = 10;
    public static final int MAX_TIME_LIMIT_SECONDS = 600;
    public static final int DEFAULT_RATING_TIME_LIMIT_SECONDS = 60;

    /**
     * Number of draw/rate cycles the room plays.
     */
    private int numRounds;

    /**
     * Seconds every player has to submit a drawing, counted from {@code drawingStartTime}.
     */
    private int timeLimitSeconds;

    /**
     * Seconds the rating phase may stay open before any client closes it.
     *
     * <p>Rooms written by older clients do not carry this field; {@link #effectiveRatingTimeLimitSeconds()}
     * falls back to the default then.
     */
    private int ratingTimeLimitSeconds;

    private RoomSettings(int numRounds, int timeLimitSeconds, int ratingTimeLimitSeconds) {
        this.numRounds = numRounds;
        this.timeLimitSeconds = timeLimitSeconds;
        this.ratingTimeLimitSeconds = ratingTimeLimitSeconds;
    }

    public static RoomSettings of(int numRounds, int timeLimitSeconds) {
        return new RoomSettings(numRounds, timeLimitSeconds, DEFAULT_RATING_TIME_LIMIT_SECONDS);
    }

    public static RoomSettings of(int numRounds, int timeLimitSeconds, int ratingTimeLimitSeconds) {
        return new RoomSettings(numRounds, timeLimitSeconds, ratingTimeLimitSeconds);
    }

    /**
     * Returns the settings the create screen starts with.
     *
     * @return 3 rounds, 60 seconds drawing time
     */
    public static RoomSettings defaultSettings() {
        return of(3, 60);
    }

    public int effectiveRatingTimeLimitSeconds() {
        return ratingTimeLimitSeconds > 0 ? ratingTimeLimitSeconds : DEFAULT_RATING_TIME_LIMIT_SECONDS;
    }
}
