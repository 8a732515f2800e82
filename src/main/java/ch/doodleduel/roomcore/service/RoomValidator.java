package ch.doodleduel.roomcore.service;

import ch.doodleduel.roomcore.domain.RoomSettings;
import ch.doodleduel.roomcore.exception.ValidationException;

/**
 * Input checks shared by the room services. Everything here runs before a write.
 */
public final class RoomValidator {

    public static final int MAX_NAME_LENGTH = 20;
    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 5;

    private RoomValidator() {
        // utility class
    }

    public static void validateSettings(RoomSettings settings) {
        if (settings == null) {
            throw new ValidationException("Room settings are required");
        }
        requireInRange("numRounds", settings.getNumRounds(),
                RoomSettings.MIN_ROUNDS, RoomSettings.MAX_ROUNDS);
        requireInRange("timeLimitSeconds", settings.getTimeLimitSeconds(),
                RoomSettings.MIN_TIME_LIMIT_SECONDS, RoomSettings.MAX_TIME_LIMIT_SECONDS);
        requireInRange("ratingTimeLimitSeconds", settings.getRatingTimeLimitSeconds(),
                RoomSettings.MIN_TIME_LIMIT_SECONDS, RoomSettings.MAX_TIME_LIMIT_SECONDS);
    }

    /**
     * Validates a display name.
     *
     * @param name raw name
     * @return trimmed name
     */
    public static String requireValidName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Please enter a name");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Name must be " + MAX_NAME_LENGTH + " characters or less");
        }
        return trimmed;
    }

    public static String requirePlayerId(String playerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new ValidationException("Player id is required");
        }
        return playerId;
    }

    public static void validateScore(String targetId, Integer score) {
        if (score == null || score < MIN_SCORE || score > MAX_SCORE) {
            throw new ValidationException("Rating for " + targetId + " must be between "
                    + MIN_SCORE + " and " + MAX_SCORE + ", got " + score);
        }
    }

    private static void requireInRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new ValidationException(field + " must be between " + min + " and " + max + ", got " + value);
        }
    }
}
