package ch.doodleduel.roomcore.dto;

/**
 * One line of the leaderboard.
 *
 * <p>Players with equal total share a rank (1, 2, 2, 4).
 *
 * @param rank competition rank, starting at 1
 * @param playerId player id
 * @param name display name
 * @param totalScore sum of all frozen round scores
 * @param roundScore score of the most recently completed round
 * @param averagePerRound total divided by the completed rounds, 0 before the first results
 * @param host whether the player hosts the room
 */
public record LeaderboardEntryDto(
        int rank,
        String playerId,
        String name,
        int totalScore,
        int roundScore,
        double averagePerRound,
        boolean host
) {
}
