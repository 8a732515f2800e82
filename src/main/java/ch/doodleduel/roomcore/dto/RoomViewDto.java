package ch.doodleduel.roomcore.dto;

import ch.doodleduel.roomcore.domain.DrawingRef;
import ch.doodleduel.roomcore.domain.Room;
import ch.doodleduel.roomcore.domain.enums.ConnectionState;
import ch.doodleduel.roomcore.domain.enums.RoomStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one client shows for a room, derived from a single snapshot.
 *
 * <p>Built fresh for every pushed snapshot; never updated in place.
 *
 * @param connection whether the view reflects live data
 * @param code room code
 * @param status phase of the room, null once the room is gone
 * @param currentRound 1-based round
 * @param numRounds rounds the room plays
 * @param currentTopic topic of the current round
 * @param localPlayerId player this view is rendered for
 * @param localIsHost whether the local player hosts the room
 * @param localHasSubmitted whether the local player has a drawing for the current round
 * @param localHasRated whether the local player stored ratings for the current round
 * @param drawingDeadline epoch millis at which drawing closes
 * @param ratingDeadline epoch millis at which rating closes
 * @param drawings drawings of the current round by player id
 * @param leaderboard ranked players
 * @param nextRoomCode follow-up room after "play again", may be null
 */
public record RoomViewDto(
        ConnectionState connection,
        String code,
        RoomStatus status,
        int currentRound,
        int numRounds,
        String currentTopic,
        String localPlayerId,
        boolean localIsHost,
        boolean localHasSubmitted,
        boolean localHasRated,
        long drawingDeadline,
        long ratingDeadline,
        Map<String, DrawingRef> drawings,
        List<LeaderboardEntryDto> leaderboard,
        String nextRoomCode
) {

    public static RoomViewDto of(Room room, String localPlayerId, List<LeaderboardEntryDto> leaderboard) {
        int round = room.getCurrentRound();
        boolean submitted = room.drawingsFor(round).containsKey(localPlayerId)
                || room.findPlayer(localPlayerId).map(p -> p.hasSubmittedFor(round)).orElse(false);

        return new RoomViewDto(
                ConnectionState.LIVE,
                room.getCode(),
                room.getStatus(),
                round,
                room.getSettings().getNumRounds(),
                room.getCurrentTopic(),
                localPlayerId,
                room.isHostPlayer(localPlayerId),
                submitted,
                room.ratingsFor(round).containsKey(localPlayerId),
                room.drawingDeadline(),
                room.ratingDeadline(),
                Collections.unmodifiableMap(new LinkedHashMap<>(room.drawingsFor(round))),
                List.copyOf(leaderboard),
                room.getNextRoomCode()
        );
    }

    /**
     * View shown after the room record was deleted.
     */
    public static RoomViewDto gone(String code, String localPlayerId) {
        return new RoomViewDto(ConnectionState.GONE, code, null, 0, 0, null, localPlayerId,
                false, false, false, Long.MAX_VALUE, Long.MAX_VALUE, Map.of(), List.of(), null);
    }

    /**
     * Marks the last known view as stale, or builds an empty offline view if nothing arrived yet.
     */
    public static RoomViewDto offline(RoomViewDto last, String code, String localPlayerId) {
        if (last == null) {
            return new RoomViewDto(ConnectionState.OFFLINE, code, null, 0, 0, null, localPlayerId,
                    false, false, false, Long.MAX_VALUE, Long.MAX_VALUE, Map.of(), List.of(), null);
        }
        return last.withConnection(ConnectionState.OFFLINE);
    }

    public RoomViewDto withConnection(ConnectionState state) {
        return new RoomViewDto(state, code, status, currentRound, numRounds, currentTopic, localPlayerId,
                localIsHost, localHasSubmitted, localHasRated, drawingDeadline, ratingDeadline,
                drawings, leaderboard, nextRoomCode);
    }
}
