package ch.doodleduel.roomcore.domain;

import ch.doodleduel.roomcore.domain.enums.RoomStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared state of one game session, stored as the record {@code rooms/{code}}.
 *
 * <p>A {@code Room} instance is a decoded snapshot: the store pushes the full record on every
 * change and each push is decoded into a fresh instance. Services read a snapshot, check a guard
 * against it and write a partial patch; they never write a whole room back except on creation.
 *
 * <p>Round-scoped collections ({@link #drawings}, {@link #ratings}, {@link #scores}) are keyed by
 * round number and never cleared, so a write that arrives late for round {@code r} lands under
 * {@code r} and cannot touch the data of round {@code r + 1}.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Room {

    /**
     * Short human-typeable code, also the record key.
     */
    private String code;

    /**
     * Creator of the room. The host is the only one allowed to start the game and to advance rounds.
     */
    private String hostId;

    private RoomStatus status;

    private RoomSettings settings;

    /**
     * 1-based round number; stays 1 while the room is in the lobby.
     */
    private int currentRound;

    private String currentTopic;

    /**
     * Epoch milliseconds at which the current drawing phase started; all deadlines are anchored here.
     */
    private Long drawingStartTime;

    /**
     * Epoch milliseconds at which the drawing phase was closed. Older rounds leave a stale value
     * behind; it only counts while it is not before {@link #drawingStartTime}.
     */
    private Long ratingStartTime;

    private long createdAt;

    /**
     * Follow-up room created by "play again" once this room is finished.
     */
    private String nextRoomCode;

    private Map<String, Player> players = new LinkedHashMap<>();

    /**
     * round -> playerId -> drawing
     */
    private Map<Integer, Map<String, DrawingRef>> drawings = new LinkedHashMap<>();

    /**
     * round -> raterId -> targetId -> score (1..5)
     */
    private Map<Integer, Map<String, Map<String, Integer>>> ratings = new LinkedHashMap<>();

    /**
     * round -> playerId -> round score, frozen when the round moved to results.
     */
    private Map<Integer, Map<String, Integer>> scores = new LinkedHashMap<>();

    /**
     * Creates a new room in the lobby.
     *
     * @param code unique room code
     * @param hostId id of the creating player
     * @param settings validated settings
     * @param createdAt creation time in epoch milliseconds
     */
    public Room(String code, String hostId, RoomSettings settings, long createdAt) {
        this.code = code;
        this.hostId = hostId;
        this.settings = settings;
        this.createdAt = createdAt;
        this.status = RoomStatus.LOBBY;
        this.currentRound = 1;
        this.currentTopic = "";
    }

    public void addPlayer(Player player) {
        this.players.put(player.getId(), player);
    }

    public Optional<Player> findPlayer(String playerId) {
        if (playerId == null || players == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(players.get(playerId));
    }

    public boolean isHostPlayer(String playerId) {
        return playerId != null && Objects.equals(hostId, playerId);
    }

    /**
     * Returns the players ordered by join time, ties broken by id.
     *
     * @return players in a stable join order
     */
    public List<Player> playersInJoinOrder() {
        if (players == null) {
            return List.of();
        }
        return players.values().stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingLong(Player::getJoinedAt).thenComparing(Player::getId))
                .toList();
    }

    /**
     * Returns whether the room already is at or past the given phase of the given round.
     *
     * <p>This is the guard of every transition: a transition into {@code (round, status)} is
     * applied only while this returns false, so a repeated attempt becomes a no-op.
     *
     * @param round 1-based round number
     * @param target phase within that round
     * @return true if the room's position is {@code >= (round, target)}
     */
    public boolean hasReached(int round, RoomStatus target) {
        if (status == RoomStatus.FINISHED) {
            return true;
        }
        if (target == RoomStatus.FINISHED) {
            return false;
        }
        if (currentRound != round) {
            return currentRound > round;
        }
        return status.ordinal() >= target.ordinal();
    }

    public Map<String, DrawingRef> drawingsFor(int round) {
        return nestedOrEmpty(drawings, round);
    }

    public Map<String, Map<String, Integer>> ratingsFor(int round) {
        return nestedOrEmpty(ratings, round);
    }

    public Map<String, Integer> frozenScoresFor(int round) {
        return nestedOrEmpty(scores, round);
    }

    /**
     * Returns whether every player has a drawing (real or placeholder) for the round.
     *
     * @param round 1-based round number
     * @return true if no submission is missing
     */
    public boolean allPlayersSubmitted(int round) {
        Map<String, DrawingRef> roundDrawings = drawingsFor(round);
        return !playersInJoinOrder().isEmpty()
                && playersInJoinOrder().stream().allMatch(p -> roundDrawings.get(p.getId()) != null);
    }

    /**
     * Epoch milliseconds at which the drawing phase of the current round ends.
     *
     * @return deadline, or {@code Long.MAX_VALUE} if no drawing phase has started
     */
    public long drawingDeadline() {
        if (drawingStartTime == null || settings == null) {
            return Long.MAX_VALUE;
        }
        return drawingStartTime + settings.getTimeLimitSeconds() * 1000L;
    }

    /**
     * Epoch milliseconds at which the rating phase of the current round ends.
     *
     * <p>Counted from the moment the drawing phase was closed, so a late close still leaves the
     * full rating time. Records written without {@code ratingStartTime} fall back to the drawing
     * deadline as the start.
     *
     * @return deadline, or {@code Long.MAX_VALUE} if no drawing phase has started
     */
    public long ratingDeadline() {
        long drawingDeadline = drawingDeadline();
        if (drawingDeadline == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        long start = drawingDeadline;
        if (ratingStartTime != null && ratingStartTime >= drawingStartTime) {
            start = ratingStartTime;
        }
        return start + settings.effectiveRatingTimeLimitSeconds() * 1000L;
    }

    private static <V> Map<String, V> nestedOrEmpty(Map<Integer, Map<String, V>> byRound, int round) {
        if (byRound == null) {
            return Map.of();
        }
        Map<String, V> values = byRound.get(round);
        return values == null ? Map.of() : values;
    }
}
