package ch.doodleduel.roomcore.service;

import ch.doodleduel.roomcore.domain.DrawingRef;
import ch.doodleduel.roomcore.domain.Player;
import ch.doodleduel.roomcore.domain.Room;
import ch.doodleduel.roomcore.domain.enums.RoomStatus;
import ch.doodleduel.roomcore.domain.enums.TransitionOutcome;
import ch.doodleduel.roomcore.exception.InvalidTransitionException;
import ch.doodleduel.roomcore.exception.PlayerNotFoundException;
import ch.doodleduel.roomcore.exception.ValidationException;
import ch.doodleduel.roomcore.repository.ArtifactStore;
import ch.doodleduel.roomcore.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects the drawings of a round and closes the drawing phase.
 *
 * <p>A submission writes only the submitting player's keys ({@code drawings/{round}/{playerId}}
 * and its own flags), so players never conflict with each other. Closing the phase is a shared
 * write that any client may attempt: once every player has a drawing, or once the deadline
 * {@code drawingStartTime + timeLimitSeconds} has passed. From the deadline on, submissions are
 * refused, so a close can only fill in placeholders for players who really missed it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoundCoordinator {

    public static final String PNG = "image/png";

    private final RoomRepository roomRepository;
    private final ArtifactStore artifactStore;
    private final Clock clock;

    /**
     * Uploads the image of a drawing and submits its reference.
     *
     * @param code room code
     * @param playerId drawing player
     * @param round round the drawing belongs to
     * @param png encoded image
     * @return the stored reference
     */
    public DrawingRef uploadDrawing(String code, String playerId, int round, byte[] png) {
        Room room = roomRepository.getByCode(code);
        requireOpenDrawingPhase(room, playerId, round);

        String url = artifactStore.put(ArtifactStore.drawingPath(code, playerId, round), png, PNG);
        return submitDrawing(code, playerId, round, url);
    }

    /**
     * Records a drawing for the given round.
     *
     * <p>Submitting twice for the same round keeps the first drawing.
     *
     * @param code room code
     * @param playerId drawing player
     * @param round round the drawing belongs to
     * @param url artifact reference
     * @return the drawing now stored for the player
     */
    public DrawingRef submitDrawing(String code, String playerId, int round, String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("Drawing reference is required");
        }
        return writeSubmission(code, playerId, round, DrawingRef.of(url, clock.millis()));
    }

    /**
     * Records a placeholder for a player who cannot draw, e.g. on a platform without canvas support.
     */
    public DrawingRef skipDrawing(String code, String playerId, int round) {
        return writeSubmission(code, playerId, round, DrawingRef.placeholder(clock.millis()));
    }

    /**
     * Moves the round from drawing to rating if everybody submitted or the deadline passed.
     *
     * <p>Players without a drawing get a placeholder stamped with the deadline, so two clients
     * closing the same round write identical drawings. Only {@code ratingStartTime} may differ
     * between them, by the skew of their clocks.
     *
     * @param code room code
     * @param round round to close
     * @return {@code APPLIED}, {@code ALREADY_APPLIED} if the round is already past drawing,
     *         {@code NOT_READY} if drawings are missing and the deadline is still ahead
     * @throws InvalidTransitionException if the round has not started yet
     */
    public TransitionOutcome closeDrawingPhase(String code, int round) {
        Room room = roomRepository.getByCode(code);

        if (room.hasReached(round, RoomStatus.RATING)) {
            log.debug("Drawing phase of round {} in room {} already closed", round, code);
            return TransitionOutcome.ALREADY_APPLIED;
        }
        if (!room.hasReached(round, RoomStatus.DRAWING)) {
            throw new InvalidTransitionException("Round " + round + " of room " + code + " has not started");
        }

        long now = clock.millis();
        boolean allSubmitted = room.allPlayersSubmitted(round);
        long deadline = room.drawingDeadline();
        if (!allSubmitted && now < deadline) {
            return TransitionOutcome.NOT_READY;
        }

        Map<String, DrawingRef> drawings = room.drawingsFor(round);
        Map<String, Object> patch = new LinkedHashMap<>();
        int placeholders = 0;
        for (Player player : room.playersInJoinOrder()) {
            if (drawings.get(player.getId()) == null) {
                patch.put(drawingKey(round, player.getId()), DrawingRef.placeholder(deadline));
                placeholders++;
            }
        }
        patch.put("ratingStartTime", now);
        patch.put("status", RoomStatus.RATING);
        roomRepository.patch(code, patch);

        log.info("Room {} round {} moved to rating ({} placeholder(s))", code, round, placeholders);
        return TransitionOutcome.APPLIED;
    }

    public long drawingDeadline(Room room) {
        return room.drawingDeadline();
    }

    public long ratingDeadline(Room room) {
        return room.ratingDeadline();
    }

    // ----------------- helpers -----------------

    private DrawingRef writeSubmission(String code, String playerId, int round, DrawingRef drawing) {
        Room room = roomRepository.getByCode(code);
        requireOpenDrawingPhase(room, playerId, round);

        DrawingRef existing = room.drawingsFor(round).get(playerId);
        if (existing != null) {
            log.debug("Player {} already submitted for round {} in room {}", playerId, round, code);
            return existing;
        }

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put(drawingKey(round, playerId), drawing);
        patch.put("players/" + playerId + "/hasSubmitted", true);
        patch.put("players/" + playerId + "/submittedRound", round);
        roomRepository.patch(code, patch);

        log.info("Player {} submitted {} for round {} in room {}",
                playerId, drawing.isPlaceholder() ? "a placeholder" : "a drawing", round, code);
        return drawing;
    }

    private void requireOpenDrawingPhase(Room room, String playerId, int round) {
        if (room.findPlayer(playerId).isEmpty()) {
            throw new PlayerNotFoundException(room.getCode(), playerId);
        }
        if (room.getStatus() != RoomStatus.DRAWING || room.getCurrentRound() != round) {
            throw new InvalidTransitionException("Room " + room.getCode() + " does not accept drawings for round "
                    + round + " (round " + room.getCurrentRound() + ", " + room.getStatus().getWireName() + ")");
        }
        if (clock.millis() >= room.drawingDeadline()) {
            throw new InvalidTransitionException("Time is up for round " + round + " in room " + room.getCode());
        }
    }

    private static String drawingKey(int round, String playerId) {
        return "drawings/" + round + "/" + playerId;
    }
}
