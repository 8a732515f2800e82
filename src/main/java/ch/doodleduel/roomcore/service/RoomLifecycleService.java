package ch.doodleduel.roomcore.service;

import ch.doodleduel.roomcore.domain.Player;
import ch.doodleduel.roomcore.domain.Room;
import ch.doodleduel.roomcore.domain.RoomSettings;
import ch.doodleduel.roomcore.domain.enums.RoomStatus;
import ch.doodleduel.roomcore.domain.enums.TransitionOutcome;
import ch.doodleduel.roomcore.exception.AuthorizationException;
import ch.doodleduel.roomcore.exception.ExhaustedRetriesException;
import ch.doodleduel.roomcore.exception.InvalidTransitionException;
import ch.doodleduel.roomcore.exception.RoomNotFoundException;
import ch.doodleduel.roomcore.exception.RoomNotJoinableException;
import ch.doodleduel.roomcore.exception.ValidationException;
import ch.doodleduel.roomcore.repository.RecordAlreadyExistsException;
import ch.doodleduel.roomcore.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Owns room creation, joining and the host-driven phase transitions
 * ({@code lobby -> drawing} and {@code results -> drawing | finished}).
 *
 * <p>Every transition reads the current snapshot, checks it against {@link Room#hasReached}
 * and only then writes a partial patch. A second attempt of the same transition therefore
 * returns {@link TransitionOutcome#ALREADY_APPLIED} instead of advancing twice.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code doodleduel.room.code-max-attempts}: how many fresh codes are tried on collision (default: 5)</li>
 *   <li>{@code doodleduel.room.min-players}: players needed to start a game (default: 2)</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoomLifecycleService {

    private final RoomRepository roomRepository;
    private final RoomCodeGenerator codeGenerator;
    private final TopicCatalog topicCatalog;
    private final Clock clock;

    @Value("${doodleduel.room.code-max-attempts:5}")
    private int codeMaxAttempts;

    @Value("${doodleduel.room.min-players:2}")
    private int minPlayers;

    /**
     * Creates a room in the lobby with the caller as its only player and host.
     *
     * @param hostId identity of the creating device
     * @param hostName display name of the host
     * @param settings requested settings
     * @return the code of the new room
     * @throws ValidationException if name or settings are out of range
     * @throws ExhaustedRetriesException if every generated code was taken
     */
    public String createRoom(String hostId, String hostName, RoomSettings settings) {
        RoomValidator.requirePlayerId(hostId);
        String name = RoomValidator.requireValidName(hostName);
        RoomValidator.validateSettings(settings);

        long now = clock.millis();
        for (int attempt = 1; attempt <= codeMaxAttempts; attempt++) {
            String code = codeGenerator.generate();

            Room room = new Room(code, hostId, settings, now);
            room.addPlayer(new Player(hostId, name, true, now));

            try {
                roomRepository.create(room);
                log.info("Room {} created by {} ({} rounds, {}s)",
                        code, hostId, settings.getNumRounds(), settings.getTimeLimitSeconds());
                return code;
            } catch (RecordAlreadyExistsException e) {
                log.debug("Room code {} already taken (attempt {}/{})", code, attempt, codeMaxAttempts);
            }
        }

        log.warn("Giving up room creation for {} after {} code collisions", hostId, codeMaxAttempts);
        throw new ExhaustedRetriesException(codeMaxAttempts);
    }

    /**
     * Adds a player to a room in the lobby. Joining again with the same id only refreshes the name.
     *
     * @param code room code as typed by the user
     * @param playerId identity of the joining device
     * @param playerName display name
     * @return the room after the join
     */
    public Room joinRoom(String code, String playerId, String playerName) {
        String normalized = requireValidCode(code);
        RoomValidator.requirePlayerId(playerId);
        String name = RoomValidator.requireValidName(playerName);

        Room room = roomRepository.getByCode(normalized);

        if (room.getStatus() != RoomStatus.LOBBY) {
            throw new RoomNotJoinableException(normalized, room.getStatus());
        }

        Optional<Player> existing = room.findPlayer(playerId);
        if (existing.isPresent()) {
            if (!name.equals(existing.get().getName())) {
                roomRepository.patch(normalized, Map.of("players/" + playerId + "/name", name));
                log.debug("Player {} re-joined room {} as {}", playerId, normalized, name);
            }
            return roomRepository.getByCode(normalized);
        }

        Player player = new Player(playerId, name, false, clock.millis());
        roomRepository.patch(normalized, Map.of("players/" + playerId, player));
        log.info("Player {} joined room {}", playerId, normalized);

        return roomRepository.getByCode(normalized);
    }

    /**
     * Moves the room from the lobby into the drawing phase of round 1.
     *
     * @param code room code
     * @param requesterId player asking to start
     * @return {@code APPLIED}, or {@code ALREADY_APPLIED} if the game is already in round 1 drawing
     * @throws AuthorizationException if the requester is not the host
     * @throws InvalidTransitionException if the game is past round 1 drawing
     * @throws ValidationException if fewer than the minimum players joined
     */
    public TransitionOutcome startGame(String code, String requesterId) {
        Room room = roomRepository.getByCode(code);

        if (!room.isHostPlayer(requesterId)) {
            throw new AuthorizationException("Only the host can start the game");
        }

        if (room.hasReached(1, RoomStatus.DRAWING)) {
            if (room.getStatus() == RoomStatus.DRAWING && room.getCurrentRound() == 1) {
                log.debug("Room {} already started", code);
                return TransitionOutcome.ALREADY_APPLIED;
            }
            throw new InvalidTransitionException(
                    "Cannot start room " + code + " in status " + room.getStatus().getWireName());
        }

        if (room.getPlayers().size() < minPlayers) {
            throw new ValidationException("You need at least " + minPlayers + " players to start the game");
        }

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("currentTopic", topicCatalog.nextTopic());
        patch.put("currentRound", 1);
        patch.put("drawingStartTime", clock.millis());
        patch.put("status", RoomStatus.DRAWING);
        roomRepository.patch(code, patch);

        log.info("Room {} started with {} players", code, room.getPlayers().size());
        return TransitionOutcome.APPLIED;
    }

    /**
     * Leaves the results of a round: starts the next round, or finishes the game after the last one.
     *
     * @param code room code
     * @param requesterId player asking to continue
     * @param completedRound the round whose results are being shown
     * @return {@code APPLIED}, or {@code ALREADY_APPLIED} if the room already moved on
     * @throws AuthorizationException if the requester is not the host
     * @throws InvalidTransitionException if the round has no results yet
     */
    public TransitionOutcome advanceRound(String code, String requesterId, int completedRound) {
        Room room = roomRepository.getByCode(code);

        if (!room.isHostPlayer(requesterId)) {
            throw new AuthorizationException("Only the host can continue to the next round");
        }

        int numRounds = room.getSettings().getNumRounds();
        if (completedRound < 1 || completedRound > numRounds) {
            throw new ValidationException("Round " + completedRound + " does not exist in room " + code);
        }

        boolean lastRound = completedRound == numRounds;
        boolean alreadyAdvanced = lastRound
                ? room.getStatus() == RoomStatus.FINISHED
                : room.hasReached(completedRound + 1, RoomStatus.DRAWING);
        if (alreadyAdvanced) {
            log.debug("Room {} already left the results of round {}", code, completedRound);
            return TransitionOutcome.ALREADY_APPLIED;
        }

        if (!room.hasReached(completedRound, RoomStatus.RESULTS)) {
            throw new InvalidTransitionException(
                    "Round " + completedRound + " of room " + code + " has no results yet");
        }

        Map<String, Object> patch = new LinkedHashMap<>();
        if (lastRound) {
            patch.put("status", RoomStatus.FINISHED);
        } else {
            int nextRound = completedRound + 1;
            patch.put("currentRound", nextRound);
            patch.put("currentTopic", topicCatalog.nextTopic());
            patch.put("drawingStartTime", clock.millis());
            for (Player player : room.playersInJoinOrder()) {
                patch.put("players/" + player.getId() + "/hasSubmitted", false);
            }
            patch.put("status", RoomStatus.DRAWING);
        }
        roomRepository.patch(code, patch);

        if (lastRound) {
            log.info("Room {} finished after {} rounds", code, numRounds);
        } else {
            log.info("Room {} advanced to round {}", code, completedRound + 1);
        }
        return TransitionOutcome.APPLIED;
    }

    /**
     * Deletes a room record. Deleting an absent room is a success.
     *
     * @param code room code
     */
    public void deleteRoom(String code) {
        roomRepository.delete(codeGenerator.normalize(code));
        log.info("Room {} deleted", code);
    }

    /**
     * Deletes a room once its game is over; called by every client navigating away from the final screen.
     *
     * @param code room code
     * @throws InvalidTransitionException if the game is still running
     */
    public void leaveFinishedRoom(String code) {
        Optional<Room> room = roomRepository.findByCode(code);
        if (room.isEmpty()) {
            log.debug("Room {} already gone", code);
            return;
        }
        if (room.get().getStatus() != RoomStatus.FINISHED) {
            throw new InvalidTransitionException("Room " + code + " is still running");
        }
        deleteRoom(code);
    }

    /**
     * Moves the players of a finished room into a fresh lobby with the same settings.
     *
     * <p>The first player to ask creates the new room, becomes its host and publishes its code as
     * {@code nextRoomCode}; everybody asking later joins that room.
     *
     * @param code code of the finished room
     * @param playerId player asking to play again
     * @param playerName display name in the new room
     * @return code of the room to go to
     */
    public String playAgain(String code, String playerId, String playerName) {
        Room finished = roomRepository.getByCode(code);
        if (finished.getStatus() != RoomStatus.FINISHED) {
            throw new InvalidTransitionException("Room " + code + " is still running");
        }

        String nextCode = finished.getNextRoomCode();
        if (nextCode != null && !nextCode.isBlank()) {
            try {
                joinRoom(nextCode, playerId, playerName);
                return nextCode;
            } catch (RoomNotFoundException | RoomNotJoinableException e) {
                log.info("Follow-up room {} of {} is not joinable any more, creating a new one", nextCode, code);
            }
        }

        String newCode = createRoom(playerId, playerName, finished.getSettings());
        try {
            roomRepository.patch(code, Map.of("nextRoomCode", newCode));
        } catch (RoomNotFoundException e) {
            log.debug("Room {} was deleted before its follow-up {} could be published", code, newCode);
        }
        return newCode;
    }

    public Room getRoom(String code) {
        return roomRepository.getByCode(codeGenerator.normalize(code));
    }

    // ----------------- helpers -----------------

    private String requireValidCode(String code) {
        String normalized = codeGenerator.normalize(code);
        if (!codeGenerator.isValid(normalized)) {
            throw new ValidationException("Please enter a valid " + RoomCodeGenerator.LENGTH + "-character room code");
        }
        return normalized;
    }
}
