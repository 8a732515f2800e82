package ch.doodleduel.roomcore.service;

import ch.doodleduel.roomcore.dto.RoomViewDto;
import ch.doodleduel.roomcore.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.util.function.Consumer;

/**
 * Opens {@link RoomSession}s, the client side view of a room.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoomSessionService {

    private final RoomRepository roomRepository;
    private final RoundCoordinator roundCoordinator;
    private final ScoringService scoringService;
    private final TaskScheduler taskScheduler;
    private final IdentityProvider identityProvider;
    private final RoomCodeGenerator codeGenerator;

    /**
     * Opens a session for the player of this installation.
     */
    public RoomSession open(String code, Consumer<RoomViewDto> listener) {
        return open(code, identityProvider.currentPlayerId(), listener);
    }

    /**
     * Subscribes to a room and starts projecting its snapshots.
     *
     * <p>The listener receives the current view right away. If the store is unreachable the
     * listener gets an offline view and {@link RoomSession#connect()} can be retried later.
     *
     * @param code room code
     * @param localPlayerId player the views are rendered for
     * @param listener receives every new view
     * @return open session; close it when leaving the room
     */
    public RoomSession open(String code, String localPlayerId, Consumer<RoomViewDto> listener) {
        String normalized = codeGenerator.normalize(code);
        RoomSession session = new RoomSession(normalized, RoomValidator.requirePlayerId(localPlayerId),
                roomRepository, roundCoordinator, scoringService, taskScheduler, listener);
        session.connect();
        log.info("Player {} opened session for room {}", localPlayerId, normalized);
        return session;
    }
}
