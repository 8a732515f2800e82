package ch.doodleduel.roomcore.service;

import ch.doodleduel.roomcore.domain.Room;
import ch.doodleduel.roomcore.domain.enums.RoomStatus;
import ch.doodleduel.roomcore.domain.enums.TransitionOutcome;
import ch.doodleduel.roomcore.dto.RoomViewDto;
import ch.doodleduel.roomcore.exception.RoomException;
import ch.doodleduel.roomcore.exception.TransientStoreException;
import ch.doodleduel.roomcore.repository.RoomRepository;
import ch.doodleduel.roomcore.repository.RoomStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * One client's live connection to a room.
 *
 * <p>Every pushed snapshot is projected into a {@link RoomViewDto} for the listener. The session
 * also drives the transitions this client may perform: a local timer per deadline (any client),
 * closing the drawing phase once all drawings are in (host only) and finalizing a round once
 * all ratings are in. Every one of these is idempotent, so several clients racing is harmless.
 *
 * <p>Created by {@link RoomSessionService#open}.
 */
@Slf4j
public class RoomSession implements AutoCloseable {

    @Getter
    private final String code;

    @Getter
    private final String localPlayerId;

    private final RoomRepository roomRepository;
    private final RoundCoordinator roundCoordinator;
    private final ScoringService scoringService;
    private final TaskScheduler taskScheduler;
    private final Consumer<RoomViewDto> listener;

    /**
     * Timer key ({@code drawing-1}, {@code rating-1}, ...) to pending timer.
     */
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    private volatile RoomStore.Subscription subscription;
    private volatile RoomViewDto lastView;
    private volatile boolean closed;

    RoomSession(String code,
                String localPlayerId,
                RoomRepository roomRepository,
                RoundCoordinator roundCoordinator,
                ScoringService scoringService,
                TaskScheduler taskScheduler,
                Consumer<RoomViewDto> listener) {
        this.code = code;
        this.localPlayerId = localPlayerId;
        this.roomRepository = roomRepository;
        this.roundCoordinator = roundCoordinator;
        this.scoringService = scoringService;
        this.taskScheduler = taskScheduler;
        this.listener = listener;
    }

    /**
     * (Re)subscribes to the room. Called on open and when the user retries after going offline.
     */
    public void connect() {
        if (closed) {
            throw new IllegalStateException("Session for room " + code + " is closed");
        }
        RoomStore.Subscription previous = subscription;
        if (previous != null) {
            previous.close();
            subscription = null;
        }
        try {
            subscription = roomRepository.subscribe(code, this::onSnapshot);
            log.debug("Player {} subscribed to room {}", localPlayerId, code);
        } catch (TransientStoreException e) {
            log.warn("Could not subscribe to room {}: {}", code, e.getMessage());
            publish(RoomViewDto.offline(lastView, code, localPlayerId));
        }
    }

    public Optional<RoomViewDto> getLastView() {
        return Optional.ofNullable(lastView);
    }

    @Override
    public void close() {
        closed = true;
        RoomStore.Subscription current = subscription;
        if (current != null) {
            current.close();
            subscription = null;
        }
        cancelTimersExcept(null);
        log.debug("Player {} left session of room {}", localPlayerId, code);
    }

    // ----------------- snapshot handling -----------------

    void onSnapshot(Optional<Room> snapshot) {
        if (closed) {
            return;
        }
        if (snapshot.isEmpty()) {
            cancelTimersExcept(null);
            publish(RoomViewDto.gone(code, localPlayerId));
            return;
        }

        Room room = snapshot.get();
        publish(RoomViewDto.of(room, localPlayerId, scoringService.leaderboard(room)));
        drive(room);
    }

    private void drive(Room room) {
        int round = room.getCurrentRound();

        if (room.getStatus() == RoomStatus.DRAWING) {
            String key = "drawing-" + round;
            cancelTimersExcept(key);
            schedule(key, room.drawingDeadline(), () -> closeDrawingPhase(round));
            if (room.isHostPlayer(localPlayerId) && room.allPlayersSubmitted(round)) {
                closeDrawingPhase(round);
            }
        } else if (room.getStatus() == RoomStatus.RATING) {
            String key = "rating-" + round;
            cancelTimersExcept(key);
            schedule(key, room.ratingDeadline(), () -> finalizeRound(round));
            if (scoringService.allRatingsIn(room, round)) {
                finalizeRound(round);
            }
        } else {
            cancelTimersExcept(null);
        }
    }

    private void closeDrawingPhase(int round) {
        runGuarded("close drawing of round " + round, () -> roundCoordinator.closeDrawingPhase(code, round));
    }

    private void finalizeRound(int round) {
        runGuarded("finalize round " + round, () -> scoringService.finalizeRound(code, round));
    }

    private void runGuarded(String action, Supplier<TransitionOutcome> transition) {
        if (closed) {
            return;
        }
        try {
            TransitionOutcome outcome = transition.get();
            log.debug("Room {}: {} by {} -> {}", code, action, localPlayerId, outcome);
        } catch (TransientStoreException e) {
            log.warn("Room {}: {} failed, store offline: {}", code, action, e.getMessage());
            publish(RoomViewDto.offline(lastView, code, localPlayerId));
        } catch (RoomException e) {
            log.warn("Room {}: {} rejected: {}", code, action, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Room {}: {} failed: {}", code, action, e.getMessage(), e);
        }
    }

    // ----------------- timers -----------------

    private void schedule(String key, long epochMillis, Runnable task) {
        if (epochMillis == Long.MAX_VALUE) {
            return;
        }
        timers.computeIfAbsent(key, k -> {
            log.debug("Room {}: timer {} set for {}", code, k, Instant.ofEpochMilli(epochMillis));
            return taskScheduler.schedule(task, Instant.ofEpochMilli(epochMillis));
        });
    }

    private void cancelTimersExcept(String keep) {
        timers.entrySet().removeIf(entry -> {
            if (entry.getKey().equals(keep)) {
                return false;
            }
            entry.getValue().cancel(false);
            return true;
        });
    }

    private void publish(RoomViewDto view) {
        lastView = view;
        try {
            listener.accept(view);
        } catch (RuntimeException e) {
            log.warn("Room view listener of {} failed: {}", localPlayerId, e.getMessage(), e);
        }
    }
}
