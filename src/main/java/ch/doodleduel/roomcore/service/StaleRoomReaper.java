package ch.doodleduel.roomcore.service;

import ch.doodleduel.roomcore.dto.ReaperResultDto;
import ch.doodleduel.roomcore.repository.ArtifactStore;
import ch.doodleduel.roomcore.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Removes rooms that outlived the retention window, together with their drawings, and sweeps
 * drawings whose room no longer exists.
 *
 * <p>There is no server to run this periodically; every client runs one pass after startup,
 * detached on the {@link TaskScheduler} so that startup never waits for it. Any number of clients
 * may run it at the same time: deleting something already deleted succeeds.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code doodleduel.reaper.enabled}: run a pass on startup (default: true)</li>
 *   <li>{@code doodleduel.reaper.retention-hours}: age at which a room is removed (default: 24 hours)</li>
 * </ul>
 *
 * <p>Failures never leave this class: they are logged at WARN and counted in the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StaleRoomReaper {

    private final RoomRepository roomRepository;
    private final ArtifactStore artifactStore;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    @Value("${doodleduel.reaper.enabled:true}")
    private boolean enabled;

    @Value("${doodleduel.reaper.retention-hours:24}")
    private int retentionHours;

    /**
     * Schedules one detached pass as soon as the application is ready.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.debug("Stale room reaper disabled");
            return;
        }
        taskScheduler.schedule(this::reap, clock.instant());
    }

    /**
     * Runs one pass.
     *
     * @return counts of what was deleted and what failed
     */
    public ReaperResultDto reap() {
        long threshold = clock.millis() - retentionHours * 3_600_000L;
        log.debug("Starting stale room pass. Removing rooms created at or before {} (retention: {} hours)",
                threshold, retentionHours);

        Counter counter = new Counter();
        try {
            Map<String, Long> creationTimes = roomRepository.findCreationTimes();
            creationTimes.forEach((code, createdAt) -> {
                if (createdAt <= threshold) {
                    deleteRoom(code, counter);
                }
            });
            sweepOrphans(counter);
        } catch (RuntimeException e) {
            counter.failures++;
            log.warn("Stale room pass aborted: {}", e.getMessage(), e);
        }

        ReaperResultDto result = new ReaperResultDto(counter.rooms, counter.artifacts, counter.failures);
        if (counter.rooms > 0 || counter.artifacts > 0) {
            log.info("Removed {} stale room(s) and {} artifact(s), {} failure(s)",
                    result.roomsDeleted(), result.artifactsDeleted(), result.failures());
        } else {
            log.debug("No stale rooms or orphaned artifacts to remove");
        }
        return result;
    }

    // ----------------- helpers -----------------

    private void deleteRoom(String code, Counter counter) {
        try {
            deleteArtifacts(ArtifactStore.roomPrefix(code), counter);
            roomRepository.delete(code);
            counter.rooms++;
            log.debug("Removed stale room {}", code);
        } catch (RuntimeException e) {
            counter.failures++;
            log.warn("Could not remove stale room {}: {}", code, e.getMessage());
        }
    }

    /**
     * Deletes artifacts below {@code drawings/} whose room record is gone.
     */
    private void sweepOrphans(Counter counter) {
        Map<String, Boolean> roomExists = new HashMap<>();
        for (String path : artifactStore.list(ArtifactStore.DRAWINGS_PREFIX)) {
            String code = ArtifactStore.roomCodeOf(path);
            if (code == null) {
                continue;
            }
            try {
                if (!roomExists.computeIfAbsent(code, roomRepository::exists)) {
                    artifactStore.delete(path);
                    counter.artifacts++;
                }
            } catch (RuntimeException e) {
                counter.failures++;
                log.warn("Could not sweep artifact {}: {}", path, e.getMessage());
            }
        }
    }

    private void deleteArtifacts(String prefix, Counter counter) {
        List<String> paths = artifactStore.list(prefix);
        for (String path : paths) {
            artifactStore.delete(path);
            counter.artifacts++;
        }
    }

    private static final class Counter {
        private int rooms;
        private int artifacts;
        private int failures;
    }
}
