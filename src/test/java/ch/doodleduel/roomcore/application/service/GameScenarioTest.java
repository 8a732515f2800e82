package ch.doodleduel.roomcore.application.service;

import ch.doodleduel.roomcore.domain.Room;
import ch.doodleduel.roomcore.domain.RoomSettings;
import ch.doodleduel.roomcore.domain.enums.RoomStatus;
import ch.doodleduel.roomcore.domain.enums.TransitionOutcome;
import ch.doodleduel.roomcore.dto.LeaderboardEntryDto;
import ch.doodleduel.roomcore.repository.InMemoryArtifactStore;
import ch.doodleduel.roomcore.repository.InMemoryRoomStore;
import ch.doodleduel.roomcore.repository.RoomRepository;
import ch.doodleduel.roomcore.service.RoomCodeGenerator;
import ch.doodleduel.roomcore.service.RoomLifecycleService;
import ch.doodleduel.roomcore.service.RoundCoordinator;
import ch.doodleduel.roomcore.service.ScoringService;
import ch.doodleduel.roomcore.service.TopicCatalog;
import ch.doodleduel.roomcore.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static ch.doodleduel.roomcore.testutil.RoomTestUtils.T0;
import static ch.doodleduel.roomcore.testutil.RoomTestUtils.repositoryFor;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Whole games played by several clients against one shared in-memory store.
 *
 * <p>All clients share the services; what distinguishes them is the player id they act as.
 */
class GameScenarioTest {

    private MutableClock clock;
    private RoomRepository roomRepository;
    private RoomLifecycleService lifecycleService;
    private RoundCoordinator roundCoordinator;
    private ScoringService scoringService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.ofEpochMilli(T0));
        roomRepository = repositoryFor(new InMemoryRoomStore());
        TopicCatalog topics = () -> "Cat";

        lifecycleService = new RoomLifecycleService(roomRepository, new RoomCodeGenerator(), topics, clock);
        ReflectionTestUtils.setField(lifecycleService, "codeMaxAttempts", 5);
        ReflectionTestUtils.setField(lifecycleService, "minPlayers", 2);

        roundCoordinator = new RoundCoordinator(roomRepository, new InMemoryArtifactStore(), clock);
        scoringService = new ScoringService(roomRepository, clock);
    }

    @Test
    void twoRoundGame_shouldSumRoundScoresIntoTotal() {
        // Arrange: B hosts, A and C join
        String code = lifecycleService.createRoom("B", "Bea", RoomSettings.of(2, 30));
        clock.advance(Duration.ofSeconds(1));
        lifecycleService.joinRoom(code, "A", "Anna");
        clock.advance(Duration.ofSeconds(1));
        lifecycleService.joinRoom(code, "C", "Carl");

        Room created = roomRepository.getByCode(code);
        assertThat(created.getPlayers().values()).filteredOn(p -> p.isHost()).hasSize(1);

        // Round 1
        assertThat(lifecycleService.startGame(code, "B")).isEqualTo(TransitionOutcome.APPLIED);
        drawAll(code, 1);
        assertThat(roundCoordinator.closeDrawingPhase(code, 1)).isEqualTo(TransitionOutcome.APPLIED);

        scoringService.submitRatings(code, "B", 1, Map.of("A", 5, "C", 2));
        scoringService.submitRatings(code, "C", 1, Map.of("A", 3, "B", 4));
        scoringService.submitRatings(code, "A", 1, Map.of("B", 1, "C", 1));
        assertThat(scoringService.finalizeRound(code, 1)).isEqualTo(TransitionOutcome.APPLIED);

        Room afterRound1 = roomRepository.getByCode(code);
        assertThat(scoringService.roundScore(afterRound1, "A", 1)).isEqualTo(8);
        assertThat(afterRound1.getPlayers().get("A").getTotalScore()).isEqualTo(8);

        // Round 2
        clock.advance(Duration.ofMinutes(2));
        assertThat(lifecycleService.advanceRound(code, "B", 1)).isEqualTo(TransitionOutcome.APPLIED);
        drawAll(code, 2);
        roundCoordinator.closeDrawingPhase(code, 2);

        scoringService.submitRatings(code, "B", 2, Map.of("A", 1, "C", 3));
        scoringService.submitRatings(code, "C", 2, Map.of("A", 3, "B", 3));
        scoringService.submitRatings(code, "A", 2, Map.of("B", 2, "C", 2));
        scoringService.finalizeRound(code, 2);

        // Act
        TransitionOutcome finish = lifecycleService.advanceRound(code, "B", 2);

        // Assert
        Room finished = roomRepository.getByCode(code);
        assertThat(finish).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(finished.getStatus()).isEqualTo(RoomStatus.FINISHED);
        assertThat(finished.getPlayers().get("A").getTotalScore()).isEqualTo(12);
        assertThat(finished.getPlayers().get("A").getRoundScore()).isEqualTo(4);

        List<LeaderboardEntryDto> board = scoringService.leaderboard(finished);
        assertThat(board.get(0).playerId()).isEqualTo("A");
        assertThat(board.get(0).averagePerRound()).isEqualTo(6.0);

        // Leaving removes the room for everybody
        lifecycleService.leaveFinishedRoom(code);
        lifecycleService.leaveFinishedRoom(code);
        assertThat(roomRepository.exists(code)).isFalse();
    }

    @Test
    void missingDrawing_shouldBecomePlaceholder_andNotBlockRating() {
        // Arrange
        String code = lifecycleService.createRoom("H", "Host", RoomSettings.of(1, 30));
        lifecycleService.joinRoom(code, "P", "Painter");
        lifecycleService.joinRoom(code, "S", "Sleeper");
        lifecycleService.startGame(code, "H");

        roundCoordinator.submitDrawing(code, "H", 1, "memory://h.png");
        roundCoordinator.submitDrawing(code, "P", 1, "memory://p.png");
        assertThat(roundCoordinator.closeDrawingPhase(code, 1)).isEqualTo(TransitionOutcome.NOT_READY);

        // Act: S never draws, the deadline passes
        clock.advance(Duration.ofSeconds(31));
        TransitionOutcome outcome = roundCoordinator.closeDrawingPhase(code, 1);

        // Assert
        assertThat(outcome).isEqualTo(TransitionOutcome.APPLIED);
        Room room = roomRepository.getByCode(code);
        assertThat(room.getStatus()).isEqualTo(RoomStatus.RATING);
        assertThat(room.drawingsFor(1).get("S").isPlaceholder()).isTrue();

        // S can still rate, nobody has to rate S
        scoringService.submitRatings(code, "H", 1, Map.of("P", 4));
        scoringService.submitRatings(code, "P", 1, Map.of("H", 2));
        scoringService.submitRatings(code, "S", 1, Map.of("H", 3, "P", 5));
        assertThat(scoringService.finalizeRound(code, 1)).isEqualTo(TransitionOutcome.APPLIED);

        Room results = roomRepository.getByCode(code);
        assertThat(results.getPlayers().get("S").getRoundScore()).isZero();
        assertThat(results.getPlayers().get("P").getRoundScore()).isEqualTo(9);
    }

    @Test
    void lateDrawingClose_shouldStillLeaveFullRatingTime() {
        // Arrange: both drew, but every client was in the background when the deadline passed
        String code = lifecycleService.createRoom("H", "Host", RoomSettings.of(1, 30));
        lifecycleService.joinRoom(code, "P", "Painter");
        lifecycleService.startGame(code, "H");
        roundCoordinator.submitDrawing(code, "H", 1, "memory://h.png");
        roundCoordinator.submitDrawing(code, "P", 1, "memory://p.png");
        clock.advance(Duration.ofSeconds(120));

        // Act
        TransitionOutcome close = roundCoordinator.closeDrawingPhase(code, 1);
        TransitionOutcome finalizeRightAway = scoringService.finalizeRound(code, 1);

        // Assert
        assertThat(close).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(finalizeRightAway).isEqualTo(TransitionOutcome.NOT_READY);
        assertThat(roomRepository.getByCode(code).getStatus()).isEqualTo(RoomStatus.RATING);

        clock.advance(Duration.ofSeconds(20));
        scoringService.submitRatings(code, "H", 1, Map.of("P", 4));
        scoringService.submitRatings(code, "P", 1, Map.of("H", 3));
        assertThat(scoringService.finalizeRound(code, 1)).isEqualTo(TransitionOutcome.APPLIED);
        assertThat(roomRepository.getByCode(code).getPlayers().get("P").getTotalScore()).isEqualTo(4);
    }

    @Test
    void transitionsAppliedTwice_shouldLeaveSameRoomAsOnce() {
        // Arrange
        String code = lifecycleService.createRoom("H", "Host", RoomSettings.of(2, 30));
        lifecycleService.joinRoom(code, "P", "Painter");

        // lobby -> drawing
        lifecycleService.startGame(code, "H");
        Map<String, Object> afterStart = roomRepository.toRecord(roomRepository.getByCode(code));
        assertThat(lifecycleService.startGame(code, "H")).isEqualTo(TransitionOutcome.ALREADY_APPLIED);
        assertThat(roomRepository.toRecord(roomRepository.getByCode(code))).isEqualTo(afterStart);

        // drawing -> rating
        clock.advance(Duration.ofSeconds(30));
        roundCoordinator.closeDrawingPhase(code, 1);
        Map<String, Object> afterClose = roomRepository.toRecord(roomRepository.getByCode(code));
        assertThat(roundCoordinator.closeDrawingPhase(code, 1)).isEqualTo(TransitionOutcome.ALREADY_APPLIED);
        assertThat(roomRepository.toRecord(roomRepository.getByCode(code))).isEqualTo(afterClose);

        // rating -> results
        clock.advance(Duration.ofSeconds(60));
        scoringService.finalizeRound(code, 1);
        Map<String, Object> afterFinalize = roomRepository.toRecord(roomRepository.getByCode(code));
        assertThat(scoringService.finalizeRound(code, 1)).isEqualTo(TransitionOutcome.ALREADY_APPLIED);
        assertThat(roomRepository.toRecord(roomRepository.getByCode(code))).isEqualTo(afterFinalize);
    }

    @Test
    void concurrentDeadlineDetection_shouldMoveToRatingOnce_withoutDoubleCounting() throws Exception {
        // Arrange
        String code = lifecycleService.createRoom("H", "Host", RoomSettings.of(2, 30));
        lifecycleService.joinRoom(code, "P", "Painter");
        lifecycleService.startGame(code, "H");
        roundCoordinator.submitDrawing(code, "H", 1, "memory://h.png");
        clock.advance(Duration.ofSeconds(30));

        ExecutorService clients = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            // Act: two clients see the deadline at the same time
            Future<TransitionOutcome> first = clients.submit(() -> {
                start.await();
                return roundCoordinator.closeDrawingPhase(code, 1);
            });
            Future<TransitionOutcome> second = clients.submit(() -> {
                start.await();
                return roundCoordinator.closeDrawingPhase(code, 1);
            });
            start.countDown();

            List<TransitionOutcome> outcomes = List.of(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));

            // Assert
            assertThat(outcomes).contains(TransitionOutcome.APPLIED);
        } finally {
            clients.shutdownNow();
        }

        Room room = roomRepository.getByCode(code);
        assertThat(room.getStatus()).isEqualTo(RoomStatus.RATING);
        assertThat(room.getCurrentRound()).isEqualTo(1);
        assertThat(room.drawingsFor(1)).hasSize(2);

        // both clients also finalize the round after the rating deadline
        scoringService.submitRatings(code, "P", 1, Map.of("H", 5));
        clock.advance(Duration.ofSeconds(60));
        scoringService.finalizeRound(code, 1);
        scoringService.finalizeRound(code, 1);
        assertThat(roomRepository.getByCode(code).getPlayers().get("H").getTotalScore()).isEqualTo(5);
    }

    private void drawAll(String code, int round) {
        for (String playerId : List.of("A", "B", "C")) {
            roundCoordinator.submitDrawing(code, playerId, round, "memory://" + playerId + round + ".png");
        }
    }
}
