package ch.doodleduel.roomcore.service;

import ch.doodleduel.roomcore.domain.DrawingRef;
import ch.doodleduel.roomcore.domain.Player;
import ch.doodleduel.roomcore.domain.Room;
import ch.doodleduel.roomcore.domain.enums.RoomStatus;
import ch.doodleduel.roomcore.domain.enums.TransitionOutcome;
import ch.doodleduel.roomcore.dto.LeaderboardEntryDto;
import ch.doodleduel.roomcore.exception.InvalidTransitionException;
import ch.doodleduel.roomcore.exception.PlayerNotFoundException;
import ch.doodleduel.roomcore.exception.ValidationException;
import ch.doodleduel.roomcore.repository.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collects ratings, freezes round scores and builds the leaderboard.
 *
 * <p>A round score is the sum of the ratings a player received from everybody else in that round.
 * Scores are frozen under {@code scores/{round}} at the {@code rating -> results} transition and
 * each player's {@code totalScore} is recomputed from the frozen rounds, so repeating the
 * transition never counts a round twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScoringService {

    private final RoomRepository roomRepository;
    private final Clock clock;

    /**
     * Stores the ratings one player gives in a round.
     *
     * @param code room code
     * @param raterId rating player
     * @param round round being rated
     * @param ratings target player id to score (1..5)
     * @throws ValidationException on self-ratings, unknown targets, out-of-range scores
     *                             or missing ratings for real drawings
     * @throws InvalidTransitionException if the round is not being rated or its rating time is up
     */
    public void submitRatings(String code, String raterId, int round, Map<String, Integer> ratings) {
        Room room = roomRepository.getByCode(code);

        if (room.findPlayer(raterId).isEmpty()) {
            throw new PlayerNotFoundException(code, raterId);
        }
        if (room.getStatus() != RoomStatus.RATING || room.getCurrentRound() != round) {
            throw new InvalidTransitionException("Room " + code + " does not accept ratings for round " + round);
        }
        if (clock.millis() >= room.ratingDeadline()) {
            throw new InvalidTransitionException("Rating time is up for round " + round + " in room " + code);
        }
        if (ratings == null || ratings.isEmpty() && !requiredTargets(room, round, raterId).isEmpty()) {
            throw new ValidationException("Please rate all drawings");
        }

        for (Map.Entry<String, Integer> rating : ratings.entrySet()) {
            String targetId = rating.getKey();
            if (raterId.equals(targetId)) {
                throw new ValidationException("You cannot rate your own drawing");
            }
            if (room.findPlayer(targetId).isEmpty()) {
                throw new ValidationException("Player " + targetId + " is not part of room " + code);
            }
            RoomValidator.validateScore(targetId, rating.getValue());
        }

        Set<String> missing = requiredTargets(room, round, raterId).stream()
                .filter(targetId -> !ratings.containsKey(targetId))
                .collect(Collectors.toSet());
        if (!missing.isEmpty()) {
            throw new ValidationException("Please rate all drawings, missing: " + missing);
        }

        roomRepository.patch(code, Map.of("ratings/" + round + "/" + raterId, new LinkedHashMap<>(ratings)));
        log.info("Player {} rated {} drawing(s) in round {} of room {}", raterId, ratings.size(), round, code);
    }

    /**
     * Computes the score of every player for a round from the stored ratings.
     *
     * @param room snapshot
     * @param round 1-based round
     * @return player id to score, 0 for players nobody rated
     */
    public Map<String, Integer> roundScores(Room room, int round) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (Player player : room.playersInJoinOrder()) {
            scores.put(player.getId(), 0);
        }
        room.ratingsFor(round).forEach((raterId, given) -> {
            if (given == null) {
                return;
            }
            given.forEach((targetId, score) -> {
                if (score != null && !targetId.equals(raterId) && scores.containsKey(targetId)) {
                    scores.merge(targetId, score, Integer::sum);
                }
            });
        });
        return scores;
    }

    public int roundScore(Room room, String playerId, int round) {
        return roundScores(room, round).getOrDefault(playerId, 0);
    }

    /**
     * Returns whether every player rated all the drawings they have to rate.
     */
    public boolean allRatingsIn(Room room, int round) {
        Map<String, Map<String, Integer>> ratings = room.ratingsFor(round);
        return room.playersInJoinOrder().stream().allMatch(player -> {
            Map<String, Integer> given = ratings.get(player.getId());
            Set<String> required = requiredTargets(room, round, player.getId());
            return required.isEmpty() || given != null && given.keySet().containsAll(required);
        });
    }

    /**
     * Moves the round from rating to results once all ratings are in or the rating deadline passed.
     *
     * @param code room code
     * @param round round to finalize
     * @return {@code APPLIED}, {@code ALREADY_APPLIED} if results are already out,
     *         {@code NOT_READY} if ratings are missing and the deadline is still ahead
     * @throws InvalidTransitionException if the round has not reached rating yet
     */
    public TransitionOutcome finalizeRound(String code, int round) {
        Room room = roomRepository.getByCode(code);

        if (room.hasReached(round, RoomStatus.RESULTS)) {
            log.debug("Round {} of room {} already finalized", round, code);
            return TransitionOutcome.ALREADY_APPLIED;
        }
        if (!room.hasReached(round, RoomStatus.RATING)) {
            throw new InvalidTransitionException("Round " + round + " of room " + code + " is not being rated");
        }

        if (!allRatingsIn(room, round) && clock.millis() < room.ratingDeadline()) {
            return TransitionOutcome.NOT_READY;
        }

        Map<String, Integer> scores = roundScores(room, round);
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("scores/" + round, scores);
        scores.forEach((playerId, roundScore) -> {
            patch.put("players/" + playerId + "/roundScore", roundScore);
            patch.put("players/" + playerId + "/totalScore", frozenTotalBefore(room, playerId, round) + roundScore);
        });
        patch.put("status", RoomStatus.RESULTS);
        roomRepository.patch(code, patch);

        log.info("Room {} round {} moved to results", code, round);
        return TransitionOutcome.APPLIED;
    }

    /**
     * Ranks the players by total score, ties in join order.
     *
     * @param room snapshot
     * @return entries from first to last place
     */
    public List<LeaderboardEntryDto> leaderboard(Room room) {
        List<Player> ordered = room.playersInJoinOrder().stream()
                .sorted(Comparator.comparingInt(Player::getTotalScore).reversed())
                .toList();
        int completedRounds = completedRounds(room);

        List<LeaderboardEntryDto> entries = new ArrayList<>();
        int rank = 0;
        Integer previousTotal = null;
        for (int i = 0; i < ordered.size(); i++) {
            Player player = ordered.get(i);
            if (previousTotal == null || player.getTotalScore() != previousTotal) {
                rank = i + 1;
                previousTotal = player.getTotalScore();
            }
            double average = completedRounds == 0 ? 0.0 : (double) player.getTotalScore() / completedRounds;
            entries.add(new LeaderboardEntryDto(rank, player.getId(), player.getName(),
                    player.getTotalScore(), player.getRoundScore(), average, player.isHost()));
        }
        return entries;
    }

    // ----------------- helpers -----------------

    /**
     * Players the rater has to rate: everybody else with a real drawing. Placeholders may be rated but need not be.
     */
    private static Set<String> requiredTargets(Room room, int round, String raterId) {
        Map<String, DrawingRef> drawings = room.drawingsFor(round);
        return room.playersInJoinOrder().stream()
                .map(Player::getId)
                .filter(id -> !id.equals(raterId))
                .filter(id -> drawings.get(id) != null && !drawings.get(id).isPlaceholder())
                .collect(Collectors.toSet());
    }

    private static int frozenTotalBefore(Room room, String playerId, int round) {
        int total = 0;
        for (int r = 1; r < round; r++) {
            total += room.frozenScoresFor(r).getOrDefault(playerId, 0);
        }
        return total;
    }

    private static int completedRounds(Room room) {
        int completed = 0;
        for (int r = 1; r <= room.getSettings().getNumRounds(); r++) {
            if (room.getScores() != null && room.getScores().containsKey(r)) {
                completed++;
            }
        }
        return completed;
    }
}
