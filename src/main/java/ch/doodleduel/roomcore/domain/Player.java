package ch.doodleduel.roomcore.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A participant of a room, stored under {@code players/{id}}.
 *
 * <p>Every field of a player is written only by that player itself (join, submission) or by
 * the idempotent round transitions (scores), so players never race on each other's keys.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Player {

    /**
     * Stable anonymous device id handed out by the identity provider.
     */
    private String id;

    /**
     * Display name, trimmed.
     */
    private String name;

    @JsonProperty("isHost")
    private boolean host;

    /**
     * Score received in the most recently completed round.
     */
    private int roundScore;

    /**
     * Sum of all frozen round scores; never decreases.
     */
    private int totalScore;

    /**
     * Display flag; only meaningful together with {@link #submittedRound}.
     */
    private boolean hasSubmitted;

    /**
     * Round the {@link #hasSubmitted} flag belongs to.
     */
    private int submittedRound;

    /**
     * Join timestamp in epoch milliseconds, used as the leaderboard tie-breaker.
     */
    private long joinedAt;

    public Player(String id, String name, boolean host, long joinedAt) {
        this.id = id;
        this.name = name;
        this.host = host;
        this.joinedAt = joinedAt;
    }

    /**
     * Returns whether this player submitted a drawing for the given round.
     *
     * @param round 1-based round number
     * @return true only if the flag was written for exactly that round
     */
    public boolean hasSubmittedFor(int round) {
        return hasSubmitted && submittedRound == round;
    }
}
