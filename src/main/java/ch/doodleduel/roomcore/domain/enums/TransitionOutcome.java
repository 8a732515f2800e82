package ch.doodleduel.roomcore.domain.enums;

/**
 * Result of a guarded phase transition.
 *
 * <p>Several clients race to apply the same transition. Only the first patch changes the room,
 * every later attempt observes the post-transition snapshot and reports {@link #ALREADY_APPLIED}.
 * That outcome is a success and is never shown to the user.
 */
public enum TransitionOutcome {
    APPLIED,
    ALREADY_APPLIED,
    /**
     * The triggering condition (all submissions in, or deadline passed) does not hold yet.
     */
    NOT_READY
}
