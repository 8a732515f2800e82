package ch.doodleduel.roomcore.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Reference to an uploaded drawing, stored under {@code drawings/{round}/{playerId}}.
 *
 * <p>A placeholder stands in for a player who could not or did not draw: a restricted
 * platform, an empty canvas or a missed deadline. Placeholders take part in the rating
 * phase but nobody is required to rate them.
 */
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DrawingRef {

    /**
     * Opaque artifact reference; may be null for placeholders.
     */
    private String url;

    private long submittedAt;

    @JsonProperty("isPlaceholder")
    private boolean placeholder;

    private DrawingRef(String url, long submittedAt, boolean placeholder) {
        this.url = url;
        this.submittedAt = submittedAt;
        this.placeholder = placeholder;
    }

    public static DrawingRef of(String url, long submittedAt) {
        return new DrawingRef(url, submittedAt, false);
    }

    public static DrawingRef placeholder(long submittedAt) {
        return new DrawingRef(null, submittedAt, true);
    }
}
