package ch.doodleduel.roomcore.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates and normalizes the short room codes players type in to join.
 *
 * <p>Codes are 6 characters long. {@code O} and {@code 0} are left out because they are easily confused.
 */
@Component
public class RoomCodeGenerator {

    public static final String CHARS = "ABCDEFGHJKLMNPQRSTUVWXYZ123456789";
    public static final int LENGTH = 6;

    public String generate() {
        StringBuilder code = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            code.append(CHARS.charAt(ThreadLocalRandom.current().nextInt(CHARS.length())));
        }
        return code.toString();
    }

    public boolean isValid(String code) {
        if (code == null || code.length() != LENGTH) {
            return false;
        }
        return code.chars().allMatch(c -> CHARS.indexOf(c) >= 0);
    }

    /**
     * Trims and upper-cases user input.
     *
     * @param code raw input, may be null
     * @return normalized code, empty string for null input
     */
    public String normalize(String code) {
        return code == null ? "" : code.trim().toUpperCase();
    }
}
