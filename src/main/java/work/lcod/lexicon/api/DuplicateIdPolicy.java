package work.lcod.lexicon.api;

import java.util.Locale;

/**
 * Describes how a catalog treats two documents carrying the same lexicon id.
 */
public enum DuplicateIdPolicy {
    REJECT,
    LAST_WINS;

    public static DuplicateIdPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return REJECT;
        }
        try {
            return DuplicateIdPolicy.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported duplicate id policy: " + value);
        }
    }
}
