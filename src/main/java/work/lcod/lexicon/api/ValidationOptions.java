package work.lcod.lexicon.api;

import java.util.Objects;

/**
 * Immutable settings shared by every validation call made through a {@link LexiconValidator}.
 *
 * @param maxDepth ceiling on path nesting during a single traversal
 * @param duplicateIdPolicy how the catalog reacts to two documents with the same id
 */
public record ValidationOptions(int maxDepth, DuplicateIdPolicy duplicateIdPolicy) {
    public static final int DEFAULT_MAX_DEPTH = 128;

    public ValidationOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        Objects.requireNonNull(duplicateIdPolicy, "duplicateIdPolicy");
    }

    public static ValidationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().maxDepth(maxDepth).duplicateIdPolicy(duplicateIdPolicy);
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private DuplicateIdPolicy duplicateIdPolicy = DuplicateIdPolicy.REJECT;

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder duplicateIdPolicy(DuplicateIdPolicy duplicateIdPolicy) {
            this.duplicateIdPolicy = duplicateIdPolicy;
            return this;
        }

        public ValidationOptions build() {
            return new ValidationOptions(maxDepth, duplicateIdPolicy);
        }
    }
}
