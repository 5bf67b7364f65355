package work.lcod.lexicon.error;

/**
 * Uniform failure channel for schema checks, data checks and catalog lookups.
 */
public abstract sealed class LexiconException extends RuntimeException
    permits InvalidSchemaException, DataValidationException, LexiconNotFoundException {

    protected LexiconException(String message) {
        super(message);
    }

    public abstract Kind kind();

    @Override
    public String toString() {
        return kind().prefix() + getMessage();
    }

    public enum Kind {
        INVALID_SCHEMA("Invalid lexicon schema: "),
        DATA_VALIDATION("Data validation failed: "),
        LEXICON_NOT_FOUND("Lexicon not found for collection: ");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }
}
