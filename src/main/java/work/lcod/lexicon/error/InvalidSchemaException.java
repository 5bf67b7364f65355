package work.lcod.lexicon.error;

/**
 * The lexicon document itself is malformed.
 */
public final class InvalidSchemaException extends LexiconException {
    public InvalidSchemaException(String message) {
        super(message);
    }

    @Override
    public Kind kind() {
        return Kind.INVALID_SCHEMA;
    }
}
