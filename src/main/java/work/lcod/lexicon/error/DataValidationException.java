package work.lcod.lexicon.error;

/**
 * A data value does not conform to an otherwise valid schema.
 */
public final class DataValidationException extends LexiconException {
    public DataValidationException(String message) {
        super(message);
    }

    @Override
    public Kind kind() {
        return Kind.DATA_VALIDATION;
    }
}
