package work.lcod.lexicon.error;

/**
 * A requested lexicon id is absent from the catalog. The message is the missing id.
 */
public final class LexiconNotFoundException extends LexiconException {
    private final String lexiconId;

    public LexiconNotFoundException(String lexiconId) {
        super(lexiconId);
        this.lexiconId = lexiconId;
    }

    public String lexiconId() {
        return lexiconId;
    }

    @Override
    public Kind kind() {
        return Kind.LEXICON_NOT_FOUND;
    }
}
