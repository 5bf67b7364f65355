package work.lcod.lexicon.format;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Known values of the {@code format} field of string schemas.
 */
public enum StringFormat {
    DATETIME("datetime", Syntax::isValidDatetime),
    URI("uri", Syntax::isValidUri),
    AT_URI("at-uri", Syntax::isValidAtUri),
    DID("did", Syntax::isValidDid),
    HANDLE("handle", Syntax::isValidHandle),
    AT_IDENTIFIER("at-identifier", Syntax::isValidAtIdentifier),
    NSID("nsid", Syntax::isValidNsid),
    CID("cid", Syntax::isValidCid),
    LANGUAGE("language", Syntax::isValidLanguage),
    TID("tid", Syntax::isValidTid),
    RECORD_KEY("record-key", Syntax::isValidRecordKey);

    private final String formatName;
    private final Predicate<String> predicate;

    StringFormat(String formatName, Predicate<String> predicate) {
        this.formatName = formatName;
        this.predicate = predicate;
    }

    public String formatName() {
        return formatName;
    }

    public boolean test(String value) {
        return predicate.test(value);
    }

    public static Optional<StringFormat> fromName(String name) {
        return Arrays.stream(values())
            .filter(format -> format.formatName.equals(name))
            .findFirst();
    }
}
