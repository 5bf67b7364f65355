package work.lcod.lexicon.runtime;

import java.util.Objects;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.format.Syntax;

/**
 * A parsed reference: the target document id and the definition name inside it.
 *
 * <p>Three textual forms are accepted: {@code #name} (local to the current document), {@code nsid}
 * (the {@code main} definition of another document) and {@code nsid#name}.
 */
public record Reference(String documentId, String definition) {
    public static final String MAIN = "main";

    public Reference {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(definition, "definition");
    }

    public static Reference parse(String raw, String currentDocumentId) {
        checkSyntax(raw);
        if (raw.startsWith("#")) {
            if (currentDocumentId == null) {
                throw new InvalidSchemaException("local reference '" + raw + "' used without a current lexicon");
            }
            return new Reference(currentDocumentId, raw.substring(1));
        }
        int hash = raw.indexOf('#');
        if (hash < 0) {
            return new Reference(raw, MAIN);
        }
        return new Reference(raw.substring(0, hash), raw.substring(hash + 1));
    }

    /**
     * Validates the textual form without resolving anything.
     */
    public static void checkSyntax(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidSchemaException("reference must not be empty");
        }
        int hash = raw.indexOf('#');
        if (hash != raw.lastIndexOf('#')) {
            throw new InvalidSchemaException("reference '" + raw + "' contains more than one '#'");
        }
        if (hash == 0) {
            if (raw.length() == 1) {
                throw new InvalidSchemaException("local reference '#' is missing a definition name");
            }
            return;
        }
        String documentId = hash < 0 ? raw : raw.substring(0, hash);
        if (hash >= 0 && hash == raw.length() - 1) {
            throw new InvalidSchemaException("reference '" + raw + "' is missing a definition name");
        }
        if (!Syntax.isValidNsid(documentId)) {
            throw new InvalidSchemaException("reference '" + raw + "' does not name a valid NSID");
        }
    }

    public static boolean isLocal(String raw) {
        return raw != null && raw.startsWith("#");
    }

    /**
     * Fully-qualified {@code nsid#name} form, identical for every spelling of the same target.
     */
    public String canonical() {
        return documentId + "#" + definition;
    }

    @Override
    public String toString() {
        return canonical();
    }
}
