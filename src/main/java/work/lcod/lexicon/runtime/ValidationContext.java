package work.lcod.lexicon.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.api.ValidationOptions;
import work.lcod.lexicon.error.InvalidSchemaException;

/**
 * State threaded through a single validation call: the catalog, the location used in error messages,
 * the document local references resolve against, and the references entered but not yet left.
 *
 * <p>Instances are immutable. Every {@code with*} method returns a new context, so sibling branches of
 * the traversal never observe each other's path or reference state.
 */
public final class ValidationContext {
    private final LexiconCatalog catalog;
    private final ValidationOptions options;
    private final DataValidator dataValidator;
    private final String path;
    private final String currentDocumentId;
    private final Set<String> references;
    private final int depth;

    private ValidationContext(
        LexiconCatalog catalog,
        ValidationOptions options,
        DataValidator dataValidator,
        String path,
        String currentDocumentId,
        Set<String> references,
        int depth
    ) {
        this.catalog = catalog;
        this.options = options;
        this.dataValidator = dataValidator;
        this.path = path;
        this.currentDocumentId = currentDocumentId;
        this.references = references;
        this.depth = depth;
    }

    public static ValidationContext create(LexiconCatalog catalog, ValidationOptions options) {
        return create(catalog, options, TypeDispatcher::checkData);
    }

    public static ValidationContext create(LexiconCatalog catalog, ValidationOptions options, DataValidator dataValidator) {
        return new ValidationContext(
            Objects.requireNonNull(catalog, "catalog"),
            Objects.requireNonNull(options, "options"),
            Objects.requireNonNull(dataValidator, "dataValidator"),
            "",
            null,
            Set.of(),
            0
        );
    }

    /**
     * A context with an empty catalog and no current document, for checking a single schema on its own.
     * References are only checked for syntax in such a context.
     */
    public static ValidationContext isolated() {
        return create(LexiconCatalog.empty(), ValidationOptions.defaults());
    }

    public LexiconCatalog catalog() {
        return catalog;
    }

    public ValidationOptions options() {
        return options;
    }

    public String path() {
        return path;
    }

    public int depth() {
        return depth;
    }

    public Optional<String> currentDocumentId() {
        return Optional.ofNullable(currentDocumentId);
    }

    public Set<String> references() {
        return references;
    }

    public ValidationContext withPath(String segment) {
        String next = path.isEmpty() ? segment : path + "." + segment;
        return new ValidationContext(catalog, options, dataValidator, next, currentDocumentId, references, depth + 1);
    }

    public ValidationContext withIndex(int index) {
        return new ValidationContext(
            catalog, options, dataValidator, path + "[" + index + "]", currentDocumentId, references, depth + 1
        );
    }

    public ValidationContext withCurrentDocument(String documentId) {
        return new ValidationContext(catalog, options, dataValidator, path, documentId, references, depth);
    }

    public ValidationContext withReference(String reference) {
        var next = new LinkedHashSet<>(references);
        next.add(reference);
        return new ValidationContext(
            catalog, options, dataValidator, path, currentDocumentId, Collections.unmodifiableSet(next), depth
        );
    }

    public boolean hasReference(String reference) {
        return references.contains(reference);
    }

    public Reference parseReference(String raw) {
        return Reference.parse(raw, currentDocumentId);
    }

    /**
     * Resolves a local, global or fragment reference against the catalog.
     *
     * @throws InvalidSchemaException if the reference is malformed or the definition is missing
     * @throws work.lcod.lexicon.error.LexiconNotFoundException if the target document is missing
     */
    public ObjectNode resolve(String reference) {
        return catalog.resolve(parseReference(reference));
    }

    public void validateData(JsonNode value, JsonNode schema) {
        dataValidator.validate(value, schema, this);
    }

    /**
     * Prefixes a message with the current location, or returns it unchanged at the root.
     */
    public String describe(String message) {
        return path.isEmpty() ? message : path + ": " + message;
    }
}
