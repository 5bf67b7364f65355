package work.lcod.lexicon.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.error.LexiconException;
import work.lcod.lexicon.error.LexiconNotFoundException;
import work.lcod.lexicon.format.StringFormat;
import work.lcod.lexicon.format.Syntax;
import work.lcod.lexicon.runtime.LexiconCatalog;
import work.lcod.lexicon.runtime.LexiconDocument;
import work.lcod.lexicon.runtime.Reference;
import work.lcod.lexicon.runtime.TypeDispatcher;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.schema.RpcSchema;
import work.lcod.lexicon.schema.SchemaType;

/**
 * Entry point for validating lexicon documents and the data they describe.
 *
 * <p>Instances only hold immutable {@link ValidationOptions} and may be shared between threads. Each
 * call builds its own catalog from the documents it is given.
 */
public final class LexiconValidator {
    private static final Logger LOGGER = LoggerFactory.getLogger(LexiconValidator.class);

    private final ValidationOptions options;

    public LexiconValidator() {
        this(ValidationOptions.defaults());
    }

    public LexiconValidator(ValidationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public ValidationOptions options() {
        return options;
    }

    /**
     * Validates every definition of every document. Errors are collected per document, one message per
     * failing definition, formatted as {@code <id>#<definition>: <detail>}.
     */
    public ValidationReport validate(List<? extends JsonNode> documents) {
        var errors = new LinkedHashMap<String, List<String>>();
        BiConsumer<String, String> report = (id, message) -> errors.computeIfAbsent(id, k -> new ArrayList<>()).add(message);

        var parsed = new ArrayList<LexiconDocument>();
        var seen = new HashSet<String>();
        for (int i = 0; i < documents.size(); i++) {
            JsonNode json = documents.get(i);
            LexiconDocument document;
            try {
                document = LexiconDocument.parse(json);
            } catch (InvalidSchemaException ex) {
                report.accept(documentKey(json, i), ex.getMessage());
                continue;
            }
            if (!seen.add(document.id()) && options.duplicateIdPolicy() == DuplicateIdPolicy.REJECT) {
                report.accept(document.id(), "duplicate lexicon id '" + document.id() + "'");
                continue;
            }
            parsed.add(document);
        }

        var catalog = LexiconCatalog.of(parsed, options.duplicateIdPolicy());
        var root = ValidationContext.create(catalog, options);
        for (var document : catalog.documents()) {
            int failures = 0;
            for (var definition : document.definitions().entrySet()) {
                String name = definition.getKey();
                var ctx = root.withCurrentDocument(document.id()).withPath("defs." + name);
                try {
                    var type = TypeDispatcher.parse(definition.getValue(), ctx).type();
                    if (type.isPrimary() && !Reference.MAIN.equals(name)) {
                        throw new InvalidSchemaException(ctx.describe(type.tag() + " definitions are only allowed as main"));
                    }
                    TypeDispatcher.checkSchema(definition.getValue(), ctx);
                } catch (LexiconException ex) {
                    failures++;
                    report.accept(document.id(), document.id() + "#" + name + ": " + ex.getMessage());
                }
            }
            LOGGER.debug("Checked lexicon {}: {} definition(s), {} failure(s)", document.id(), document.definitions().size(), failures);
        }
        return new ValidationReport(errors);
    }

    /**
     * Validates a record against the {@code main} definition of {@code typeId}.
     *
     * @throws LexiconNotFoundException if no document has that id
     * @throws InvalidSchemaException if the document has no main definition or a schema is malformed
     * @throws DataValidationException if the record does not conform
     */
    public void validateRecord(List<? extends JsonNode> documents, String typeId, JsonNode record) {
        var catalog = LexiconCatalog.parse(documents, options.duplicateIdPolicy());
        var main = mainDefinition(catalog, typeId);
        ValidationContext.create(catalog, options).withCurrentDocument(typeId).validateData(record, main);
    }

    /**
     * Validates query parameters against the main query, procedure or subscription of {@code typeId}.
     * A definition without parameters accepts anything.
     */
    public void validateParameters(List<? extends JsonNode> documents, String typeId, JsonNode parameters) {
        var target = rpcTarget(documents, typeId);
        target.schema().parameters().ifPresent(p -> p.checkData(parameters, target.ctx().withPath("parameters")));
    }

    public void validateInput(List<? extends JsonNode> documents, String typeId, JsonNode input) {
        var target = rpcTarget(documents, typeId);
        target.schema().input().ifPresent(body -> body.checkData(input, target.ctx().withPath("input")));
    }

    public void validateOutput(List<? extends JsonNode> documents, String typeId, JsonNode output) {
        var target = rpcTarget(documents, typeId);
        target.schema().output().ifPresent(body -> body.checkData(output, target.ctx().withPath("output")));
    }

    public static boolean isValidNsid(String value) {
        return Syntax.isValidNsid(value);
    }

    /**
     * @throws DataValidationException if {@code value} does not match {@code format}
     */
    public static void validateStringFormat(String value, StringFormat format) {
        if (!format.test(value)) {
            throw new DataValidationException("'" + value + "' is not a valid " + format.formatName());
        }
    }

    private RpcTarget rpcTarget(List<? extends JsonNode> documents, String typeId) {
        var catalog = LexiconCatalog.parse(documents, options.duplicateIdPolicy());
        var main = mainDefinition(catalog, typeId);
        var ctx = ValidationContext.create(catalog, options).withCurrentDocument(typeId);
        var node = TypeDispatcher.parse(main, ctx);
        if (!(node instanceof RpcSchema rpc)) {
            throw new InvalidSchemaException("lexicon '" + typeId + "' main definition is a " + node.type().tag()
                + ", not a " + SchemaType.QUERY.tag() + ", " + SchemaType.PROCEDURE.tag() + " or " + SchemaType.SUBSCRIPTION.tag());
        }
        return new RpcTarget(rpc, ctx);
    }

    private static JsonNode mainDefinition(LexiconCatalog catalog, String typeId) {
        var document = catalog.get(typeId).orElseThrow(() -> new LexiconNotFoundException(typeId));
        return document.main()
            .orElseThrow(() -> new InvalidSchemaException("lexicon '" + typeId + "' has no main definition"));
    }

    private static String documentKey(JsonNode json, int index) {
        JsonNode id = json == null ? null : json.get("id");
        if (id != null && id.isTextual() && !id.textValue().isBlank()) {
            return id.textValue();
        }
        return "document[" + index + "]";
    }

    private record RpcTarget(RpcSchema schema, ValidationContext ctx) {}
}
