package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.error.LexiconNotFoundException;
import work.lcod.lexicon.runtime.Reference;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * Reference handling shared by {@link RefSchema} and {@link UnionSchema}.
 */
final class ReferenceSupport {
    private ReferenceSupport() {}

    static void checkSyntax(String raw, ValidationContext ctx) {
        try {
            Reference.checkSyntax(raw);
        } catch (InvalidSchemaException ex) {
            throw SchemaFields.invalid(ctx, ex.getMessage());
        }
    }

    /**
     * Schema pass: confirms the target exists. Skipped when there is no current document to resolve
     * local references against.
     */
    static void checkResolvable(String raw, ValidationContext ctx) {
        if (ctx.currentDocumentId().isEmpty()) {
            return;
        }
        try {
            ctx.resolve(raw);
        } catch (LexiconNotFoundException ex) {
            throw SchemaFields.invalid(ctx, "reference '" + raw + "' points to unknown lexicon '" + ex.lexiconId() + "'");
        } catch (InvalidSchemaException ex) {
            throw SchemaFields.invalid(ctx, ex.getMessage());
        }
    }

    /**
     * Data pass: validates {@code value} against the definition {@code raw} points to, refusing to
     * enter a reference that is already being followed on the current chain.
     */
    static void follow(String raw, JsonNode value, ValidationContext ctx) {
        if (ctx.currentDocumentId().isEmpty()) {
            throw SchemaFields.invalid(ctx, "cannot resolve reference '" + raw + "' without a current lexicon");
        }
        Reference target;
        ObjectNode schema;
        try {
            target = ctx.parseReference(raw);
            if (ctx.hasReference(target.canonical())) {
                throw new DataValidationException(ctx.describe("circular reference detected: " + target.canonical()));
            }
            schema = ctx.catalog().resolve(target);
        } catch (InvalidSchemaException ex) {
            throw SchemaFields.invalid(ctx, ex.getMessage());
        }
        ctx.withReference(target.canonical())
            .withCurrentDocument(target.documentId())
            .validateData(value, schema);
    }
}
