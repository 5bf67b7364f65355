package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * A named symbol with no data of its own. Values carry the fully-qualified token name; matching
 * against an expected set of tokens is left to the enclosing schema.
 */
public record TokenSchema() implements SchemaNode {
    public static TokenSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.TOKEN, SchemaFields.BASE_FIELDS, ctx);
        return new TokenSchema();
    }

    @Override
    public SchemaType type() {
        return SchemaType.TOKEN;
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isTextual() || value.textValue().isEmpty()) {
            throw new DataValidationException(ctx.describe("expected a non-empty token name"));
        }
    }
}
