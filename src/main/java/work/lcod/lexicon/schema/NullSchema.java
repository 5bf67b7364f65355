package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.ValidationContext;

public record NullSchema() implements SchemaNode {
    public static NullSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.NULL, SchemaFields.BASE_FIELDS, ctx);
        return new NullSchema();
    }

    @Override
    public SchemaType type() {
        return SchemaType.NULL;
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isNull()) {
            throw new DataValidationException(ctx.describe("expected null"));
        }
    }
}
