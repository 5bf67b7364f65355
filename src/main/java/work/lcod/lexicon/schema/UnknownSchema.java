package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * Any JSON object, except the special bytes and blob encodings.
 */
public record UnknownSchema() implements SchemaNode {
    public static UnknownSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.UNKNOWN, SchemaFields.BASE_FIELDS, ctx);
        return new UnknownSchema();
    }

    @Override
    public SchemaType type() {
        return SchemaType.UNKNOWN;
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isObject()) {
            throw new DataValidationException(ctx.describe("expected an object"));
        }
        if (value.has(BytesSchema.BYTES_FIELD)) {
            throw new DataValidationException(ctx.describe("unknown value cannot be a bytes object"));
        }
        JsonNode typeTag = value.get("$type");
        if (typeTag != null && typeTag.isTextual() && BlobSchema.BLOB_TYPE.equals(typeTag.textValue())) {
            throw new DataValidationException(ctx.describe("unknown value cannot be a blob object"));
        }
    }
}
