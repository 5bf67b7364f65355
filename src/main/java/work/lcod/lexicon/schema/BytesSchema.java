package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Base64;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;

/**
 * Raw bytes, encoded in JSON as {@code {"$bytes": "<base64>"}}. Length bounds apply to the decoded bytes.
 */
public record BytesSchema(Optional<Integer> minLength, Optional<Integer> maxLength) implements SchemaNode {
    static final String BYTES_FIELD = "$bytes";
    private static final Set<String> FIELDS = SchemaFields.allowed("minLength", "maxLength");

    public static BytesSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.BYTES, FIELDS, ctx);
        var minLength = SchemaFields.optionalLength(json, "minLength", ctx);
        var maxLength = SchemaFields.optionalLength(json, "maxLength", ctx);
        Constraints.checkRange(ctx, "minLength", minLength, "maxLength", maxLength);
        return new BytesSchema(minLength, maxLength);
    }

    @Override
    public SchemaType type() {
        return SchemaType.BYTES;
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isObject() || value.size() != 1 || !value.has(BYTES_FIELD)) {
            throw new DataValidationException(ctx.describe("expected an object with a single '$bytes' field"));
        }
        JsonNode encoded = value.get(BYTES_FIELD);
        if (!encoded.isTextual()) {
            throw new DataValidationException(ctx.describe("$bytes must be a base64 string"));
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encoded.textValue());
        } catch (IllegalArgumentException ex) {
            throw new DataValidationException(ctx.describe("$bytes is not valid base64: " + ex.getMessage()));
        }
        Constraints.checkBounds(ctx, "byte length", decoded.length, "minLength", minLength, "maxLength", maxLength);
    }
}
