package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.TypeDispatcher;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;

public record ArraySchema(ObjectNode items, Optional<Integer> minLength, Optional<Integer> maxLength) implements SchemaNode {
    private static final Set<String> FIELDS = SchemaFields.allowed("items", "minLength", "maxLength");

    public static ArraySchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.ARRAY, FIELDS, ctx);
        var items = SchemaFields.requiredObject(json, "items", ctx);
        var minLength = SchemaFields.optionalLength(json, "minLength", ctx);
        var maxLength = SchemaFields.optionalLength(json, "maxLength", ctx);
        Constraints.checkRange(ctx, "minLength", minLength, "maxLength", maxLength);
        return new ArraySchema(items, minLength, maxLength);
    }

    @Override
    public SchemaType type() {
        return SchemaType.ARRAY;
    }

    @Override
    public void checkSchema(ValidationContext ctx) {
        var child = ctx.withPath("items");
        var type = SchemaFields.peekType(items);
        if (type.isPresent() && type.get().isTopLevelOnly()) {
            throw SchemaFields.invalid(child, type.get().tag() + " cannot be used as array items");
        }
        TypeDispatcher.checkSchema(items, child);
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isArray()) {
            throw new DataValidationException(ctx.describe("expected an array"));
        }
        Constraints.checkBounds(ctx, "array length", value.size(), "minLength", minLength, "maxLength", maxLength);
        for (int i = 0; i < value.size(); i++) {
            ctx.withIndex(i).validateData(value.get(i), items);
        }
    }
}
