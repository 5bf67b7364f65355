package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;

public record BooleanSchema(Optional<Boolean> constValue, Optional<Boolean> defaultValue) implements SchemaNode {
    private static final Set<String> FIELDS = SchemaFields.allowed("const", "default");

    public static BooleanSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.BOOLEAN, FIELDS, ctx);
        var constValue = SchemaFields.optionalBoolean(json, "const", ctx);
        var defaultValue = SchemaFields.optionalBoolean(json, "default", ctx);
        Constraints.checkConstDefault(ctx, constValue.isPresent(), defaultValue.isPresent());
        return new BooleanSchema(constValue, defaultValue);
    }

    @Override
    public SchemaType type() {
        return SchemaType.BOOLEAN;
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isBoolean()) {
            throw new DataValidationException(ctx.describe("expected a boolean"));
        }
        if (constValue.isPresent() && constValue.get() != value.booleanValue()) {
            throw new DataValidationException(ctx.describe("value must be const " + constValue.get()));
        }
    }
}
