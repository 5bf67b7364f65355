package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;

/**
 * Signed 64-bit integer with an inclusive range and an optional value set.
 */
public record IntegerSchema(
    Optional<Long> minimum,
    Optional<Long> maximum,
    Optional<List<Long>> enumValues,
    Optional<Long> constValue,
    Optional<Long> defaultValue
) implements SchemaNode {
    private static final Set<String> FIELDS = SchemaFields.allowed("minimum", "maximum", "enum", "const", "default");

    public static IntegerSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.INTEGER, FIELDS, ctx);
        var minimum = SchemaFields.optionalInteger(json, "minimum", ctx);
        var maximum = SchemaFields.optionalInteger(json, "maximum", ctx);
        Constraints.checkRange(ctx, "minimum", minimum, "maximum", maximum);
        var constValue = SchemaFields.optionalInteger(json, "const", ctx);
        var defaultValue = SchemaFields.optionalInteger(json, "default", ctx);
        Constraints.checkConstDefault(ctx, constValue.isPresent(), defaultValue.isPresent());
        return new IntegerSchema(
            minimum,
            maximum,
            SchemaFields.optionalIntegerList(json, "enum", ctx),
            constValue,
            defaultValue
        );
    }

    @Override
    public SchemaType type() {
        return SchemaType.INTEGER;
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new DataValidationException(ctx.describe("expected an integer"));
        }
        long number = value.longValue();
        if (constValue.isPresent() && constValue.get() != number) {
            throw new DataValidationException(ctx.describe("value must be const " + constValue.get()));
        }
        Constraints.checkBounds(ctx, "value", number, "minimum", minimum, "maximum", maximum);
        Constraints.checkEnum(ctx, number, enumValues);
    }
}
