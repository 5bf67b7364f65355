package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.format.StringFormat;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;
import work.lcod.lexicon.shared.Graphemes;

/**
 * String with byte-length and grapheme bounds, an optional format and closed or open value sets.
 * {@code minLength}/{@code maxLength} count UTF-8 bytes.
 */
public record StringSchema(
    Optional<StringFormat> format,
    Optional<Integer> minLength,
    Optional<Integer> maxLength,
    Optional<Integer> minGraphemes,
    Optional<Integer> maxGraphemes,
    Optional<List<String>> enumValues,
    Optional<List<String>> knownValues,
    Optional<String> constValue,
    Optional<String> defaultValue
) implements SchemaNode {
    private static final Set<String> FIELDS = SchemaFields.allowed(
        "format", "minLength", "maxLength", "minGraphemes", "maxGraphemes",
        "knownValues", "enum", "const", "default"
    );

    public static StringSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.STRING, FIELDS, ctx);
        Optional<StringFormat> format = Optional.empty();
        var formatName = SchemaFields.optionalString(json, "format", ctx);
        if (formatName.isPresent()) {
            format = Optional.of(StringFormat.fromName(formatName.get())
                .orElseThrow(() -> SchemaFields.invalid(ctx, "unknown string format '" + formatName.get() + "'")));
        }
        var minLength = SchemaFields.optionalLength(json, "minLength", ctx);
        var maxLength = SchemaFields.optionalLength(json, "maxLength", ctx);
        Constraints.checkRange(ctx, "minLength", minLength, "maxLength", maxLength);
        var minGraphemes = SchemaFields.optionalLength(json, "minGraphemes", ctx);
        var maxGraphemes = SchemaFields.optionalLength(json, "maxGraphemes", ctx);
        Constraints.checkRange(ctx, "minGraphemes", minGraphemes, "maxGraphemes", maxGraphemes);
        var constValue = SchemaFields.optionalString(json, "const", ctx);
        var defaultValue = SchemaFields.optionalString(json, "default", ctx);
        Constraints.checkConstDefault(ctx, constValue.isPresent(), defaultValue.isPresent());
        return new StringSchema(
            format,
            minLength,
            maxLength,
            minGraphemes,
            maxGraphemes,
            SchemaFields.optionalStringList(json, "enum", ctx),
            SchemaFields.optionalStringList(json, "knownValues", ctx),
            constValue,
            defaultValue
        );
    }

    @Override
    public SchemaType type() {
        return SchemaType.STRING;
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isTextual()) {
            throw new DataValidationException(ctx.describe("expected a string"));
        }
        String text = value.textValue();
        if (constValue.isPresent() && !constValue.get().equals(text)) {
            throw new DataValidationException(ctx.describe("value must be const '" + constValue.get() + "'"));
        }
        if (minLength.isPresent() || maxLength.isPresent()) {
            int bytes = text.getBytes(StandardCharsets.UTF_8).length;
            Constraints.checkBounds(ctx, "string length", bytes, "minLength", minLength, "maxLength", maxLength);
        }
        if (minGraphemes.isPresent() || maxGraphemes.isPresent()) {
            int graphemes = Graphemes.count(text);
            Constraints.checkBounds(ctx, "grapheme count", graphemes, "minGraphemes", minGraphemes, "maxGraphemes", maxGraphemes);
        }
        if (format.isPresent() && !format.get().test(text)) {
            throw new DataValidationException(ctx.describe(
                "'" + text + "' is not a valid " + format.get().formatName()
            ));
        }
        Constraints.checkEnum(ctx, text, enumValues);
    }
}
