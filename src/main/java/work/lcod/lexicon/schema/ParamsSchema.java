package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.TypeDispatcher;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * HTTP query parameters of a query, procedure or subscription. Properties are limited to scalar
 * types and arrays of them.
 */
public record ParamsSchema(Map<String, ObjectNode> properties, List<String> required) implements SchemaNode {
    private static final Set<String> FIELDS = SchemaFields.allowed("properties", "required");
    private static final Set<SchemaType> SCALARS =
        EnumSet.of(SchemaType.BOOLEAN, SchemaType.INTEGER, SchemaType.STRING, SchemaType.UNKNOWN);

    public ParamsSchema {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = List.copyOf(required);
    }

    public static ParamsSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.PARAMS, FIELDS, ctx);
        var properties = SchemaFields.objectMap(json, "properties", ctx);
        var required = SchemaFields.optionalStringList(json, "required", ctx).orElse(List.of());
        SchemaFields.checkNamesDeclared("required", required, properties, ctx);
        for (var entry : properties.entrySet()) {
            checkParameterType(entry.getValue(), ctx.withPath("properties." + entry.getKey()));
        }
        return new ParamsSchema(properties, required);
    }

    /**
     * Reads the {@code parameters} member of an RPC definition, which must itself be a params schema.
     */
    static Optional<ParamsSchema> parseMember(ObjectNode json, ValidationContext ctx) {
        var member = SchemaFields.optionalObject(json, "parameters", ctx);
        if (member.isEmpty()) {
            return Optional.empty();
        }
        var memberCtx = ctx.withPath("parameters");
        if (SchemaFields.peekType(member.get()).filter(SchemaType.PARAMS::equals).isEmpty()) {
            throw SchemaFields.invalid(memberCtx, "parameters must be a params schema");
        }
        return Optional.of(parse(member.get(), memberCtx));
    }

    private static void checkParameterType(ObjectNode property, ValidationContext ctx) {
        var type = SchemaFields.peekType(property)
            .orElseThrow(() -> SchemaFields.invalid(ctx, "parameter must declare a known type"));
        if (SCALARS.contains(type)) {
            return;
        }
        if (type == SchemaType.ARRAY) {
            var items = SchemaFields.peekType(property.get("items"));
            if (items.isPresent() && SCALARS.contains(items.get())) {
                return;
            }
            throw SchemaFields.invalid(ctx, "array parameters must hold boolean, integer, string or unknown items");
        }
        throw SchemaFields.invalid(ctx, "parameter type '" + type.tag() + "' is not allowed");
    }

    @Override
    public SchemaType type() {
        return SchemaType.PARAMS;
    }

    @Override
    public void checkSchema(ValidationContext ctx) {
        for (var entry : properties.entrySet()) {
            TypeDispatcher.checkSchema(entry.getValue(), ctx.withPath("properties." + entry.getKey()));
        }
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isObject()) {
            throw new DataValidationException(ctx.describe("expected an object of parameters"));
        }
        for (String name : required) {
            if (!value.has(name)) {
                throw new DataValidationException(ctx.describe("required parameter '" + name + "' is missing"));
            }
        }
        for (var entry : properties.entrySet()) {
            JsonNode member = value.get(entry.getKey());
            if (member == null) {
                continue;
            }
            var child = ctx.withPath(entry.getKey());
            if (member.isNull()) {
                throw new DataValidationException(child.describe("cannot be null"));
            }
            child.validateData(member, entry.getValue());
        }
    }
}
