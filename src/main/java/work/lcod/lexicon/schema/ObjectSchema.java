package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.TypeDispatcher;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * Object with named properties. Data members that are not declared are accepted as-is.
 */
public record ObjectSchema(Map<String, ObjectNode> properties, List<String> required, List<String> nullable)
    implements SchemaNode {
    private static final Set<String> FIELDS = SchemaFields.allowed("properties", "required", "nullable");

    public ObjectSchema {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = List.copyOf(required);
        nullable = List.copyOf(nullable);
    }

    public static ObjectSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.OBJECT, FIELDS, ctx);
        var properties = SchemaFields.objectMap(json, "properties", ctx);
        var required = SchemaFields.optionalStringList(json, "required", ctx).orElse(List.of());
        var nullable = SchemaFields.optionalStringList(json, "nullable", ctx).orElse(List.of());
        SchemaFields.checkNamesDeclared("required", required, properties, ctx);
        SchemaFields.checkNamesDeclared("nullable", nullable, properties, ctx);
        return new ObjectSchema(properties, required, nullable);
    }

    @Override
    public SchemaType type() {
        return SchemaType.OBJECT;
    }

    @Override
    public void checkSchema(ValidationContext ctx) {
        for (var entry : properties.entrySet()) {
            var child = ctx.withPath("properties." + entry.getKey());
            var type = SchemaFields.peekType(entry.getValue());
            if (type.isPresent() && type.get().isTopLevelOnly()) {
                throw SchemaFields.invalid(child, type.get().tag() + " cannot be used as an object property");
            }
            TypeDispatcher.checkSchema(entry.getValue(), child);
        }
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isObject()) {
            throw new DataValidationException(ctx.describe("expected an object"));
        }
        for (String name : required) {
            if (!value.has(name)) {
                throw new DataValidationException(ctx.describe("required field '" + name + "' is missing"));
            }
        }
        for (var entry : properties.entrySet()) {
            JsonNode member = value.get(entry.getKey());
            if (member == null) {
                continue;
            }
            var child = ctx.withPath(entry.getKey());
            // A property typed null takes JSON null without being listed in nullable.
            if (member.isNull() && SchemaFields.peekType(entry.getValue()).orElse(null) != SchemaType.NULL) {
                if (nullable.contains(entry.getKey())) {
                    continue;
                }
                throw new DataValidationException(child.describe("cannot be null"));
            }
            child.validateData(member, entry.getValue());
        }
    }
}
