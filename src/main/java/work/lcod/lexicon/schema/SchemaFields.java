package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;

/**
 * Typed accessors over a schema's JSON fields. Each raises {@link InvalidSchemaException} when the
 * field is present with the wrong shape.
 */
final class SchemaFields {
    static final Set<String> BASE_FIELDS = Set.of("type", "description");

    private SchemaFields() {}

    static Set<String> allowed(String... fields) {
        return Stream.concat(BASE_FIELDS.stream(), Stream.of(fields)).collect(Collectors.toUnmodifiableSet());
    }

    static void allowOnly(ObjectNode json, SchemaType type, Set<String> allowed, ValidationContext ctx) {
        Constraints.checkAllowedFields(ctx, type.tag(), json.fieldNames(), allowed);
        optionalString(json, "description", ctx);
    }

    static Optional<String> optionalString(ObjectNode json, String field, ValidationContext ctx) {
        JsonNode node = json.get(field);
        if (node == null) {
            return Optional.empty();
        }
        if (!node.isTextual()) {
            throw invalid(ctx, field + " must be a string");
        }
        return Optional.of(node.textValue());
    }

    static String requiredString(ObjectNode json, String field, ValidationContext ctx) {
        return optionalString(json, field, ctx).orElseThrow(() -> invalid(ctx, "missing required field '" + field + "'"));
    }

    static Optional<Boolean> optionalBoolean(ObjectNode json, String field, ValidationContext ctx) {
        JsonNode node = json.get(field);
        if (node == null) {
            return Optional.empty();
        }
        if (!node.isBoolean()) {
            throw invalid(ctx, field + " must be a boolean");
        }
        return Optional.of(node.booleanValue());
    }

    static Optional<Long> optionalInteger(ObjectNode json, String field, ValidationContext ctx) {
        JsonNode node = json.get(field);
        if (node == null) {
            return Optional.empty();
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw invalid(ctx, field + " must be an integer");
        }
        return Optional.of(node.longValue());
    }

    static Optional<Integer> optionalLength(ObjectNode json, String field, ValidationContext ctx) {
        JsonNode node = json.get(field);
        if (node == null) {
            return Optional.empty();
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() < 0) {
            throw invalid(ctx, field + " must be a non-negative integer");
        }
        return Optional.of(node.intValue());
    }

    static Optional<List<String>> optionalStringList(ObjectNode json, String field, ValidationContext ctx) {
        JsonNode node = json.get(field);
        if (node == null) {
            return Optional.empty();
        }
        if (!node.isArray()) {
            throw invalid(ctx, field + " must be an array of strings");
        }
        var values = new ArrayList<String>();
        for (var item : node) {
            if (!item.isTextual()) {
                throw invalid(ctx, field + " must be an array of strings");
            }
            values.add(item.textValue());
        }
        return Optional.of(List.copyOf(values));
    }

    static List<String> requiredStringList(ObjectNode json, String field, ValidationContext ctx) {
        return optionalStringList(json, field, ctx).orElseThrow(() -> invalid(ctx, "missing required field '" + field + "'"));
    }

    static Optional<List<Long>> optionalIntegerList(ObjectNode json, String field, ValidationContext ctx) {
        JsonNode node = json.get(field);
        if (node == null) {
            return Optional.empty();
        }
        if (!node.isArray()) {
            throw invalid(ctx, field + " must be an array of integers");
        }
        var values = new ArrayList<Long>();
        for (var item : node) {
            if (!item.isIntegralNumber() || !item.canConvertToLong()) {
                throw invalid(ctx, field + " must be an array of integers");
            }
            values.add(item.longValue());
        }
        return Optional.of(List.copyOf(values));
    }

    static Optional<ObjectNode> optionalObject(ObjectNode json, String field, ValidationContext ctx) {
        JsonNode node = json.get(field);
        if (node == null) {
            return Optional.empty();
        }
        if (!node.isObject()) {
            throw invalid(ctx, field + " must be an object");
        }
        return Optional.of((ObjectNode) node);
    }

    static ObjectNode requiredObject(ObjectNode json, String field, ValidationContext ctx) {
        return optionalObject(json, field, ctx).orElseThrow(() -> invalid(ctx, "missing required field '" + field + "'"));
    }

    /**
     * Reads a map of name to nested schema object, preserving declaration order.
     */
    static Map<String, ObjectNode> objectMap(ObjectNode json, String field, ValidationContext ctx) {
        var result = new LinkedHashMap<String, ObjectNode>();
        var container = optionalObject(json, field, ctx);
        if (container.isEmpty()) {
            return result;
        }
        var fields = container.get().fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (entry.getKey().isEmpty()) {
                throw invalid(ctx, field + " names must not be empty");
            }
            if (!entry.getValue().isObject()) {
                throw invalid(ctx, field + "." + entry.getKey() + " must be an object");
            }
            result.put(entry.getKey(), (ObjectNode) entry.getValue());
        }
        return result;
    }

    /**
     * Reads the {@code type} tag of a nested schema without interpreting the rest of it.
     */
    static Optional<SchemaType> peekType(JsonNode schema) {
        JsonNode tag = schema == null ? null : schema.get("type");
        if (tag == null || !tag.isTextual()) {
            return Optional.empty();
        }
        return SchemaType.fromTag(tag.textValue());
    }

    static void checkNamesDeclared(String field, List<String> names, Map<String, ObjectNode> properties, ValidationContext ctx) {
        for (String name : names) {
            if (!properties.containsKey(name)) {
                throw invalid(ctx, field + " names '" + name + "', which is not defined in properties");
            }
        }
    }

    static InvalidSchemaException invalid(ValidationContext ctx, String message) {
        return new InvalidSchemaException(ctx.describe(message));
    }
}
