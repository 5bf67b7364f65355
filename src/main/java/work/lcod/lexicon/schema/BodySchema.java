package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.runtime.TypeDispatcher;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;

/**
 * Input or output body of an RPC definition. Without a {@code schema} the body is opaque and any value
 * passes.
 */
public record BodySchema(String encoding, Optional<String> description, Optional<ObjectNode> schema) {
    private static final Set<String> FIELDS = Set.of("encoding", "description", "schema");
    private static final Set<SchemaType> SCHEMA_TYPES = EnumSet.of(SchemaType.OBJECT, SchemaType.REF, SchemaType.UNION);

    static Optional<BodySchema> parseMember(ObjectNode json, String field, ValidationContext ctx) {
        var member = SchemaFields.optionalObject(json, field, ctx);
        if (member.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(parse(member.get(), ctx.withPath(field)));
    }

    static BodySchema parse(ObjectNode json, ValidationContext ctx) {
        Constraints.checkAllowedFields(ctx, "body", json.fieldNames(), FIELDS);
        String encoding = SchemaFields.requiredString(json, "encoding", ctx);
        if (encoding.isBlank()) {
            throw SchemaFields.invalid(ctx, "encoding must not be empty");
        }
        var description = SchemaFields.optionalString(json, "description", ctx);
        var schema = SchemaFields.optionalObject(json, "schema", ctx);
        if (schema.isPresent()) {
            var type = SchemaFields.peekType(schema.get());
            if (type.isEmpty() || !SCHEMA_TYPES.contains(type.get())) {
                throw SchemaFields.invalid(ctx.withPath("schema"), "body schema must be an object, ref or union");
            }
        }
        return new BodySchema(encoding, description, schema);
    }

    public void checkSchema(ValidationContext ctx) {
        schema.ifPresent(s -> TypeDispatcher.checkSchema(s, ctx.withPath("schema")));
    }

    public void checkData(JsonNode value, ValidationContext ctx) {
        schema.ifPresent(s -> ctx.validateData(value, s));
    }
}
