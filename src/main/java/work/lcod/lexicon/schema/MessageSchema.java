package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.runtime.TypeDispatcher;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;

/**
 * Message stream of a subscription; its schema, when given, is a union of the message types.
 */
public record MessageSchema(Optional<String> description, Optional<ObjectNode> schema) {
    private static final Set<String> FIELDS = Set.of("description", "schema");

    static Optional<MessageSchema> parseMember(ObjectNode json, ValidationContext ctx) {
        var member = SchemaFields.optionalObject(json, "message", ctx);
        if (member.isEmpty()) {
            return Optional.empty();
        }
        var memberCtx = ctx.withPath("message");
        Constraints.checkAllowedFields(memberCtx, "message", member.get().fieldNames(), FIELDS);
        var description = SchemaFields.optionalString(member.get(), "description", memberCtx);
        var schema = SchemaFields.optionalObject(member.get(), "schema", memberCtx);
        if (schema.isPresent() && SchemaFields.peekType(schema.get()).filter(SchemaType.UNION::equals).isEmpty()) {
            throw SchemaFields.invalid(memberCtx.withPath("schema"), "message schema must be a union");
        }
        return Optional.of(new MessageSchema(description, schema));
    }

    public void checkSchema(ValidationContext ctx) {
        schema.ifPresent(s -> TypeDispatcher.checkSchema(s, ctx.withPath("schema")));
    }
}
