package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Set;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * Indirection to another definition, in this document ({@code #name}) or another one
 * ({@code nsid} or {@code nsid#name}).
 */
public record RefSchema(String ref) implements SchemaNode {
    private static final Set<String> FIELDS = SchemaFields.allowed("ref");

    public static RefSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.REF, FIELDS, ctx);
        String ref = SchemaFields.requiredString(json, "ref", ctx);
        ReferenceSupport.checkSyntax(ref, ctx);
        return new RefSchema(ref);
    }

    @Override
    public SchemaType type() {
        return SchemaType.REF;
    }

    @Override
    public void checkSchema(ValidationContext ctx) {
        ReferenceSupport.checkResolvable(ref, ctx);
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        ReferenceSupport.follow(ref, value, ctx);
    }
}
