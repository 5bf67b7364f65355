package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Set;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.runtime.Reference;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * One of several referenced object types, chosen by the value's {@code $type} field. An open union
 * accepts {@code $type} values it does not list; a closed one rejects them.
 */
public record UnionSchema(List<String> refs, boolean closed) implements SchemaNode {
    private static final Set<String> FIELDS = SchemaFields.allowed("refs", "closed");
    private static final String MAIN_SUFFIX = "#" + Reference.MAIN;

    public UnionSchema {
        refs = List.copyOf(refs);
    }

    public static UnionSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.UNION, FIELDS, ctx);
        var refs = SchemaFields.requiredStringList(json, "refs", ctx);
        for (int i = 0; i < refs.size(); i++) {
            ReferenceSupport.checkSyntax(refs.get(i), ctx.withPath("refs").withIndex(i));
        }
        boolean closed = SchemaFields.optionalBoolean(json, "closed", ctx).orElse(false);
        if (closed && refs.isEmpty()) {
            throw SchemaFields.invalid(ctx, "a closed union must list at least one ref");
        }
        return new UnionSchema(refs, closed);
    }

    @Override
    public SchemaType type() {
        return SchemaType.UNION;
    }

    @Override
    public void checkSchema(ValidationContext ctx) {
        for (int i = 0; i < refs.size(); i++) {
            ReferenceSupport.checkResolvable(refs.get(i), ctx.withPath("refs").withIndex(i));
        }
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isObject()) {
            throw new DataValidationException(ctx.describe("expected an object with a $type field"));
        }
        JsonNode typeNode = value.get("$type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new DataValidationException(ctx.describe("union value is missing a string $type field"));
        }
        String type = typeNode.textValue();
        for (String ref : refs) {
            if (matches(ref, type)) {
                if (ctx.currentDocumentId().isPresent()) {
                    ReferenceSupport.follow(ref, value, ctx);
                }
                return;
            }
        }
        if (refs.isEmpty()) {
            throw new DataValidationException(ctx.describe("$type '" + type + "' cannot match a union without refs"));
        }
        if (closed) {
            throw new DataValidationException(ctx.describe("$type '" + type + "' is not one of the allowed refs " + refs));
        }
    }

    /**
     * Whether a union entry names the given {@code $type}. A local entry {@code #name} matches
     * {@code name} and any {@code ...#name}; an entry without a fragment stands for its {@code #main}
     * definition, and the reverse.
     */
    static boolean matches(String ref, String type) {
        if (ref.equals(type)) {
            return true;
        }
        if (Reference.isLocal(ref)) {
            String name = ref.substring(1);
            return type.equals(name) || type.endsWith(ref);
        }
        if (ref.indexOf('#') < 0 && type.equals(ref + MAIN_SUFFIX)) {
            return true;
        }
        if (ref.endsWith(MAIN_SUFFIX) && type.equals(ref.substring(0, ref.length() - MAIN_SUFFIX.length()))) {
            return true;
        }
        return type.endsWith(MAIN_SUFFIX) && ref.equals(type.substring(0, type.length() - MAIN_SUFFIX.length()));
    }
}
