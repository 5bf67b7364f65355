package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Set;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * Repository record: an object schema plus the record key strategy ({@code tid}, {@code nsid},
 * {@code any} or {@code literal:<value>}).
 */
public record RecordSchema(String key, ObjectSchema record) implements SchemaNode {
    private static final Set<String> FIELDS = SchemaFields.allowed("key", "record");
    private static final Set<String> KEY_STRATEGIES = Set.of("tid", "nsid", "any");
    static final String LITERAL_PREFIX = "literal:";

    public static RecordSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.RECORD, FIELDS, ctx);
        String key = SchemaFields.requiredString(json, "key", ctx);
        if (!isValidKey(key)) {
            throw SchemaFields.invalid(ctx, "invalid record key '" + key + "'");
        }
        var recordJson = SchemaFields.requiredObject(json, "record", ctx);
        var recordCtx = ctx.withPath("record");
        if (SchemaFields.peekType(recordJson).filter(SchemaType.OBJECT::equals).isEmpty()) {
            throw SchemaFields.invalid(recordCtx, "record must be an object schema");
        }
        return new RecordSchema(key, ObjectSchema.parse(recordJson, recordCtx));
    }

    static boolean isValidKey(String key) {
        if (KEY_STRATEGIES.contains(key)) {
            return true;
        }
        return key.startsWith(LITERAL_PREFIX) && key.length() > LITERAL_PREFIX.length();
    }

    @Override
    public SchemaType type() {
        return SchemaType.RECORD;
    }

    @Override
    public void checkSchema(ValidationContext ctx) {
        record.checkSchema(ctx.withPath("record"));
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        record.checkData(value, ctx);
    }
}
