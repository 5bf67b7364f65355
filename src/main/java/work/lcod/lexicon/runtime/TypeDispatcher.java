package work.lcod.lexicon.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.schema.ArraySchema;
import work.lcod.lexicon.schema.BlobSchema;
import work.lcod.lexicon.schema.BooleanSchema;
import work.lcod.lexicon.schema.BytesSchema;
import work.lcod.lexicon.schema.CidLinkSchema;
import work.lcod.lexicon.schema.IntegerSchema;
import work.lcod.lexicon.schema.NullSchema;
import work.lcod.lexicon.schema.ObjectSchema;
import work.lcod.lexicon.schema.ParamsSchema;
import work.lcod.lexicon.schema.ProcedureSchema;
import work.lcod.lexicon.schema.QuerySchema;
import work.lcod.lexicon.schema.RecordSchema;
import work.lcod.lexicon.schema.RefSchema;
import work.lcod.lexicon.schema.SchemaNode;
import work.lcod.lexicon.schema.SchemaType;
import work.lcod.lexicon.schema.StringSchema;
import work.lcod.lexicon.schema.SubscriptionSchema;
import work.lcod.lexicon.schema.TokenSchema;
import work.lcod.lexicon.schema.UnionSchema;
import work.lcod.lexicon.schema.UnknownSchema;

/**
 * Routes a schema definition to its type variant, for both the schema pass and the data pass.
 */
public final class TypeDispatcher {
    private TypeDispatcher() {}

    public static SchemaNode parse(JsonNode schema, ValidationContext ctx) {
        if (schema == null || !schema.isObject()) {
            throw new InvalidSchemaException(ctx.describe("schema must be an object"));
        }
        JsonNode tag = schema.get("type");
        if (tag == null || tag.isNull()) {
            throw new InvalidSchemaException(ctx.describe("schema is missing a 'type' field"));
        }
        if (!tag.isTextual()) {
            throw new InvalidSchemaException(ctx.describe("schema 'type' must be a string"));
        }
        SchemaType type = SchemaType.fromTag(tag.textValue())
            .orElseThrow(() -> new InvalidSchemaException(ctx.describe("unknown schema type '" + tag.textValue() + "'")));
        ObjectNode json = (ObjectNode) schema;
        return switch (type) {
            case STRING -> StringSchema.parse(json, ctx);
            case INTEGER -> IntegerSchema.parse(json, ctx);
            case BOOLEAN -> BooleanSchema.parse(json, ctx);
            case BYTES -> BytesSchema.parse(json, ctx);
            case BLOB -> BlobSchema.parse(json, ctx);
            case CID_LINK -> CidLinkSchema.parse(json, ctx);
            case NULL -> NullSchema.parse(json, ctx);
            case OBJECT -> ObjectSchema.parse(json, ctx);
            case ARRAY -> ArraySchema.parse(json, ctx);
            case UNION -> UnionSchema.parse(json, ctx);
            case REF -> RefSchema.parse(json, ctx);
            case TOKEN -> TokenSchema.parse(json, ctx);
            case UNKNOWN -> UnknownSchema.parse(json, ctx);
            case RECORD -> RecordSchema.parse(json, ctx);
            case QUERY -> QuerySchema.parse(json, ctx);
            case PROCEDURE -> ProcedureSchema.parse(json, ctx);
            case SUBSCRIPTION -> SubscriptionSchema.parse(json, ctx);
            case PARAMS -> ParamsSchema.parse(json, ctx);
        };
    }

    public static void checkSchema(JsonNode schema, ValidationContext ctx) {
        if (ctx.depth() > ctx.options().maxDepth()) {
            throw new InvalidSchemaException(ctx.describe("schema nesting exceeds maximum depth " + ctx.options().maxDepth()));
        }
        parse(schema, ctx).checkSchema(ctx);
    }

    public static void checkData(JsonNode value, JsonNode schema, ValidationContext ctx) {
        if (ctx.depth() > ctx.options().maxDepth()) {
            throw new DataValidationException(ctx.describe("data nesting exceeds maximum depth " + ctx.options().maxDepth()));
        }
        parse(schema, ctx).checkData(value, ctx);
    }
}
