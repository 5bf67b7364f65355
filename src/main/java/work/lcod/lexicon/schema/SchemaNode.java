package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * A schema definition interpreted as one of the lexicon type variants.
 *
 * <p>Construction (each record's {@code parse}) enforces the variant's allowed fields and the
 * consistency of its own constraints. {@link #checkSchema} covers what needs the surrounding catalog or
 * nested definitions; {@link #checkData} validates an instance.
 */
public sealed interface SchemaNode
    permits StringSchema,
    IntegerSchema,
    BooleanSchema,
    BytesSchema,
    BlobSchema,
    CidLinkSchema,
    NullSchema,
    ObjectSchema,
    ArraySchema,
    UnionSchema,
    RefSchema,
    TokenSchema,
    UnknownSchema,
    RecordSchema,
    RpcSchema,
    ParamsSchema {

    SchemaType type();

    default void checkSchema(ValidationContext ctx) {
    }

    void checkData(JsonNode value, ValidationContext ctx);
}
