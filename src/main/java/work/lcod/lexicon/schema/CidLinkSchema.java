package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.format.Syntax;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * Link to content by hash, encoded in JSON as {@code {"$link": "<cid>"}}.
 */
public record CidLinkSchema() implements SchemaNode {
    static final String LINK_FIELD = "$link";

    public static CidLinkSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.CID_LINK, SchemaFields.BASE_FIELDS, ctx);
        return new CidLinkSchema();
    }

    @Override
    public SchemaType type() {
        return SchemaType.CID_LINK;
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isObject() || value.size() != 1 || !value.has(LINK_FIELD)) {
            throw new DataValidationException(ctx.describe("expected an object with a single '$link' field"));
        }
        JsonNode link = value.get(LINK_FIELD);
        if (!link.isTextual() || !Syntax.isValidCid(link.textValue())) {
            throw new DataValidationException(ctx.describe("$link must be a valid CID"));
        }
    }
}
