package work.lcod.lexicon.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.format.Syntax;
import work.lcod.lexicon.runtime.ValidationContext;
import work.lcod.lexicon.shared.Constraints;

/**
 * Reference to an uploaded file, restricted by MIME type patterns and size.
 *
 * <p>Values look like
 * {@code {"$type": "blob", "ref": {"$link": "<raw cid>"}, "mimeType": "image/png", "size": 1234}}
 * and may not carry any other field.
 */
public record BlobSchema(Optional<List<String>> accept, Optional<Long> maxSize) implements SchemaNode {
    static final String BLOB_TYPE = "blob";
    private static final Set<String> FIELDS = SchemaFields.allowed("accept", "maxSize");
    private static final Set<String> VALUE_FIELDS = Set.of("$type", "ref", "mimeType", "size");

    public static BlobSchema parse(ObjectNode json, ValidationContext ctx) {
        SchemaFields.allowOnly(json, SchemaType.BLOB, FIELDS, ctx);
        var accept = SchemaFields.optionalStringList(json, "accept", ctx);
        if (accept.isPresent()) {
            for (String pattern : accept.get()) {
                if (!isValidMimePattern(pattern)) {
                    throw SchemaFields.invalid(ctx, "accept entry '" + pattern + "' is not a valid MIME type pattern");
                }
            }
        }
        var maxSize = SchemaFields.optionalInteger(json, "maxSize", ctx);
        if (maxSize.isPresent() && maxSize.get() <= 0) {
            throw SchemaFields.invalid(ctx, "maxSize must be greater than 0");
        }
        return new BlobSchema(accept, maxSize);
    }

    @Override
    public SchemaType type() {
        return SchemaType.BLOB;
    }

    @Override
    public void checkData(JsonNode value, ValidationContext ctx) {
        if (value == null || !value.isObject()) {
            throw new DataValidationException(ctx.describe("expected a blob object"));
        }
        var fields = value.fieldNames();
        while (fields.hasNext()) {
            String field = fields.next();
            if (!VALUE_FIELDS.contains(field)) {
                throw new DataValidationException(ctx.describe("blob has unexpected field '" + field + "'"));
            }
        }
        JsonNode typeTag = value.get("$type");
        if (typeTag == null || !typeTag.isTextual() || !BLOB_TYPE.equals(typeTag.textValue())) {
            throw new DataValidationException(ctx.describe("blob $type must be 'blob'"));
        }
        JsonNode ref = value.get("ref");
        if (ref == null || !ref.isObject() || ref.size() != 1 || !ref.has(CidLinkSchema.LINK_FIELD)) {
            throw new DataValidationException(ctx.describe("blob ref must be an object with a single '$link' field"));
        }
        JsonNode link = ref.get(CidLinkSchema.LINK_FIELD);
        if (!link.isTextual() || !Syntax.isValidRawCid(link.textValue())) {
            throw new DataValidationException(ctx.describe("blob ref $link must be a raw CID"));
        }
        JsonNode mimeType = value.get("mimeType");
        if (mimeType == null || !mimeType.isTextual() || mimeType.textValue().isEmpty()) {
            throw new DataValidationException(ctx.describe("blob mimeType must be a non-empty string"));
        }
        JsonNode size = value.get("size");
        if (size == null || !size.isIntegralNumber() || !size.canConvertToLong() || size.longValue() < 0) {
            throw new DataValidationException(ctx.describe("blob size must be a non-negative integer"));
        }
        if (accept.isPresent() && accept.get().stream().noneMatch(pattern -> mimeMatches(pattern, mimeType.textValue()))) {
            throw new DataValidationException(ctx.describe(
                "blob mimeType '" + mimeType.textValue() + "' is not accepted (" + String.join(", ", accept.get()) + ")"
            ));
        }
        Constraints.checkBounds(ctx, "blob size", size.longValue(), "minSize", Optional.<Long>empty(), "maxSize", maxSize);
    }

    /**
     * {@code type/subtype}, {@code type/*} or {@code *}{@code /*}; a wildcard must be a whole segment.
     */
    static boolean isValidMimePattern(String pattern) {
        int slash = pattern.indexOf('/');
        if (slash <= 0 || slash != pattern.lastIndexOf('/') || slash == pattern.length() - 1) {
            return false;
        }
        String type = pattern.substring(0, slash);
        String subtype = pattern.substring(slash + 1);
        if ("*".equals(type)) {
            return "*".equals(subtype);
        }
        if (type.contains("*")) {
            return false;
        }
        return "*".equals(subtype) || !subtype.contains("*");
    }

    static boolean mimeMatches(String pattern, String mimeType) {
        if ("*/*".equals(pattern)) {
            return true;
        }
        String candidate = mimeType.toLowerCase(Locale.ROOT);
        String normalized = pattern.toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/*")) {
            return candidate.startsWith(normalized.substring(0, normalized.length() - 1));
        }
        return candidate.equals(normalized);
    }
}
