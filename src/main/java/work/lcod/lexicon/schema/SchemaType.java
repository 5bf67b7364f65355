package work.lcod.lexicon.schema;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of values of a schema node's {@code type} tag.
 */
public enum SchemaType {
    STRING("string"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    BYTES("bytes"),
    BLOB("blob"),
    CID_LINK("cid-link"),
    NULL("null"),
    OBJECT("object"),
    ARRAY("array"),
    UNION("union"),
    REF("ref"),
    TOKEN("token"),
    UNKNOWN("unknown"),
    RECORD("record"),
    QUERY("query"),
    PROCEDURE("procedure"),
    SUBSCRIPTION("subscription"),
    PARAMS("params");

    private final String tag;

    SchemaType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Types that describe a whole record or endpoint and may only appear as a document's {@code main}.
     */
    public boolean isPrimary() {
        return this == RECORD || this == QUERY || this == PROCEDURE || this == SUBSCRIPTION;
    }

    /**
     * Types that cannot be nested inside object properties or array items.
     */
    public boolean isTopLevelOnly() {
        return isPrimary() || this == PARAMS;
    }

    public static Optional<SchemaType> fromTag(String tag) {
        return Arrays.stream(values())
            .filter(type -> type.tag.equals(tag))
            .findFirst();
    }
}
