package work.lcod.lexicon.schema;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.lexicon.support.LexiconTestSupport.allFixtures;
import static work.lcod.lexicon.support.LexiconTestSupport.context;
import static work.lcod.lexicon.support.LexiconTestSupport.json;

import org.junit.jupiter.api.Test;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.runtime.TypeDispatcher;
import work.lcod.lexicon.runtime.ValidationContext;

class UnionSchemaTest {
    private static final String RAW_CID = "bafkreigh2akiscaildcqabsyg3dfr6chu3fgpregiymsck7e7aqa4s52zy";

    private final ValidationContext post = context(allFixtures()).withCurrentDocument("com.example.post");

    @Test
    void localRefsMatchBareAndQualifiedTypes() {
        assertTrue(UnionSchema.matches("#post", "post"));
        assertTrue(UnionSchema.matches("#post", "ns.example.thing#post"));
        assertFalse(UnionSchema.matches("#post", "repost"));
        assertTrue(UnionSchema.matches("com.example.image", "com.example.image"));
        assertTrue(UnionSchema.matches("com.example.image", "com.example.image#main"));
        assertTrue(UnionSchema.matches("com.example.image#main", "com.example.image"));
        assertFalse(UnionSchema.matches("com.example.image", "com.example.image#thumb"));
    }

    @Test
    void openAndClosedUnionsDifferOnlyForUnknownTypes() {
        var open = json("{\"type\": \"union\", \"refs\": [\"#external\"]}");
        var closed = json("{\"type\": \"union\", \"refs\": [\"#external\"], \"closed\": true}");
        var known = json("{\"$type\": \"com.example.post#external\", \"uri\": \"https://example.com\"}");
        var unknown = json("{\"$type\": \"com.example.other\"}");

        assertDoesNotThrow(() -> TypeDispatcher.checkData(known, open, post));
        assertDoesNotThrow(() -> TypeDispatcher.checkData(known, closed, post));
        assertDoesNotThrow(() -> TypeDispatcher.checkData(unknown, open, post));
        var error = assertThrows(DataValidationException.class, () -> TypeDispatcher.checkData(unknown, closed, post));
        assertEquals("$type 'com.example.other' is not one of the allowed refs [#external]", error.getMessage());
    }

    @Test
    void matchedValuesAreValidatedAgainstTheTarget() {
        var embed = json("{\"type\": \"union\", \"refs\": [\"com.example.image\", \"#external\"]}");
        var image = json("{\"$type\": \"com.example.image\", \"alt\": \"a cat\", \"image\": {\"$type\": \"blob\", \"ref\": {\"$link\": \""
            + RAW_CID + "\"}, \"mimeType\": \"image/png\", \"size\": 10}}");
        assertDoesNotThrow(() -> TypeDispatcher.checkData(image, embed, post));

        var broken = json("{\"$type\": \"external\", \"uri\": \"not a uri\"}");
        var error = assertThrows(DataValidationException.class, () -> TypeDispatcher.checkData(broken, embed, post));
        assertEquals("uri: 'not a uri' is not a valid uri", error.getMessage());
    }

    @Test
    void valuesNeedAStringType() {
        var union = json("{\"type\": \"union\", \"refs\": [\"#external\"]}");
        assertThrows(DataValidationException.class, () -> TypeDispatcher.checkData(json("{\"uri\": \"x\"}"), union, post));
        assertThrows(DataValidationException.class, () -> TypeDispatcher.checkData(json("{\"$type\": 1}"), union, post));
        assertThrows(DataValidationException.class, () -> TypeDispatcher.checkData(json("\"external\""), union, post));
    }

    @Test
    void emptyUnionsRejectEverything() {
        var empty = json("{\"type\": \"union\", \"refs\": []}");
        assertThrows(DataValidationException.class, () -> TypeDispatcher.checkData(json("{\"$type\": \"a\"}"), empty, post));
        assertThrows(InvalidSchemaException.class, () ->
            TypeDispatcher.parse(json("{\"type\": \"union\", \"refs\": [], \"closed\": true}"), post));
    }

    @Test
    void schemaCheckResolvesRefs() {
        var dangling = json("{\"type\": \"union\", \"refs\": [\"#missing\", \"com.example.nowhere\"]}");
        var local = assertThrows(InvalidSchemaException.class, () -> TypeDispatcher.checkSchema(dangling, post));
        assertEquals("refs[0]: definition not found: com.example.post#missing", local.getMessage());

        var remote = json("{\"type\": \"union\", \"refs\": [\"com.example.nowhere\"]}");
        var error = assertThrows(InvalidSchemaException.class, () -> TypeDispatcher.checkSchema(remote, post));
        assertEquals("refs[0]: reference 'com.example.nowhere' points to unknown lexicon 'com.example.nowhere'", error.getMessage());

        assertThrows(InvalidSchemaException.class, () ->
            TypeDispatcher.parse(json("{\"type\": \"union\", \"refs\": [\"not an nsid\"]}"), post));
        assertDoesNotThrow(() -> TypeDispatcher.checkSchema(dangling, ValidationContext.isolated()));
    }
}
