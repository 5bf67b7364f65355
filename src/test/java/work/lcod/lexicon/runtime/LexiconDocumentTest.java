package work.lcod.lexicon.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.lexicon.support.LexiconTestSupport.fixture;
import static work.lcod.lexicon.support.LexiconTestSupport.json;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.lexicon.error.InvalidSchemaException;

class LexiconDocumentTest {
    @Test
    void parsesDocumentMetadataAndDefinitions() {
        var document = LexiconDocument.parse(fixture("com.example.post"));
        assertEquals("com.example.post", document.id());
        assertEquals(Optional.of(2), document.revision());
        assertEquals(Optional.of("A short text post."), document.description());
        assertEquals(List.of("main", "replyRef", "external", "visibility"), List.copyOf(document.definitions().keySet()));
        assertTrue(document.main().isPresent());
        assertTrue(document.definition("nope").isEmpty());
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(InvalidSchemaException.class, () -> LexiconDocument.parse(json("[]")));
        assertThrows(InvalidSchemaException.class, () -> LexiconDocument.parse(json("{\"defs\": {}}")));
        assertThrows(InvalidSchemaException.class, () -> LexiconDocument.parse(json("{\"id\": \"notanid\", \"defs\": {}}")));
        assertThrows(InvalidSchemaException.class, () -> LexiconDocument.parse(json("{\"id\": \"com.example.a\"}")));
        assertThrows(InvalidSchemaException.class, () ->
            LexiconDocument.parse(json("{\"id\": \"com.example.a\", \"defs\": {\"main\": 3}}")));
        assertThrows(InvalidSchemaException.class, () ->
            LexiconDocument.parse(json("{\"lexicon\": 2, \"id\": \"com.example.a\", \"defs\": {}}")));
        assertThrows(InvalidSchemaException.class, () ->
            LexiconDocument.parse(json("{\"id\": \"com.example.a\", \"revision\": -1, \"defs\": {}}")));
    }
}
