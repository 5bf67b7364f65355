package work.lcod.lexicon.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.lexicon.support.LexiconTestSupport.allFixtures;
import static work.lcod.lexicon.support.LexiconTestSupport.context;
import static work.lcod.lexicon.support.LexiconTestSupport.json;

import java.util.ArrayList;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.lexicon.api.ValidationOptions;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.error.LexiconNotFoundException;

class ValidationContextTest {
    @Test
    void buildsDottedPaths() {
        var ctx = ValidationContext.isolated().withPath("defs.main").withPath("properties").withIndex(2);
        assertEquals("defs.main.properties[2]", ctx.path());
        assertEquals("defs.main.properties[2]: boom", ctx.describe("boom"));
        assertEquals("boom", ValidationContext.isolated().describe("boom"));
        assertEquals(3, ctx.depth());
    }

    @Test
    void extensionsLeaveTheReceiverUntouched() {
        var root = ValidationContext.isolated();
        var child = root.withPath("defs.main").withCurrentDocument("com.example.post").withReference("com.example.post#main");
        assertEquals("", root.path());
        assertEquals(Optional.empty(), root.currentDocumentId());
        assertTrue(root.references().isEmpty());
        assertEquals(Optional.of("com.example.post"), child.currentDocumentId());
        assertTrue(child.hasReference("com.example.post#main"));
    }

    @Test
    void descentKeepsTheReferenceChain() {
        var ctx = ValidationContext.isolated().withReference("com.example.tree#main");
        assertTrue(ctx.withPath("children").hasReference("com.example.tree#main"));
        assertTrue(ctx.withIndex(0).hasReference("com.example.tree#main"));
        assertFalse(ValidationContext.isolated().withPath("children").hasReference("com.example.tree#main"));
        assertEquals("[0]", ctx.withIndex(0).path());
    }

    @Test
    void resolvesAgainstTheCurrentDocument() {
        var ctx = context(allFixtures()).withCurrentDocument("com.example.post");
        assertEquals("object", ctx.resolve("#replyRef").get("type").textValue());
        assertEquals("object", ctx.resolve("com.example.image").get("type").textValue());
        assertThrows(LexiconNotFoundException.class, () -> ctx.resolve("com.example.missing"));
        assertThrows(InvalidSchemaException.class, () -> ctx.resolve("#missing"));
    }

    @Test
    void dataValidationGoesThroughTheInjectedHandle() {
        var seen = new ArrayList<String>();
        var ctx = ValidationContext.create(
            LexiconCatalog.empty(),
            ValidationOptions.defaults(),
            (value, schema, c) -> seen.add(c.path() + "=" + value)
        );
        var schema = json("{\"type\": \"integer\"}");
        ctx.withPath("count").validateData(json("3"), schema);
        assertEquals(1, seen.size());
        assertEquals("count=3", seen.get(0));
        assertSame(ctx.catalog(), ctx.withPath("x").catalog());
    }
}
