package work.lcod.lexicon.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.lexicon.api.DuplicateIdPolicy;
import work.lcod.lexicon.api.ValidationOptions;
import work.lcod.lexicon.support.LexiconTestSupport;

class LexiconLoaderTest {
    @TempDir
    Path temp;

    @Test
    void discoversJsonFilesRecursivelyInPathOrder() throws Exception {
        Files.createDirectories(temp.resolve("b/nested"));
        Files.writeString(temp.resolve("b/nested/two.json"), "{}");
        Files.writeString(temp.resolve("a.json"), "{}");
        Files.writeString(temp.resolve("notes.txt"), "ignored");

        var found = LexiconLoader.discover(temp);
        assertEquals(List.of(temp.resolve("a.json"), temp.resolve("b/nested/two.json")), found);
        assertEquals(List.of(temp.resolve("a.json")), LexiconLoader.discover(temp.resolve("a.json")));
        assertThrows(IllegalArgumentException.class, () -> LexiconLoader.discover(temp.resolve("missing")));
    }

    @Test
    void reportsUnreadableJsonPerFile() throws Exception {
        Files.writeString(temp.resolve("good.json"), "{\"id\": \"com.example.a\"}");
        Files.writeString(temp.resolve("bad.json"), "{\"id\": ");
        Files.writeString(temp.resolve("empty.json"), "");

        var files = LexiconLoader.load(temp);
        assertEquals(3, files.size());
        var bad = files.get(0);
        assertFalse(bad.isLoaded());
        assertTrue(bad.error().startsWith("invalid JSON"));
        assertEquals("file is empty", files.get(1).error());
        assertEquals("com.example.a", files.get(2).json().get("id").textValue());
    }

    @Test
    void loadsFixtureDirectory() {
        var files = LexiconLoader.load(LexiconTestSupport.FIXTURES);
        assertEquals(5, files.size());
        assertTrue(files.stream().allMatch(LexiconLoader.LoadedFile::isLoaded));
    }

    @Test
    void readsValidationSettingsFromToml() throws Exception {
        Files.writeString(temp.resolve(LexiconLoader.CONFIG_FILE), """
            [validation]
            max-depth = 16
            duplicate-ids = "last-wins"
            """);
        var options = LexiconLoader.readOptions(temp, ValidationOptions.defaults());
        assertEquals(16, options.maxDepth());
        assertEquals(DuplicateIdPolicy.LAST_WINS, options.duplicateIdPolicy());

        Files.writeString(temp.resolve("a.json"), "{}");
        assertEquals(options, LexiconLoader.readOptions(temp.resolve("a.json"), ValidationOptions.defaults()));
    }

    @Test
    void ignoresMissingOrInvalidSettings() throws Exception {
        var defaults = ValidationOptions.defaults();
        assertEquals(defaults, LexiconLoader.readOptions(temp, defaults));

        Files.writeString(temp.resolve(LexiconLoader.CONFIG_FILE), "[validation\nmax-depth = ");
        assertEquals(defaults, LexiconLoader.readOptions(temp, defaults));

        Files.writeString(temp.resolve(LexiconLoader.CONFIG_FILE), "[validation]\nduplicate-ids = \"sometimes\"\n");
        assertEquals(defaults, LexiconLoader.readOptions(temp, defaults));

        Files.writeString(temp.resolve(LexiconLoader.CONFIG_FILE), "[validation]\nmax-depth = \"deep\"\n");
        assertEquals(defaults, LexiconLoader.readOptions(temp, defaults));
    }
}
