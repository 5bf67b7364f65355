package work.lcod.lexicon.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import work.lcod.lexicon.api.ValidationOptions;
import work.lcod.lexicon.runtime.LexiconCatalog;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * Shared helpers for the lexicon test suites: inline JSON, the fixture lexicons under
 * {@code src/test/resources/lexicons}, and contexts bound to them.
 */
public final class LexiconTestSupport {
    private static final ObjectMapper JSON = new ObjectMapper();
    public static final Path FIXTURES = Path.of("src", "test", "resources", "lexicons").toAbsolutePath();

    private LexiconTestSupport() {}

    public static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid test JSON: " + text, ex);
        }
    }

    public static JsonNode fixture(String id) {
        try {
            return JSON.readTree(Files.readString(FIXTURES.resolve(id + ".json")));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static List<JsonNode> fixtures(String... ids) {
        var documents = new ArrayList<JsonNode>();
        for (var id : ids) {
            documents.add(fixture(id));
        }
        return documents;
    }

    public static List<JsonNode> allFixtures() {
        return fixtures("com.example.post", "com.example.image", "com.example.getPost", "com.example.createPost", "com.example.tree");
    }

    public static ValidationContext context(List<JsonNode> documents) {
        var options = ValidationOptions.defaults();
        return ValidationContext.create(LexiconCatalog.parse(documents, options.duplicateIdPolicy()), options);
    }
}
