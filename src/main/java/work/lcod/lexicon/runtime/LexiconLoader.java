package work.lcod.lexicon.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.lexicon.api.DuplicateIdPolicy;
import work.lcod.lexicon.api.ValidationOptions;

/**
 * Reads lexicon JSON files from disk, along with the optional {@code lexicon.toml} settings file.
 */
public final class LexiconLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(LexiconLoader.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    public static final String CONFIG_FILE = "lexicon.toml";

    private LexiconLoader() {}

    /**
     * A file that was read, or could not be: exactly one of {@code json} and {@code error} is set.
     */
    public record LoadedFile(Path path, JsonNode json, String error) {
        public boolean isLoaded() {
            return json != null;
        }
    }

    /**
     * Returns {@code target} itself when it is a file, or every {@code *.json} file below it when it is a
     * directory, in path order.
     */
    public static List<Path> discover(Path target) {
        if (Files.isRegularFile(target)) {
            return List.of(target);
        }
        if (!Files.isDirectory(target)) {
            throw new IllegalArgumentException("No such file or directory: " + target);
        }
        try (Stream<Path> walk = Files.walk(target)) {
            return walk
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(".json"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list lexicons under " + target, ex);
        }
    }

    public static List<LoadedFile> load(Path target) {
        var files = new ArrayList<LoadedFile>();
        for (var path : discover(target)) {
            files.add(read(path));
        }
        LOGGER.debug("Read {} lexicon file(s) from {}", files.size(), target);
        return files;
    }

    static LoadedFile read(Path path) {
        try (var in = Files.newInputStream(path)) {
            JsonNode json = JSON.readTree(in);
            if (json == null || json.isMissingNode()) {
                return new LoadedFile(path, null, "file is empty");
            }
            return new LoadedFile(path, json, null);
        } catch (JsonProcessingException ex) {
            return new LoadedFile(path, null, "invalid JSON: " + ex.getOriginalMessage());
        } catch (IOException ex) {
            return new LoadedFile(path, null, "cannot read file: " + ex.getMessage());
        }
    }

    /**
     * Applies the {@code [validation]} table of the {@code lexicon.toml} found in {@code target} (a
     * directory) or next to it (a file) on top of {@code base}. Unreadable or invalid settings are logged
     * and skipped.
     */
    public static ValidationOptions readOptions(Path target, ValidationOptions base) {
        Path configPath = Files.isDirectory(target) ? target.resolve(CONFIG_FILE) : target.resolveSibling(CONFIG_FILE);
        TomlParseResult config = parseToml(configPath);
        if (config == null) {
            return base;
        }
        TomlTable validation = config.getTable("validation");
        if (validation == null) {
            return base;
        }
        var builder = base.toBuilder();
        try {
            Long maxDepth = validation.getLong("max-depth");
            if (maxDepth != null) {
                if (maxDepth < 1 || maxDepth > Integer.MAX_VALUE) {
                    LOGGER.warn("Ignoring max-depth {} in {}: must be a positive integer", maxDepth, configPath);
                } else {
                    builder.maxDepth(maxDepth.intValue());
                }
            }
            String duplicateIds = validation.getString("duplicate-ids");
            if (duplicateIds != null) {
                builder.duplicateIdPolicy(DuplicateIdPolicy.from(duplicateIds));
            }
        } catch (TomlInvalidTypeException | IllegalArgumentException ex) {
            LOGGER.warn("Ignoring invalid setting in {}: {}", configPath, ex.getMessage());
            return base;
        }
        return builder.build();
    }

    private static TomlParseResult parseToml(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return null;
        }
        try {
            TomlParseResult result = Toml.parse(Files.readString(path));
            if (result.hasErrors()) {
                LOGGER.warn("Ignoring {}: {}", path, result.errors().get(0).toString());
                return null;
            }
            return result;
        } catch (IOException ex) {
            LOGGER.warn("Ignoring {}: {}", path, ex.getMessage());
            return null;
        }
    }
}
