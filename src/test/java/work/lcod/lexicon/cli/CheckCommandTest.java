package work.lcod.lexicon.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.lexicon.runtime.LexiconLoader;
import work.lcod.lexicon.support.LexiconTestSupport;

class CheckCommandTest {
    private static final String BROKEN = """
        {"lexicon": 1, "id": "com.example.bad", "defs": {"main": {"type": "float"}}}
        """;
    private static final String DUPLICATE = """
        {"lexicon": 1, "id": "com.example.image", "defs": {"main": {"type": "string"}}}
        """;

    @TempDir
    Path workspace;

    @Test
    void acceptsAValidDirectory() throws IOException {
        copyFixture("com.example.post");
        copyFixture("com.example.image");

        var result = run("check", workspace.toString());
        assertEquals(0, result.exitCode(), result.err());
        assertTrue(result.out().contains("✓ " + workspace.resolve("com.example.image.json")));
        assertTrue(result.out().contains("✓ " + workspace.resolve("com.example.post.json")));
        assertTrue(result.out().contains("2 file(s) checked, 0 failed"));
    }

    @Test
    void reportsBrokenAndUnreadableFiles() throws IOException {
        copyFixture("com.example.image");
        write("broken.json", BROKEN);
        write("empty.json", "");

        var result = run("check", workspace.toString());
        assertEquals(1, result.exitCode());
        assertTrue(result.out().contains("✗ " + workspace.resolve("broken.json")));
        assertTrue(result.out().contains("  com.example.bad#main: defs.main: unknown schema type 'float'"));
        assertTrue(result.out().contains("✗ " + workspace.resolve("empty.json")));
        assertTrue(result.out().contains("  file is empty"));
        assertTrue(result.out().contains("3 file(s) checked, 2 failed"));
    }

    @Test
    void printsJsonSummary() throws Exception {
        var file = write("broken.json", BROKEN);

        var result = run("check", "--json", file.toString());
        assertEquals(1, result.exitCode());
        var tree = new ObjectMapper().readTree(result.out());
        assertFalse(tree.get("valid").booleanValue());
        assertEquals(1, tree.get("checked").intValue());
        assertEquals(1, tree.get("failed").intValue());
        assertEquals("com.example.bad#main: defs.main: unknown schema type 'float'",
            tree.get("errors").get(file.toString()).get(0).textValue());
        assertEquals(0, tree.get("skipped").size());
    }

    @Test
    void reportsDuplicateIdsOnTheLaterFile() throws IOException {
        copyFixture("com.example.image");
        write("z-duplicate.json", DUPLICATE);

        var result = run("check", workspace.toString());
        assertEquals(1, result.exitCode());
        assertTrue(result.out().contains("✓ " + workspace.resolve("com.example.image.json")));
        assertTrue(result.out().contains("✗ " + workspace.resolve("z-duplicate.json")));
        assertTrue(result.out().contains("  duplicate lexicon id 'com.example.image' (first defined in "
            + workspace.resolve("com.example.image.json") + ")"));
        assertTrue(result.out().contains("2 file(s) checked, 1 failed"));
    }

    @Test
    void marksShadowedFilesAsSkippedWhenTheLastDefinitionWins() throws Exception {
        copyFixture("com.example.image");
        write("z-duplicate.json", DUPLICATE);
        write(LexiconLoader.CONFIG_FILE, "[validation]\nduplicate-ids = \"last-wins\"\n");

        var result = run("check", workspace.toString());
        assertEquals(0, result.exitCode(), result.out());
        assertTrue(result.out().contains("- " + workspace.resolve("com.example.image.json")));
        assertTrue(result.out().contains("  skipped: id 'com.example.image' also defined in " + workspace.resolve("z-duplicate.json")));
        assertTrue(result.out().contains("✓ " + workspace.resolve("z-duplicate.json")));
        assertTrue(result.out().contains("2 file(s) checked, 0 failed, 1 skipped"));

        var json = new ObjectMapper().readTree(run("check", "--json", workspace.toString()).out());
        assertEquals(workspace.resolve("z-duplicate.json").toString(),
            json.get("skipped").get(workspace.resolve("com.example.image.json").toString()).textValue());

        assertEquals(1, run("check", "--duplicate-ids", "reject", workspace.toString()).exitCode());
    }

    @Test
    void rejectsBadArguments() {
        var missing = run("check", workspace.resolve("nowhere").toString());
        assertEquals(2, missing.exitCode());
        assertTrue(missing.err().contains("No such file or directory"));

        assertEquals(2, run("check", "--max-depth", "0", workspace.toString()).exitCode());
        assertEquals(2, run("check", "--duplicate-ids", "first-wins", workspace.toString()).exitCode());
        assertEquals(2, run("frobnicate").exitCode());
    }

    @Test
    void printsUsageWithoutASubcommand() {
        var result = run();
        assertEquals(2, result.exitCode());
        assertTrue(result.err().contains("check"));

        var help = run("help", "check");
        assertEquals(0, help.exitCode());
        assertTrue(help.out().contains("--duplicate-ids"));

        var version = run("--version");
        assertEquals(0, version.exitCode());
        assertTrue(version.out().startsWith("lexicon (java) "));
    }

    private void copyFixture(String id) throws IOException {
        Files.copy(LexiconTestSupport.FIXTURES.resolve(id + ".json"), workspace.resolve(id + ".json"));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(workspace.resolve(name), content, StandardCharsets.UTF_8);
    }

    private static Result run(String... args) {
        var out = new StringWriter();
        var err = new StringWriter();
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        int exitCode = commandLine.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    private record Result(int exitCode, String out, String err) {}
}
