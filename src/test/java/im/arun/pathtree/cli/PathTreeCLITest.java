package im.arun.pathtree.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class PathTreeCLITest {

    @TempDir
    Path root;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void createTree() throws IOException {
        Files.createDirectories(root.resolve("outer/b"));
        Files.writeString(root.resolve("outer/a"), "a");
        Files.writeString(root.resolve("outer/b/c"), "c");
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new PathTreeCLI());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void printsJsonSummary() throws IOException {
        assertThat(run("--root", root.toString())).isZero();

        JsonNode summary = new ObjectMapper().readTree(out.toString());
        assertThat(summary.get("items").asInt()).isEqualTo(4);
        assertThat(summary.get("directories").asInt()).isEqualTo(2);
        assertThat(summary.has("missing_paths")).isFalse();
    }

    @Test
    void listsAndEncodesWithTheChosenSeparator() {
        assertThat(run("--root", root.toString(), "--list", "--encoded", "--separator", ":")).isZero();

        assertThat(out.toString())
            .contains("outer:b:c" + System.lineSeparator())
            .contains("outer:a:..:b:c:..:..:..");
    }

    @Test
    void writesSummaryToFile(@TempDir Path outputDir) throws IOException {
        Path output = outputDir.resolve("summary.json");
        assertThat(run("--root", root.toString(), "--verify", "--output", output.toString())).isZero();

        JsonNode summary = new ObjectMapper().readTree(output.toFile());
        assertThat(summary.get("items").asInt()).isEqualTo(4);
        assertThat(summary.get("missing_paths").asInt()).isZero();
        assertThat(out.toString()).contains("Summary written to");
    }

    @Test
    void rejectsMissingRoot() {
        assertThat(run("--root", root.resolve("nope").toString())).isEqualTo(1);
        assertThat(err.toString()).contains("not a directory");
    }

    @Test
    void rejectsBadSeparator() {
        assertThat(run("--root", root.toString(), "--separator", "::")).isEqualTo(1);
        assertThat(err.toString()).contains("single character");
    }
}
