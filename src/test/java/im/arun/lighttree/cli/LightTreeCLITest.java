package im.arun.lighttree.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LightTreeCLITest {

    @TempDir
    Path tempDir;

    private Path jsonFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        jsonFile = tempDir.resolve("doc.json");
        Files.write(jsonFile, "{\"a\":[{},{\"b\":12},[1,2,3]]}".getBytes(StandardCharsets.UTF_8));
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new LightTreeCLI());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void printsDocumentTree() {
        int exitCode = run("--json-path", jsonFile.toString());
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo(String.join("\n",
            "{}",
            "└── a: []",
            "    ├── {}",
            "    ├── {}",
            "    │   └── b: 12",
            "    └── []",
            "        ├── 1",
            "        ├── 2",
            "        └── 3") + "\n");
    }

    @Test
    void printsSubtreeAtPath() {
        int exitCode = run("--json-path", jsonFile.toString(), "--path", "a.2", "--line-type", "ascii");
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("[]\n|-- 1\n|-- 2\n+-- 3\n");
    }

    @Test
    void limitTruncatesOutput() {
        int exitCode = run("--json-path", jsonFile.toString(), "--limit", "2");
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("{}\n└── a: []\n...\n(truncated, total number of nodes: 9)\n");
    }

    @Test
    void serializedForm() {
        int exitCode = run("--json-path", jsonFile.toString(), "--serialized");
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"children_of\"").contains("\"parent_of\"");
    }

    @Test
    void missingFileFails() {
        int exitCode = run("--json-path", tempDir.resolve("nope.json").toString());
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("JSON file not found");
    }

    @Test
    void unknownPathFails() {
        int exitCode = run("--json-path", jsonFile.toString(), "--path", "a.9");
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error");
    }

    @Test
    void missingRequiredOptionIsUsageError() {
        assertThat(run()).isEqualTo(2);
    }
}
