package org.modcat.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.modcat.cli.CommandLineInterface;
import org.modcat.graph.DependencyGraph;
import org.modcat.graph.DependencyGraphBuilder;
import org.modcat.graph.TopologicalOrderer;
import org.modcat.scan.ModuleId;
import org.modcat.scan.ModuleRecord;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the concat command.
 */
public class ConcatCommandTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    void testCommandParses() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("concat", "notebook", "report");
    }

    @Test
    @Tag("unit")
    void testHelpOutput() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        cmdLine.execute("concat", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("--source", "--level", "--exclude", "--output", "--labels");
    }

    @Test
    @Tag("integration")
    void testWritesCombinedFile() throws Exception {
        Path src = tempDir.resolve("src");
        Files.createDirectories(src);
        Files.writeString(src.resolve("a.py"), "def a():\n    return 1\n");
        Files.writeString(src.resolve("b.py"), "from .a import a\nprint(a())\n");
        Path output = tempDir.resolve("combined.py");

        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("concat", "-s", src.toString(), "-o", output.toString(), "-l", "interface");

        assertThat(exitCode).isZero();
        assertThat(output).exists();
        assertThat(Files.readString(output)).contains("# Summary Level: interface", "# From a.py", "# From b.py");
        assertThat(out.toString()).contains("Dependency Resolution:", "1. a.py", "2. b.py", "   Depends on: a.py",
                "Generated interface version:");
    }

    @Test
    @Tag("unit")
    void testMissingSourceFails() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("concat", "-s", tempDir.resolve("missing").toString(),
                "-o", tempDir.resolve("out.py").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error:", "Source directory not found");
        assertThat(tempDir.resolve("out.py")).doesNotExist();
    }

    @Test
    @Tag("unit")
    void testUnknownLevelFails() throws Exception {
        Files.writeString(tempDir.resolve("a.py"), "x = 1\n");
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("concat", "-s", tempDir.toString(), "-l", "everything",
                "-o", tempDir.resolve("out.py").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown summary level 'everything'");
    }

    @Test
    @Tag("unit")
    void testPrintsCyclesInsteadOfResolution() {
        DependencyGraph graph = new DependencyGraphBuilder().build(List.of(
                record("a.py", ".b"),
                record("b.py", ".a")));
        StringWriter out = new StringWriter();

        ConcatCommand.printResolution(new PrintWriter(out, true), graph, new TopologicalOrderer().order(graph));

        assertThat(out.toString()).contains("Warning: Circular dependencies detected:", "a.py -> b.py -> a.py",
                "Using discovery order instead.");
    }

    private static ModuleRecord record(String path, String... imports) {
        return new ModuleRecord(new ModuleId(path), Path.of(path), "", Set.of(imports), Set.of(), Set.of());
    }
}
