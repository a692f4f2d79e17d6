package ai.rtl.patcher.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.rtl.patcher.config.ConfigLoader;
import ai.rtl.patcher.hint.SourceHintLoader;
import ai.rtl.patcher.io.SourceReader;
import ai.rtl.patcher.io.SourceWriter;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final int INVALID_INPUT = 2;

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

    @Test
    void repairsFileAndWritesOutput() throws IOException {
        Path input = tempDir.resolve("broken.v");
        Files.write(input, List.of("assign a =", "  (sel) ?", "  1'b1 :", "  1'b0"), StandardCharsets.UTF_8);
        Path output = tempDir.resolve("out/fixed.v");

        int exitCode = application("").run(new String[] {
                "--input", input.toString(),
                "--output", output.toString()
        });

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(output, StandardCharsets.UTF_8))
                .containsExactly("assign a = (sel) ? 1'b1 : 1'b0;");
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void streamsFromStandardInputToStandardOutput() {
        int exitCode = application("else if (x)\n  y <= 1;\n").run(new String[0]);

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8).lines()).containsExactly("if (x)", "  y <= 1;");
    }

    @Test
    void missingReferenceFileDoesNotAbortRepair() {
        int exitCode = application("always\n  y = a;\n").run(new String[] {
                "--reference", tempDir.resolve("absent.v").toString()
        });

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8).lines())
                .containsExactly("always @(*) begin", "  y = a;", "end");
    }

    @Test
    void unknownOptionReturnsInvalidInputCode() {
        int exitCode = application("").run(new String[] {"--bogus"});

        assertThat(exitCode).isEqualTo(INVALID_INPUT);
    }

    @Test
    void invalidSettingReturnsInvalidInputCode() {
        int exitCode = application("").run(new String[] {"--default-loop-bound", "0"});

        assertThat(exitCode).isEqualTo(INVALID_INPUT);
    }

    @Test
    void unreadableInputReturnsFailureCode() {
        int exitCode = application("").run(new String[] {
                "--input", tempDir.resolve("missing.v").toString()
        });

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_IO_FAILURE);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    private CliApplication application(String stdin) {
        return new CliApplication(
                new ConfigLoader(key -> Optional.empty()),
                new SourceHintLoader(),
                new SourceReader(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8))),
                new SourceWriter(new PrintStream(stdout, true, StandardCharsets.UTF_8)));
    }
}
