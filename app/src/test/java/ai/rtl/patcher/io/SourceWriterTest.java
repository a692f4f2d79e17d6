package ai.rtl.patcher.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void createsParentDirectoriesAndReplacesExistingContent() throws IOException {
        Path target = tempDir.resolve("nested/dir/out.v");
        SourceWriter writer = new SourceWriter(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        writer.write(Optional.of(target), List.of("module a;", "endmodule", "// trailing", "x", "y"));
        writer.write(Optional.of(target), List.of("module b;", "endmodule"));

        assertThat(Files.readAllLines(target, StandardCharsets.UTF_8)).containsExactly("module b;", "endmodule");
    }

    @Test
    void writesToStandardOutputWhenNoTarget() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        SourceWriter writer = new SourceWriter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        writer.write(Optional.empty(), List.of("assign y = a;", ""));

        assertThat(buffer.toString(StandardCharsets.UTF_8))
                .isEqualTo("assign y = a;" + System.lineSeparator() + System.lineSeparator());
    }

    @Test
    void reportsUnwritableTarget() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file");
        SourceWriter writer = new SourceWriter(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        assertThatThrownBy(() -> writer.write(Optional.of(blocker.resolve("out.v")), List.of("x")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("out.v");
    }
}
