package ai.rtl.patcher.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsFileWithoutLineTerminators() throws IOException {
        Path source = Files.writeString(tempDir.resolve("in.v"), "module m;\r\n  wire a;\nendmodule\n");

        assertThat(new SourceReader(InputStream.nullInputStream()).read(Optional.of(source)))
                .containsExactly("module m;", "  wire a;", "endmodule");
    }

    @Test
    void readsStandardInputWhenNoPath() {
        InputStream stdin = new ByteArrayInputStream("a\n\nb".getBytes(StandardCharsets.UTF_8));

        assertThat(new SourceReader(stdin).read(Optional.empty())).containsExactly("a", "", "b");
    }

    @Test
    void wrapsMissingFileFailure() {
        Path missing = tempDir.resolve("missing.v");

        assertThatThrownBy(() -> new SourceReader(InputStream.nullInputStream()).read(Optional.of(missing)))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.v");
    }
}
