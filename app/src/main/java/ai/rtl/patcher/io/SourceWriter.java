package ai.rtl.patcher.io;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes repaired lines to a file, creating parent directories, or to standard output.
 */
public class SourceWriter {

    private final PrintStream standardOutput;

    public SourceWriter() {
        this(System.out);
    }

    public SourceWriter(PrintStream standardOutput) {
        this.standardOutput = Objects.requireNonNull(standardOutput, "standardOutput");
    }

    public void write(Optional<Path> target, List<String> lines) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(lines, "lines");
        if (target.isEmpty()) {
            lines.forEach(standardOutput::println);
            standardOutput.flush();
            if (standardOutput.checkError()) {
                throw new UncheckedIOException(new IOException("Failed to write repaired source to standard output"));
            }
            return;
        }
        Path path = target.get();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write repaired source: " + path, ex);
        }
    }
}
