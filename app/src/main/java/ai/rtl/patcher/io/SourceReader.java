package ai.rtl.patcher.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads HDL source lines from a file, or from standard input when no file is configured.
 */
public class SourceReader {

    private final InputStream standardInput;

    public SourceReader() {
        this(System.in);
    }

    public SourceReader(InputStream standardInput) {
        this.standardInput = Objects.requireNonNull(standardInput, "standardInput");
    }

    public List<String> read(Optional<Path> source) {
        Objects.requireNonNull(source, "source");
        if (source.isPresent()) {
            Path path = source.get();
            try {
                return Files.readAllLines(path, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read source: " + path, ex);
            }
        }
        BufferedReader reader = new BufferedReader(new InputStreamReader(standardInput, StandardCharsets.UTF_8));
        try {
            return reader.lines().collect(Collectors.toList());
        } catch (UncheckedIOException ex) {
            throw new UncheckedIOException("Failed to read source from standard input", ex.getCause());
        }
    }
}
