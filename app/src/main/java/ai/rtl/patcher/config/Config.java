package ai.rtl.patcher.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 * <p>
 * An absent input path means standard input; an absent output path means standard output.
 */
public record Config(
        Optional<Path> inputPath,
        Optional<Path> outputPath,
        Optional<Path> referencePath,
        LogFormat logFormat,
        boolean verbose,
        RepairSettings repairSettings
) {

    public Config {
        inputPath = inputPath == null ? Optional.empty() : inputPath;
        outputPath = outputPath == null ? Optional.empty() : outputPath;
        referencePath = referencePath == null ? Optional.empty() : referencePath;
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(repairSettings, "repairSettings");
    }
}
