package ai.rtl.patcher.config;

import ai.rtl.patcher.cli.CliArguments;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUT_PATH = "INPUT_PATH";
    static final String ENV_OUTPUT_PATH = "OUTPUT_PATH";
    static final String ENV_REFERENCE_SOURCE = "REFERENCE_SOURCE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_ELSE_LOOKAHEAD_WINDOW = "ELSE_LOOKAHEAD_WINDOW";
    static final String ENV_SEQUENTIAL_PROBE_RADIUS = "SEQUENTIAL_PROBE_RADIUS";
    static final String ENV_DEFAULT_LOOP_BOUND = "DEFAULT_LOOP_BOUND";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Optional<Path> inputPath = resolvePath(arguments.inputPath(), ENV_INPUT_PATH);
        Optional<Path> outputPath = resolvePath(arguments.outputPath(), ENV_OUTPUT_PATH);
        Optional<Path> referencePath = resolvePath(arguments.referencePath(), ENV_REFERENCE_SOURCE);
        LogFormat logFormat = resolveLogFormat(arguments);

        int elseLookahead = resolvePositiveInteger(arguments.elseLookahead(), "--else-lookahead",
                ENV_ELSE_LOOKAHEAD_WINDOW, RepairSettings.DEFAULT_ELSE_LOOKAHEAD);
        int probeRadius = resolvePositiveInteger(null, null,
                ENV_SEQUENTIAL_PROBE_RADIUS, RepairSettings.DEFAULT_SEQUENTIAL_PROBE_RADIUS);
        int loopBound = resolvePositiveInteger(arguments.defaultLoopBound(), "--default-loop-bound",
                ENV_DEFAULT_LOOP_BOUND, RepairSettings.DEFAULT_LOOP_BOUND);

        RepairSettings settings = RepairSettings.defaults()
                .withElseLookahead(elseLookahead)
                .withSequentialProbeRadius(probeRadius)
                .withDefaultLoopBound(loopBound);
        return new Config(inputPath, outputPath, referencePath, logFormat, arguments.verbose(), settings);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Path::of);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolvePositiveInteger(Integer cliValue, String optionName, String envKey, int defaultValue) {
        if (cliValue != null) {
            if (cliValue <= 0) {
                throw new IllegalArgumentException(optionName + " must be greater than zero");
            }
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parsePositiveInteger(raw, envKey))
                .orElse(defaultValue);
    }

    private static int parsePositiveInteger(String raw, String envKey) {
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException(envKey + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(envKey + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
