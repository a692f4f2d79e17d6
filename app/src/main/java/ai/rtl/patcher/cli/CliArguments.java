package ai.rtl.patcher.cli;

import ai.rtl.patcher.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-rtl-patcher", mixinStandardHelpOptions = true, version = "ai-rtl-patcher 0.1.0",
        description = "Repairs structurally malformed Verilog/SystemVerilog source")
public class CliArguments {

    @CommandLine.Option(names = "--input", description = "Source file to repair (default: standard input)", paramLabel = "FILE")
    private Path inputPath;

    @CommandLine.Option(names = "--output", description = "Where to write the repaired source (default: standard output)", paramLabel = "FILE")
    private Path outputPath;

    @CommandLine.Option(names = "--reference", description = "Reference source used for always-block hints", paramLabel = "FILE")
    private Path referencePath;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--else-lookahead", description = "Lines after an if block within which an else may still pair", paramLabel = "LINES")
    private Integer elseLookahead;

    @CommandLine.Option(names = "--default-loop-bound", description = "Generate loop bound when no width parameter is declared", paramLabel = "COUNT")
    private Integer defaultLoopBound;

    @CommandLine.Option(names = "--verbose", description = "Log every individual repair")
    private boolean verbose;

    public Path inputPath() {
        return inputPath;
    }

    public Path outputPath() {
        return outputPath;
    }

    public Path referencePath() {
        return referencePath;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public Integer elseLookahead() {
        return elseLookahead;
    }

    public Integer defaultLoopBound() {
        return defaultLoopBound;
    }

    public boolean verbose() {
        return verbose;
    }
}
