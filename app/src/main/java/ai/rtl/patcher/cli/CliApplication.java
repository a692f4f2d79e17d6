package ai.rtl.patcher.cli;

import ai.rtl.patcher.config.Config;
import ai.rtl.patcher.config.ConfigLoader;
import ai.rtl.patcher.config.SystemEnvironmentReader;
import ai.rtl.patcher.hint.SourceHintLoader;
import ai.rtl.patcher.hint.SourceHints;
import ai.rtl.patcher.io.SourceReader;
import ai.rtl.patcher.io.SourceWriter;
import ai.rtl.patcher.logging.LoggingConfigurator;
import ai.rtl.patcher.pipeline.RepairResult;
import ai.rtl.patcher.pipeline.SyntaxRepairPipeline;
import java.io.UncheckedIOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and repair pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_IO_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final SourceHintLoader hintLoader;
    private final SourceReader sourceReader;
    private final SourceWriter sourceWriter;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new SourceHintLoader(), new SourceReader(),
                new SourceWriter());
    }

    CliApplication(ConfigLoader configLoader, SourceHintLoader hintLoader, SourceReader sourceReader,
                   SourceWriter sourceWriter) {
        this.configLoader = configLoader;
        this.hintLoader = hintLoader;
        this.sourceReader = sourceReader;
        this.sourceWriter = sourceWriter;
    }

    public static void main(String[] args) {
        int exitCode = new CliApplication().run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        SourceHints hints = config.referencePath()
                .map(hintLoader::load)
                .orElseGet(SourceHints::empty);
        SyntaxRepairPipeline pipeline = new SyntaxRepairPipeline(config.repairSettings(), hints);

        try {
            List<String> source = sourceReader.read(config.inputPath());
            LOGGER.info("Repairing {} line(s) from {}", source.size(),
                    config.inputPath().map(Object::toString).orElse("standard input"));
            RepairResult result = pipeline.repair(source);
            sourceWriter.write(config.outputPath(), result.lines());
            LOGGER.info("Wrote {} line(s) to {}", result.report().finalLineCount(),
                    config.outputPath().map(Object::toString).orElse("standard output"));
            return 0;
        } catch (UncheckedIOException ex) {
            LOGGER.error(ex.getMessage(), ex);
            return EXIT_IO_FAILURE;
        }
    }
}
