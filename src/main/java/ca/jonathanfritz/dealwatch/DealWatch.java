package ca.jonathanfritz.dealwatch;

import ca.jonathanfritz.dealwatch.cli.CLI;
import ca.jonathanfritz.dealwatch.cli.CLIModule;
import ca.jonathanfritz.dealwatch.config.AppConfigLoader;
import ca.jonathanfritz.dealwatch.exception.CliException;
import ca.jonathanfritz.dealwatch.exception.DealWatchException;
import ca.jonathanfritz.dealwatch.io.MessageFileReader;
import ca.jonathanfritz.dealwatch.matching.MatchingModule;
import ca.jonathanfritz.dealwatch.service.MessageScanService;
import ca.jonathanfritz.dealwatch.service.ScanStatistics;
import ca.jonathanfritz.dealwatch.utils.PathUtils;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import org.apache.commons.cli.*;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * The entrypoint to the application
 * Handles CLI argument parsing and Guice injector setup
 */
public class DealWatch {

    private final MessageScanService messageScanService;
    private final MessageFileReader messageFileReader;
    private final PathUtils pathUtils;
    private final CLI cli;

    private static final Logger log = LogManager.getLogger(DealWatch.class);

    @Inject
    DealWatch(MessageScanService messageScanService, MessageFileReader messageFileReader, PathUtils pathUtils, CLI cli) {
        this.messageScanService = messageScanService;
        this.messageFileReader = messageFileReader;
        this.pathUtils = pathUtils;
        this.cli = cli;
    }

    private void scanFile(String path) throws DealWatchException {
        final Path pathToMessageFile = pathUtils.expand(path);
        if (!(Files.exists(pathToMessageFile) && Files.isReadable(pathToMessageFile))) {
            throw new CliException("Message file path either does not exist or cannot be read");
        }

        final List<String> messages;
        try {
            messages = messageFileReader.read(pathToMessageFile);
        } catch (IOException ex) {
            throw new CliException("Failed to read message file", ex);
        }

        cli.printWelcomeBanner();
        final ScanStatistics statistics = messageScanService.scan(messages);
        cli.println("");
        cli.println(statistics.toLines());
        cli.exit();
    }

    void matchText(List<String> words) throws CliException {
        if (words.isEmpty()) {
            throw new CliException("Message text not specified");
        }
        final ScanStatistics statistics = messageScanService.scan(List.of(String.join(" ", words)));
        if (statistics.getMatchesFound() == 0) {
            cli.println("No product matches");
        } else if (statistics.getMatchesMuted() == statistics.getMatchesFound()) {
            cli.println(String.format("%d product match(es), all with notifications turned off", statistics.getMatchesFound()));
        }
        cli.exit();
    }

    private void printHelp() {
        cli.println(Arrays.asList(
                "dealwatch scan [OPTIONS] [FILENAME]",
                "   Matches every message in the specified file against the product catalog",
                "   Messages are separated by lines containing only " + MessageFileReader.SEPARATOR,
                "dealwatch match [OPTIONS] [TEXT]",
                "   Matches a single message against the product catalog",
                "   --config-dir: Optional. Directory containing config.yaml",
                "                 Defaults to ~/.dealwatch",
                "dealwatch help",
                "   Displays this help text"
        ));
    }

    public static void main(String[] args) throws DealWatchException {
        final PathUtils pathUtils = new PathUtils();

        // figure out which of the major modes we're in
        final Mode mode = getMode(args);
        final DealWatchOptions options = getOptions(args);
        final DealWatch dealWatch = initializeApplication(pathUtils, options.configDirectory);

        try {
            switch (mode) {
                case SCAN:
                    // if mode is SCAN, the first positional argument is the path to the message file
                    if (options.arguments.size() != 1) {
                        throw new CliException("Message file path not specified");
                    }
                    dealWatch.scanFile(options.arguments.get(0));
                    break;
                case MATCH:
                    dealWatch.matchText(options.arguments);
                    break;
                case HELP:
                    dealWatch.printHelp();
                    break;
            }
        } catch (DealWatchException ex) {
            dealWatch.printHelp();
            throw ex;
        }
    }

    private static DealWatch initializeApplication(PathUtils pathUtils, String configDirectory) {
        final Path configPath = StringUtils.isBlank(configDirectory)
                ? pathUtils.getDataPath()
                : pathUtils.expand(configDirectory);
        final AppConfigLoader.LoadResult loadResult = new AppConfigLoader().loadOrCreate(configPath);
        if (loadResult.wasCreated()) {
            log.info("Wrote default configuration to {}", loadResult.configPath());
        }

        final Injector injector = Guice.createInjector(new CLIModule(), new MatchingModule(loadResult.config(), configPath));
        return injector.getInstance(DealWatch.class);
    }

    static Mode getMode(String[] args) throws CliException {
        if (args.length == 0) {
            throw new CliException("Too few arguments specified");
        }
        return Arrays.stream(Mode.values())
                .filter(m -> m.name().equalsIgnoreCase(args[0]))
                .findFirst()
                .orElseThrow(() -> new CliException(String.format("Invalid mode %s specified", args[0])));
    }

    enum Mode {
        SCAN,
        MATCH,
        HELP
    }

    static DealWatchOptions getOptions(String[] args) throws CliException {
        try {
            final Options options = new Options();
            options.addOption(Option.builder()
                    .argName("c")
                    .longOpt("config-dir")
                    .desc("Directory containing config.yaml")
                    .hasArg(true)
                    .required(false)
                    .build());

            // stop at the first positional argument, message text may contain words that look like options
            final CommandLineParser commandLineParser = new DefaultParser();
            final CommandLine commandLine = commandLineParser.parse(options, Arrays.copyOfRange(args, Math.min(1, args.length), args.length), true);
            return new DealWatchOptions(commandLine.getOptionValue("config-dir"), commandLine.getArgList());
        } catch (ParseException e) {
            throw new CliException("Failed to parse options", e);
        }
    }

    static class DealWatchOptions {
        final String configDirectory;
        final List<String> arguments;

        DealWatchOptions(String configDirectory, List<String> arguments) {
            this.configDirectory = configDirectory;
            this.arguments = List.copyOf(arguments);
        }
    }
}
