package ai.freetranslator.cli;

import ai.freetranslator.config.Config;
import ai.freetranslator.config.ConfigLoader;
import ai.freetranslator.config.SystemEnvironmentReader;
import ai.freetranslator.http.JdkHttpTransport;
import ai.freetranslator.language.Language;
import ai.freetranslator.language.LanguageCatalog;
import ai.freetranslator.logging.LoggingConfigurator;
import ai.freetranslator.model.TranslationResult;
import ai.freetranslator.translate.GoogleTranslateClient;
import ai.freetranslator.translate.RequestPacer;
import ai.freetranslator.translate.TranslationException;
import java.io.PrintWriter;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and translation client.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_TRANSLATION_FAILED = 1;

    private final ConfigLoader configLoader;
    private final Function<Config, GoogleTranslateClient> clientFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), CliApplication::createClient);
    }

    CliApplication(ConfigLoader configLoader, Function<Config, GoogleTranslateClient> clientFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        return run(commandLine, cliArguments, args);
    }

    int run(CommandLine commandLine, CliArguments cliArguments, String[] args) {
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            return usageError(commandLine, ex.getMessage());
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        PrintWriter out = commandLine.getOut();
        if (cliArguments.listLanguages()) {
            for (Language language : LanguageCatalog.defaultCatalog().languages()) {
                out.println(language.iso639() + "\t" + language.fullName());
            }
            out.flush();
            return 0;
        }
        if (cliArguments.to() == null) {
            return usageError(commandLine, "Missing required option: '--to=LANG'");
        }
        if (cliArguments.text().isBlank()) {
            return usageError(commandLine, "Missing text to translate");
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            return usageError(commandLine, ex.getMessage());
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Using domain {} (timeout={}, proxy={})",
                config.domain(), config.requestTimeout(), config.proxy().map(Object::toString).orElse("none"));

        GoogleTranslateClient client = clientFactory.apply(config);
        try {
            TranslationResult result = cliArguments.lite()
                    ? client.translateLite(cliArguments.text(), cliArguments.from(), cliArguments.to())
                    : client.translate(cliArguments.text(), cliArguments.from(), cliArguments.to());
            new ResultPrinter(out).print(result);
            return 0;
        } catch (TranslationException ex) {
            LOGGER.error("Translation failed: {}", ex.getMessage(), ex);
            commandLine.getErr().println(ex.getMessage());
            commandLine.getErr().flush();
            return EXIT_TRANSLATION_FAILED;
        }
    }

    private static int usageError(CommandLine commandLine, String message) {
        commandLine.getErr().println(message);
        commandLine.usage(commandLine.getErr());
        return commandLine.getCommandSpec().exitCodeOnInvalidInput();
    }

    static GoogleTranslateClient createClient(Config config) {
        LOGGER.debug("Creating client for {}", config.domain());
        RequestPacer pacer = new RequestPacer(config.minRequestDelay(), config.maxRequestDelay(),
                duration -> Thread.sleep(duration.toMillis()));
        return new GoogleTranslateClient(LanguageCatalog.defaultCatalog(),
                config.domain(),
                new JdkHttpTransport(config.requestTimeout(), config.proxy()),
                config.seedTtl(),
                pacer);
    }
}
