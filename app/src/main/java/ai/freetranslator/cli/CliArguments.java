package ai.freetranslator.cli;

import ai.freetranslator.config.LogFormat;
import ai.freetranslator.language.Language;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "free-translator", mixinStandardHelpOptions = true,
        description = "Translates text through the translate_a/single web endpoint")
public class CliArguments {

    @CommandLine.Option(names = {"-f", "--from"}, converter = LanguageConverter.class, defaultValue = "auto",
            description = "Source language code or name (default: auto-detect)", paramLabel = "LANG")
    private Language from = Language.AUTO;

    @CommandLine.Option(names = {"-t", "--to"}, converter = LanguageConverter.class,
            description = "Target language code or name", paramLabel = "LANG")
    private Language to;

    @CommandLine.Option(names = "--lite", description = "Skip extra translations, synonyms, definitions and see-also terms")
    private boolean lite;

    @CommandLine.Option(names = "--domain", description = "Service host name", paramLabel = "HOST")
    private String domain;

    @CommandLine.Option(names = "--timeout", description = "Request timeout in seconds", paramLabel = "SECONDS")
    private Integer timeoutSeconds;

    @CommandLine.Option(names = "--proxy", description = "HTTP proxy as host:port", paramLabel = "HOST:PORT")
    private String proxy;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log requests and decoding details")
    private boolean verbose;

    @CommandLine.Option(names = "--list-languages", description = "Print the supported languages and exit")
    private boolean listLanguages;

    @CommandLine.Parameters(description = "Text to translate", paramLabel = "TEXT", arity = "0..*")
    private List<String> text;

    public Language from() {
        return from;
    }

    public Language to() {
        return to;
    }

    public boolean lite() {
        return lite;
    }

    public String domain() {
        return domain;
    }

    public Integer timeoutSeconds() {
        return timeoutSeconds;
    }

    public String proxy() {
        return proxy;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean listLanguages() {
        return listLanguages;
    }

    public String text() {
        return text == null ? "" : String.join(" ", text);
    }
}
