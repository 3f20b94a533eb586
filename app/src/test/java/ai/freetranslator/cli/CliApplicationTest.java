package ai.freetranslator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.freetranslator.config.Config;
import ai.freetranslator.config.ConfigLoader;
import ai.freetranslator.config.LogFormat;
import ai.freetranslator.http.StubTransport;
import ai.freetranslator.http.TransportException;
import ai.freetranslator.language.LanguageCatalog;
import ai.freetranslator.translate.GoogleTranslateClient;
import ai.freetranslator.translate.RequestPacer;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class CliApplicationTest {

    private static final String HELLO_RESPONSE = """
            [[["привет","hello",null,null,10],[null,null,"privet"]],
             [["noun",["привет"],[["привет",["hello","hi"],null,0.5]],"hello",1]],
             "en",null,null,null,1,null,[["en"],null,[1],["en"]]]
            """;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void printsTranslationWithDictionaryDetail() {
        StubTransport transport = workingTransport();
        RecordingClientFactory factory = new RecordingClientFactory(transport);

        int exitCode = run(factory, "--from", "en", "--to", "Russian", "hello");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("привет")
                .contains("[privet]")
                .contains("English -> Russian")
                .contains("NOUN")
                .contains("привет (hello, hi)");
        assertThat(factory.created).isEqualTo(1);
        assertThat(transport.count(StubTransport.TRANSLATE)).isEqualTo(1);
    }

    @Test
    void joinsPositionalWordsIntoOneText() {
        StubTransport transport = workingTransport();

        int exitCode = run(new RecordingClientFactory(transport), "--to", "ru", "--lite", "good", "morning");

        assertThat(exitCode).isZero();
        assertThat(transport.requests().get(transport.requests().size() - 1).getRawQuery())
                .startsWith("sl=auto&tl=ru&")
                .contains("&q=good%20morning&");
        assertThat(out.toString()).doesNotContain("NOUN");
    }

    @Test
    void missingTargetIsUsageError() {
        RecordingClientFactory factory = new RecordingClientFactory(new StubTransport());

        int exitCode = run(factory, "hello");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--to");
        assertThat(factory.created).isZero();
    }

    @Test
    void unknownLanguageIsUsageError() {
        int exitCode = run(new RecordingClientFactory(new StubTransport()), "--to", "klingon", "hello");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Unsupported language: klingon");
    }

    @Test
    void bannedClientExitsWithFailure() {
        StubTransport transport = new StubTransport()
                .reply(StubTransport.LANDING_PAGE, StubTransport.ok("tkk:'406398.2087938574'", "NID=1"))
                .fail(StubTransport.TRANSLATE, TransportException.protocolFailure(
                        URI.create("https://translate.google.com/translate_a/single"), 429));

        int exitCode = run(new RecordingClientFactory(transport), "--to", "ru", "hello");

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_TRANSLATION_FAILED);
        assertThat(err.toString()).contains("IP address is probably banned");
    }

    @Test
    void listsSupportedLanguages() {
        RecordingClientFactory factory = new RecordingClientFactory(new StubTransport());

        int exitCode = run(factory, "--list-languages");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("de\tGerman").contains("zh-CN\tChinese Simplified");
        assertThat(factory.created).isZero();
    }

    @Test
    void helpIsPrinted() {
        int exitCode = run(new RecordingClientFactory(new StubTransport()), "--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("free-translator").contains("--list-languages");
    }

    private int run(RecordingClientFactory factory, String... args) {
        CliArguments arguments = new CliArguments();
        CommandLine commandLine = new CommandLine(arguments);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        CliApplication application = new CliApplication(new FixedConfigLoader(), factory::create);
        return application.run(commandLine, arguments, args);
    }

    private static StubTransport workingTransport() {
        return new StubTransport()
                .reply(StubTransport.LANDING_PAGE, StubTransport.ok("tkk:'406398.2087938574'", "NID=1"))
                .reply(StubTransport.TRANSLATE, StubTransport.ok(HELLO_RESPONSE));
    }

    private static final class RecordingClientFactory {
        private final StubTransport transport;
        private int created;

        RecordingClientFactory(StubTransport transport) {
            this.transport = transport;
        }

        GoogleTranslateClient create(Config config) {
            created++;
            return new GoogleTranslateClient(LanguageCatalog.defaultCatalog(), config.domain(), transport,
                    config.seedTtl(), RequestPacer.disabled());
        }
    }

    private static final class FixedConfigLoader extends ConfigLoader {

        FixedConfigLoader() {
            super(key -> Optional.empty());
        }

        @Override
        public Config load(CliArguments arguments) {
            return new Config("translate.google.com", Duration.ofSeconds(5), Optional.empty(), Duration.ofHours(1),
                    Duration.ZERO, Duration.ZERO, LogFormat.TEXT, false);
        }
    }
}
