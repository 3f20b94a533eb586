package ai.freetranslator.translate;

import ai.freetranslator.decode.ResponseDecoder;
import ai.freetranslator.http.HttpTransport;
import ai.freetranslator.http.JdkHttpTransport;
import ai.freetranslator.http.TransportException;
import ai.freetranslator.http.TransportResponse;
import ai.freetranslator.language.Language;
import ai.freetranslator.language.LanguageCatalog;
import ai.freetranslator.model.TranslationResult;
import ai.freetranslator.request.RequestBuilder;
import ai.freetranslator.request.TranslateRequest;
import ai.freetranslator.session.SessionManager;
import ai.freetranslator.token.LandingPageSeedSource;
import ai.freetranslator.token.TkkTokenFunction;
import ai.freetranslator.token.TokenGenerator;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the {@code translate_a/single} endpoint.
 * <p>
 * One instance owns one session: its cookie and token seed are fetched lazily and shared by all calls made through
 * it. Instances are safe for concurrent use.
 */
public class GoogleTranslateClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleTranslateClient.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final LanguageCatalog catalog;
    private final RequestBuilder requestBuilder;
    private final SessionManager sessionManager;
    private final TokenGenerator tokenGenerator;
    private final HttpTransport transport;
    private final ResponseDecoder decoder;
    private final RequestPacer pacer;
    private final FailurePolicy failurePolicy;
    private final Executor executor;

    public GoogleTranslateClient() {
        this(RequestBuilder.DEFAULT_DOMAIN);
    }

    public GoogleTranslateClient(String domain) {
        this(domain, DEFAULT_TIMEOUT, Optional.empty());
    }

    public GoogleTranslateClient(String domain, Duration timeout, Optional<InetSocketAddress> proxy) {
        this(LanguageCatalog.defaultCatalog(), domain, new JdkHttpTransport(timeout, proxy),
                TokenGenerator.DEFAULT_SEED_TTL, new RequestPacer());
    }

    public GoogleTranslateClient(LanguageCatalog catalog, String domain, HttpTransport transport,
                                 Duration seedTtl, RequestPacer pacer) {
        this(catalog, new RequestBuilder(catalog, domain), transport, seedTtl, pacer);
    }

    private GoogleTranslateClient(LanguageCatalog catalog, RequestBuilder requestBuilder, HttpTransport transport,
                                  Duration seedTtl, RequestPacer pacer) {
        this(catalog,
                requestBuilder,
                new SessionManager(transport, landingPage(requestBuilder.domain())),
                new TokenGenerator(new LandingPageSeedSource(transport, landingPage(requestBuilder.domain())),
                        new TkkTokenFunction(), seedTtl, Clock.systemUTC()),
                transport,
                new ResponseDecoder(catalog),
                pacer,
                new FailurePolicy(),
                ForkJoinPool.commonPool());
    }

    public GoogleTranslateClient(LanguageCatalog catalog,
                                 RequestBuilder requestBuilder,
                                 SessionManager sessionManager,
                                 TokenGenerator tokenGenerator,
                                 HttpTransport transport,
                                 ResponseDecoder decoder,
                                 RequestPacer pacer,
                                 FailurePolicy failurePolicy,
                                 Executor executor) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.requestBuilder = Objects.requireNonNull(requestBuilder, "requestBuilder");
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.tokenGenerator = Objects.requireNonNull(tokenGenerator, "tokenGenerator");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public LanguageCatalog catalog() {
        return catalog;
    }

    public String domain() {
        return requestBuilder.domain();
    }

    /**
     * Translates with full dictionary detail: extra translations, synonyms, definitions and see-also terms.
     *
     * @throws ai.freetranslator.language.UnsupportedLanguageException when a language is not supported
     * @throws ai.freetranslator.request.InvalidTargetLanguageException when {@code to} is auto-detect
     * @throws IpBannedException when the service rejects the request
     * @throws TransportException on any other network failure
     */
    public TranslationResult translate(String text, Language from, Language to) {
        return translate(text, from, to, true);
    }

    /**
     * Translates without the dictionary sections, for smaller and faster responses.
     */
    public TranslationResult translateLite(String text, Language from, Language to) {
        return translate(text, from, to, false);
    }

    public TranslationResult translate(Translatable item) {
        Objects.requireNonNull(item, "item");
        return translate(item.originalText(), item.fromLanguage(), item.toLanguage());
    }

    public TranslationResult translateLite(Translatable item) {
        Objects.requireNonNull(item, "item");
        return translateLite(item.originalText(), item.fromLanguage(), item.toLanguage());
    }

    public CompletableFuture<TranslationResult> translateAsync(String text, Language from, Language to) {
        return CompletableFuture.supplyAsync(() -> translate(text, from, to), executor);
    }

    public CompletableFuture<TranslationResult> translateLiteAsync(String text, Language from, Language to) {
        return CompletableFuture.supplyAsync(() -> translateLite(text, from, to), executor);
    }

    private TranslationResult translate(String text, Language from, Language to, boolean includeExtras) {
        Objects.requireNonNull(text, "text");
        requestBuilder.validate(from, to);
        if (text.isBlank()) {
            return TranslationResult.empty(text, from, to);
        }

        int retriesUsed = 0;
        while (true) {
            sessionManager.ensureCookie();
            String token = tokenGenerator.generate(text);
            TranslateRequest request = requestBuilder.build(text, from, to, token, sessionManager.cookieHeader());
            pacer.pause();
            LOGGER.debug("Translating {} characters {} -> {} via {}", text.length(), from.iso639(), to.iso639(), domain());
            TransportResponse response;
            try {
                response = transport.get(request.uri(), request.headers());
            } catch (TransportException ex) {
                FailurePolicy.Decision decision = failurePolicy.classify(ex, tokenGenerator.isSeedObsolete(), retriesUsed);
                if (decision == FailurePolicy.Decision.RETRY_WITH_FRESH_SEED) {
                    LOGGER.info("Request failed with an obsolete token seed; retrying with a fresh one");
                    tokenGenerator.invalidate();
                    retriesUsed++;
                    continue;
                }
                if (decision == FailurePolicy.Decision.IP_BANNED) {
                    throw new IpBannedException(ex);
                }
                throw ex;
            }
            sessionManager.rememberCookie(response);
            return decoder.decode(response.body(), text, from, to, includeExtras);
        }
    }

    private static URI landingPage(String domain) {
        return URI.create("https://" + domain + "/");
    }
}
