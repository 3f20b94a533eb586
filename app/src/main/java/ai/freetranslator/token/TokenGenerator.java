package ai.freetranslator.token;

import ai.freetranslator.translate.TranslationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces signing tokens, keeping the seed cached until it ages out.
 * <p>
 * Seed refreshes never fail the caller. When a refresh cannot complete, the previous seed (or
 * {@link TokenSeed#FALLBACK}) keeps being used and {@link #isSeedObsolete()} reports {@code true}, so that a
 * failing request can be retried after {@link #invalidate()}. Concurrent callers may refresh redundantly; the
 * last stored seed wins.
 */
public class TokenGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenGenerator.class);

    public static final Duration DEFAULT_SEED_TTL = Duration.ofHours(1);

    private final SeedSource seedSource;
    private final TokenFunction tokenFunction;
    private final Duration seedTtl;
    private final Clock clock;
    private final AtomicReference<CachedSeed> cachedSeed = new AtomicReference<>();
    private volatile boolean seedObsolete;

    public TokenGenerator(SeedSource seedSource) {
        this(seedSource, new TkkTokenFunction(), DEFAULT_SEED_TTL, Clock.systemUTC());
    }

    public TokenGenerator(SeedSource seedSource, TokenFunction tokenFunction, Duration seedTtl, Clock clock) {
        this.seedSource = Objects.requireNonNull(seedSource, "seedSource");
        this.tokenFunction = Objects.requireNonNull(tokenFunction, "tokenFunction");
        this.seedTtl = Objects.requireNonNull(seedTtl, "seedTtl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (seedTtl.isNegative() || seedTtl.isZero()) {
            throw new IllegalArgumentException("seedTtl must be positive");
        }
    }

    public String generate(String text) {
        Objects.requireNonNull(text, "text");
        return tokenFunction.apply(currentSeed(), text);
    }

    /**
     * Whether the last refresh attempt failed, meaning tokens are signed with a seed the service may reject.
     */
    public boolean isSeedObsolete() {
        return seedObsolete;
    }

    /**
     * Forgets the cached seed so the next {@link #generate(String)} downloads a new one.
     */
    public void invalidate() {
        cachedSeed.set(null);
    }

    private TokenSeed currentSeed() {
        CachedSeed cached = cachedSeed.get();
        Instant now = clock.instant();
        if (cached != null && cached.fetchedAt().plus(seedTtl).isAfter(now)) {
            return cached.seed();
        }
        try {
            TokenSeed fresh = seedSource.fetch();
            cachedSeed.set(new CachedSeed(fresh, now));
            seedObsolete = false;
            LOGGER.debug("Refreshed token seed");
            return fresh;
        } catch (TranslationException ex) {
            seedObsolete = true;
            TokenSeed stale = cached != null ? cached.seed() : TokenSeed.FALLBACK;
            LOGGER.warn("Token seed refresh failed, signing with a possibly stale seed: {}", ex.getMessage());
            return stale;
        }
    }

    private record CachedSeed(TokenSeed seed, Instant fetchedAt) {
    }
}
