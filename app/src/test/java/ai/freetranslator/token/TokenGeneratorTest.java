package ai.freetranslator.token;

import static org.assertj.core.api.Assertions.assertThat;

import ai.freetranslator.translate.TranslationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class TokenGeneratorTest {

    private static final TokenFunction ECHO_SEED = (seed, text) -> seed + ":" + text;

    @Test
    void fetchesSeedOnceWhileFresh() {
        ScriptedSeedSource source = new ScriptedSeedSource().thenReturn(new TokenSeed(1, 2));
        MutableClock clock = new MutableClock();
        TokenGenerator generator = new TokenGenerator(source, ECHO_SEED, Duration.ofMinutes(60), clock);

        assertThat(generator.generate("a")).isEqualTo("1.2:a");
        clock.advance(Duration.ofMinutes(59));
        assertThat(generator.generate("b")).isEqualTo("1.2:b");

        assertThat(source.calls).isEqualTo(1);
        assertThat(generator.isSeedObsolete()).isFalse();
    }

    @Test
    void refreshesSeedAfterTtl() {
        ScriptedSeedSource source = new ScriptedSeedSource()
                .thenReturn(new TokenSeed(1, 2))
                .thenReturn(new TokenSeed(3, 4));
        MutableClock clock = new MutableClock();
        TokenGenerator generator = new TokenGenerator(source, ECHO_SEED, Duration.ofMinutes(60), clock);

        generator.generate("a");
        clock.advance(Duration.ofMinutes(60));

        assertThat(generator.generate("a")).isEqualTo("3.4:a");
        assertThat(source.calls).isEqualTo(2);
    }

    @Test
    void fallsBackToBuiltInSeedWhenFirstFetchFails() {
        ScriptedSeedSource source = new ScriptedSeedSource().thenFail();
        TokenGenerator generator = new TokenGenerator(source, ECHO_SEED, Duration.ofMinutes(60), new MutableClock());

        assertThat(generator.generate("x")).isEqualTo(TokenSeed.FALLBACK + ":x");
        assertThat(generator.isSeedObsolete()).isTrue();
    }

    @Test
    void keepsStaleSeedWhenRefreshFails() {
        ScriptedSeedSource source = new ScriptedSeedSource()
                .thenReturn(new TokenSeed(1, 2))
                .thenFail();
        MutableClock clock = new MutableClock();
        TokenGenerator generator = new TokenGenerator(source, ECHO_SEED, Duration.ofMinutes(1), clock);

        generator.generate("x");
        clock.advance(Duration.ofMinutes(2));

        assertThat(generator.generate("x")).isEqualTo("1.2:x");
        assertThat(generator.isSeedObsolete()).isTrue();
    }

    @Test
    void successfulRefreshClearsObsoleteFlag() {
        ScriptedSeedSource source = new ScriptedSeedSource()
                .thenFail()
                .thenReturn(new TokenSeed(5, 6));
        TokenGenerator generator = new TokenGenerator(source, ECHO_SEED, Duration.ofMinutes(60), new MutableClock());

        generator.generate("x");
        assertThat(generator.isSeedObsolete()).isTrue();

        generator.invalidate();
        assertThat(generator.generate("x")).isEqualTo("5.6:x");
        assertThat(generator.isSeedObsolete()).isFalse();
    }

    @Test
    void invalidateForcesRefetch() {
        ScriptedSeedSource source = new ScriptedSeedSource()
                .thenReturn(new TokenSeed(1, 2))
                .thenReturn(new TokenSeed(7, 8));
        TokenGenerator generator = new TokenGenerator(source, ECHO_SEED, Duration.ofMinutes(60), new MutableClock());

        generator.generate("x");
        generator.invalidate();

        assertThat(generator.generate("x")).isEqualTo("7.8:x");
        assertThat(source.calls).isEqualTo(2);
    }

    private static final class ScriptedSeedSource implements SeedSource {
        private final Deque<Supplier<TokenSeed>> replies = new ArrayDeque<>();
        private int calls;

        ScriptedSeedSource thenReturn(TokenSeed seed) {
            replies.add(() -> seed);
            return this;
        }

        ScriptedSeedSource thenFail() {
            replies.add(() -> {
                throw new TranslationException("seed unavailable");
            });
            return this;
        }

        @Override
        public TokenSeed fetch() {
            calls++;
            Supplier<TokenSeed> next = replies.size() > 1 ? replies.poll() : replies.peek();
            return next.get();
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
