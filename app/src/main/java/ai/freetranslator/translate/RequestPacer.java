package ai.freetranslator.translate;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Waits a random interval before each translation request so bursts of calls do not trip the service's rate limits.
 */
public class RequestPacer {

    public static final Duration DEFAULT_MIN_DELAY = Duration.ofMillis(200);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofMillis(500);

    /**
     * Blocking wait, replaceable in tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final long minMillis;
    private final long maxMillis;
    private final Sleeper sleeper;

    public RequestPacer() {
        this(DEFAULT_MIN_DELAY, DEFAULT_MAX_DELAY, duration -> Thread.sleep(duration.toMillis()));
    }

    public RequestPacer(Duration minDelay, Duration maxDelay, Sleeper sleeper) {
        Objects.requireNonNull(minDelay, "minDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        if (minDelay.isNegative()) {
            throw new IllegalArgumentException("minDelay must not be negative");
        }
        if (maxDelay.compareTo(minDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least minDelay");
        }
        this.minMillis = minDelay.toMillis();
        this.maxMillis = maxDelay.toMillis();
    }

    public static RequestPacer disabled() {
        return new RequestPacer(Duration.ZERO, Duration.ZERO, duration -> { });
    }

    /**
     * @throws TranslationException when interrupted; the interrupt flag is restored
     */
    public void pause() {
        Duration delay = nextDelay();
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted while pacing translation request", ex);
        }
    }

    Duration nextDelay() {
        if (maxMillis == minMillis) {
            return Duration.ofMillis(minMillis);
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(minMillis, maxMillis + 1));
    }
}
