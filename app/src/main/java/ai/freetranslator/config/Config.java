package ai.freetranslator.config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        String domain,
        Duration requestTimeout,
        Optional<InetSocketAddress> proxy,
        Duration seedTtl,
        Duration minRequestDelay,
        Duration maxRequestDelay,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        domain = requireNonBlank(domain, "domain");
        requirePositive(requestTimeout, "requestTimeout");
        proxy = proxy == null ? Optional.empty() : proxy;
        requirePositive(seedTtl, "seedTtl");
        Objects.requireNonNull(minRequestDelay, "minRequestDelay");
        Objects.requireNonNull(maxRequestDelay, "maxRequestDelay");
        if (minRequestDelay.isNegative()) {
            throw new IllegalArgumentException("minRequestDelay must not be negative");
        }
        if (maxRequestDelay.compareTo(minRequestDelay) < 0) {
            throw new IllegalArgumentException("maxRequestDelay must be at least minRequestDelay");
        }
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }

    private static void requirePositive(Duration value, String fieldName) {
        Objects.requireNonNull(value, fieldName);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(fieldName + " must be positive");
        }
    }
}
