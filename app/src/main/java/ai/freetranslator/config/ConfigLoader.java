package ai.freetranslator.config;

import ai.freetranslator.cli.CliArguments;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_DOMAIN = "TRANSLATE_DOMAIN";
    static final String ENV_TIMEOUT_SECONDS = "TRANSLATE_TIMEOUT_SECONDS";
    static final String ENV_PROXY = "TRANSLATE_PROXY";
    static final String ENV_SEED_TTL_MINUTES = "TRANSLATE_SEED_TTL_MINUTES";
    static final String ENV_MIN_DELAY_MILLIS = "TRANSLATE_MIN_DELAY_MILLIS";
    static final String ENV_MAX_DELAY_MILLIS = "TRANSLATE_MAX_DELAY_MILLIS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_DOMAIN = "translate.google.com";
    private static final int DEFAULT_TIMEOUT_SECONDS = 30;
    private static final int DEFAULT_SEED_TTL_MINUTES = 60;
    private static final int DEFAULT_MIN_DELAY_MILLIS = 200;
    private static final int DEFAULT_MAX_DELAY_MILLIS = 500;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        String domain = firstNonBlank(arguments.domain(), ENV_DOMAIN, DEFAULT_DOMAIN);

        int timeoutSeconds = arguments.timeoutSeconds() != null
                ? requirePositive(arguments.timeoutSeconds(), "--timeout")
                : readInt(ENV_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS, true);

        Optional<InetSocketAddress> proxy = Optional.ofNullable(arguments.proxy())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.getNonBlank(ENV_PROXY))
                .map(ConfigLoader::parseProxy);

        int seedTtlMinutes = readInt(ENV_SEED_TTL_MINUTES, DEFAULT_SEED_TTL_MINUTES, true);
        int minDelayMillis = readInt(ENV_MIN_DELAY_MILLIS, DEFAULT_MIN_DELAY_MILLIS, false);
        int maxDelayMillis = readInt(ENV_MAX_DELAY_MILLIS, Math.max(DEFAULT_MAX_DELAY_MILLIS, minDelayMillis), false);

        return new Config(domain,
                Duration.ofSeconds(timeoutSeconds),
                proxy,
                Duration.ofMinutes(seedTtlMinutes),
                Duration.ofMillis(minDelayMillis),
                Duration.ofMillis(maxDelayMillis),
                resolveLogFormat(arguments),
                arguments.verbose());
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int readInt(String envKey, int defaultValue, boolean positive) {
        return environmentReader.getNonBlank(envKey)
                .map(raw -> parseInteger(raw, envKey))
                .map(value -> positive ? requirePositive(value, envKey) : requireNonNegative(value, envKey))
                .orElse(defaultValue);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue.trim();
        }
        return environmentReader.getNonBlank(envKey).orElse(defaultValue);
    }

    static InetSocketAddress parseProxy(String raw) {
        String value = raw.trim();
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Proxy must be given as host:port, got " + raw);
        }
        String host = value.substring(0, colon);
        int port = parseInteger(value.substring(colon + 1), "proxy port");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Proxy port out of range: " + port);
        }
        return InetSocketAddress.createUnresolved(host, port);
    }

    private static int parseInteger(String raw, String name) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static int requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be greater than zero");
        }
        return value;
    }

    private static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be zero or greater");
        }
        return value;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
