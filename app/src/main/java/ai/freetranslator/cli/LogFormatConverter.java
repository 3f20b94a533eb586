package ai.freetranslator.cli;

import ai.freetranslator.config.LogFormat;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import picocli.CommandLine;

/**
 * Accepts {@code text} or {@code json} in any case.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    private static final String EXPECTED = Arrays.stream(LogFormat.values())
            .map(format -> format.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage() + " (expected one of: " + EXPECTED + ")");
        }
    }
}
