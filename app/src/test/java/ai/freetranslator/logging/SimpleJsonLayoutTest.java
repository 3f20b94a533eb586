package ai.freetranslator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "seed refreshed");

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"seed refreshed\"");
        assertThat(json).contains("\"logger\":\"ai.freetranslator.token.TokenGenerator\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"error\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesMdcAndErrorDetails() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = startedLayout(context);
        LoggingEvent event = event(context, "request failed: \"quoted\"");
        event.setMDCPropertyMap(Map.of("domain", "translate.google.com"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"message\":\"request failed: \\\"quoted\\\"\"");
        assertThat(json).contains("\"mdc\":{\"domain\":\"translate.google.com\"}");
        assertThat(json).contains("\"error\":{\"type\":\"java.lang.IllegalStateException\",\"message\":\"boom\"}");
    }

    private static SimpleJsonLayout startedLayout(LoggerContext context) {
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("ai.freetranslator.token.TokenGenerator");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
