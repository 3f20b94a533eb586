package ai.freetranslator.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SystemEnvironmentReaderTest {

    private static final String KEY = "FREE_TRANSLATOR_TEST_ONLY_KEY";

    @AfterEach
    void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    void fallsBackToSystemProperty() {
        System.setProperty(KEY, " value ");

        assertThat(new SystemEnvironmentReader().get(KEY)).contains(" value ");
        assertThat(new SystemEnvironmentReader().getNonBlank(KEY)).contains("value");
    }

    @Test
    void unknownKeyIsEmpty() {
        assertThat(new SystemEnvironmentReader().get(KEY)).isEmpty();
    }
}
