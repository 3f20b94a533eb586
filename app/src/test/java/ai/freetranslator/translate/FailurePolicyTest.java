package ai.freetranslator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.freetranslator.http.TransportException;
import java.io.IOException;
import java.net.URI;
import org.junit.jupiter.api.Test;

class FailurePolicyTest {

    private static final URI ENDPOINT = URI.create("https://translate.google.com/translate_a/single");
    private static final TransportException FORBIDDEN = TransportException.protocolFailure(ENDPOINT, 403);
    private static final TransportException TIMEOUT = TransportException.networkFailure(ENDPOINT, new IOException("timed out"));

    private final FailurePolicy policy = new FailurePolicy();

    @Test
    void obsoleteSeedIsRetriedOnce() {
        assertThat(policy.classify(FORBIDDEN, true, 0)).isEqualTo(FailurePolicy.Decision.RETRY_WITH_FRESH_SEED);
        assertThat(policy.classify(TIMEOUT, true, 0)).isEqualTo(FailurePolicy.Decision.RETRY_WITH_FRESH_SEED);
        assertThat(policy.classify(FORBIDDEN, true, 1)).isEqualTo(FailurePolicy.Decision.IP_BANNED);
    }

    @Test
    void errorStatusWithCurrentSeedMeansBan() {
        assertThat(policy.classify(FORBIDDEN, false, 0)).isEqualTo(FailurePolicy.Decision.IP_BANNED);
    }

    @Test
    void networkFailuresPropagate() {
        assertThat(policy.classify(TIMEOUT, false, 0)).isEqualTo(FailurePolicy.Decision.PROPAGATE);
        assertThat(policy.classify(TIMEOUT, true, 1)).isEqualTo(FailurePolicy.Decision.PROPAGATE);
    }
}
