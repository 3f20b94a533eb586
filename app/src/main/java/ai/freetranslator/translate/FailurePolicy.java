package ai.freetranslator.translate;

import ai.freetranslator.http.TransportException;
import java.util.Objects;

/**
 * Decides what a failed translation request leads to.
 */
public class FailurePolicy {

    /**
     * Outcome of classifying a transport failure.
     */
    public enum Decision {
        /** The token was signed with an obsolete seed: refresh it and run the whole translation again. */
        RETRY_WITH_FRESH_SEED,
        /** The service answered with an error status. */
        IP_BANNED,
        /** Rethrow the failure unchanged. */
        PROPAGATE
    }

    public static final int MAX_SEED_RETRIES = 1;

    public Decision classify(TransportException failure, boolean seedObsolete, int retriesUsed) {
        Objects.requireNonNull(failure, "failure");
        if (seedObsolete && retriesUsed < MAX_SEED_RETRIES) {
            return Decision.RETRY_WITH_FRESH_SEED;
        }
        if (failure.isProtocolFailure()) {
            return Decision.IP_BANNED;
        }
        return Decision.PROPAGATE;
    }
}
