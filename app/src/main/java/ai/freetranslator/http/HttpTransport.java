package ai.freetranslator.http;

import java.net.URI;
import java.util.Map;

/**
 * Minimal HTTP GET capability used by the translation client.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Issues a GET request.
     *
     * @throws TransportException of kind {@link TransportException.Kind#PROTOCOL} when the server answers with
     *                            an error status, {@link TransportException.Kind#NETWORK} for any other failure
     */
    TransportResponse get(URI uri, Map<String, String> headers);
}
