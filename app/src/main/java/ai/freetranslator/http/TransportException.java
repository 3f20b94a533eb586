package ai.freetranslator.http;

import ai.freetranslator.translate.TranslationException;
import java.net.URI;
import java.util.Optional;

/**
 * Failure reported by an {@link HttpTransport}.
 */
public class TransportException extends TranslationException {

    /**
     * How the request failed.
     */
    public enum Kind {
        /** The server answered with an error status. */
        PROTOCOL,
        /** No usable answer: connection, timeout or I/O failure. */
        NETWORK
    }

    private final Kind kind;
    private final URI uri;
    private final Integer statusCode;

    private TransportException(Kind kind, URI uri, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.uri = uri;
        this.statusCode = statusCode;
    }

    public static TransportException protocolFailure(URI uri, int statusCode) {
        return new TransportException(Kind.PROTOCOL, uri, statusCode,
                "Request to " + describe(uri) + " failed with HTTP status " + statusCode, null);
    }

    public static TransportException networkFailure(URI uri, Throwable cause) {
        String detail = cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
        return new TransportException(Kind.NETWORK, uri, null,
                "Request to " + describe(uri) + " failed" + detail, cause);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isProtocolFailure() {
        return kind == Kind.PROTOCOL;
    }

    public Optional<URI> uri() {
        return Optional.ofNullable(uri);
    }

    public Optional<Integer> statusCode() {
        return Optional.ofNullable(statusCode);
    }

    private static String describe(URI uri) {
        if (uri == null) {
            return "(unknown)";
        }
        // the query carries the user's text and the signing token
        return uri.getScheme() + "://" + uri.getHost() + (uri.getPath() == null ? "" : uri.getPath());
    }
}
