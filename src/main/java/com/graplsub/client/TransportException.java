package com.graplsub.client;

/**
 * Raised when a request could not produce a decoded envelope.
 * <p>
 * Messages never contain the request query string, since it holds the auth token and salt.
 *
 * @author graplsub maintainers
 * @since 0.1
 */
public class TransportException extends SubsonicException {

    /**
     * Classification of transport failures.
     */
    public enum Kind {
        /** DNS, connect, timeout or I/O failure. */
        NETWORK,
        /** HTTP 404. */
        NOT_FOUND,
        /** Any other non-200 status. */
        HTTP,
        /** A 200 response whose body was not the expected JSON. */
        MALFORMED_RESPONSE
    }

    private final Kind kind;
    private final String url;
    private final int statusCode;
    private final String rawBody;

    private TransportException(Kind kind, String message, String url, int statusCode, String rawBody, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.url = url;
        this.statusCode = statusCode;
        this.rawBody = rawBody;
    }

    public static TransportException network(String url, Throwable cause) {
        String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new TransportException(Kind.NETWORK, "Network error: " + detail + " (" + url + ")", url, -1, null, cause);
    }

    /**
     * The request could not be built from the configured base URL. The cause is kept but its
     * message, which may echo the full query, is not shown.
     */
    public static TransportException invalidUrl(String url, Throwable cause) {
        return new TransportException(Kind.NETWORK, "Invalid server URL: " + url, url, -1, null, cause);
    }

    public static TransportException notFound(String url) {
        return new TransportException(Kind.NOT_FOUND, "Resource not found: " + url, url, 404, null, null);
    }

    public static TransportException http(int statusCode, String url) {
        return new TransportException(Kind.HTTP, "HTTP status " + statusCode + " for " + url, url, statusCode, null, null);
    }

    public static TransportException malformed(String url, String rawBody, Throwable cause) {
        String detail = cause == null ? "missing subsonic-response" : cause.getMessage();
        return new TransportException(Kind.MALFORMED_RESPONSE,
            "Response parsing error: " + detail + "\nResponse body: " + rawBody, url, 200, rawBody, cause);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return request URL with the query string removed
     */
    public String getUrl() {
        return url;
    }

    /**
     * @return HTTP status, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return body that failed to parse, only set for {@link Kind#MALFORMED_RESPONSE}
     */
    public String getRawBody() {
        return rawBody;
    }
}
