package models;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Classified failure of a News API request, with an optional details payload.
 */
public class FetchError {

    /** Failure classes a feed request can end in. */
    public enum Kind {
        /** Transport failure: DNS, refused connection, reset, missing mock fixture. */
        NETWORK,
        /** Connection or receive timeout exceeded. */
        TIMEOUT,
        /** The News API answered with a non-2xx status. */
        UPSTREAM,
        /** The body was not the expected JSON shape. */
        DECODE
    }

    private final Kind kind;
    private final int status;
    private final String message;
    private final JsonNode details;

    public FetchError(Kind kind, int status, String message, JsonNode details) {
        this.kind = kind;
        this.status = status;
        this.message = message;
        this.details = details;
    }

    public static FetchError network(String message) {
        return new FetchError(Kind.NETWORK, 0, message, null);
    }

    public static FetchError timeout(String message) {
        return new FetchError(Kind.TIMEOUT, 0, message, null);
    }

    public static FetchError upstream(int status, String message, JsonNode details) {
        return new FetchError(Kind.UPSTREAM, status, message, details);
    }

    public static FetchError decode(String message) {
        return new FetchError(Kind.DECODE, 0, message, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the upstream HTTP status for {@link Kind#UPSTREAM}, {@code 0} otherwise
     */
    public int getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public JsonNode getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return kind == Kind.UPSTREAM
                ? kind + "(" + status + "): " + message
                : kind + ": " + message;
    }
}
