package dev.catananti.stats.exception;

/**
 * Failure reported by the remote stats API or the transport in front of it.
 */
public class StatsRemoteException extends RuntimeException {

    public enum Kind {
        /** Network failure, timeout, open circuit or an unexpected HTTP status. */
        TRANSPORT,
        /** The API refused the request (HTTP 401/403). */
        AUTHORIZATION,
        /** The API answered without a {@code summary} payload for a top-list request. */
        EMPTY_SUMMARY
    }

    private final Kind kind;
    private final int status;
    private final String errorCode;

    public StatsRemoteException(Kind kind, int status, String errorCode, String message) {
        super(message);
        this.kind = kind;
        this.status = status;
        this.errorCode = errorCode;
    }

    public StatsRemoteException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = 0;
        this.errorCode = null;
    }

    public static StatsRemoteException emptySummary(String endpoint) {
        return new StatsRemoteException(Kind.EMPTY_SUMMARY, 200, null, "No summary returned by " + endpoint);
    }

    public Kind getKind() {
        return kind;
    }

    public int getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean is(Kind expected) {
        return kind == expected;
    }
}
