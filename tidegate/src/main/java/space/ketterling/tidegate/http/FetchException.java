package space.ketterling.tidegate.http;

/**
 * A failed attempt to load data from an external provider.
 */
public class FetchException extends Exception {
    private final Kind kind;
    private final int httpStatus;

    public FetchException(Kind kind, String message) {
        this(kind, message, -1, null);
    }

    public FetchException(Kind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public FetchException(Kind kind, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public static FetchException missingCredential(String service) {
        return new FetchException(Kind.MISSING_CREDENTIAL, service + " API key not set");
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Status code for {@link Kind#HTTP_STATUS} failures, otherwise -1.
     */
    public int httpStatus() {
        return httpStatus;
    }

    public enum Kind {
        NETWORK,
        HTTP_STATUS,
        MISSING_CREDENTIAL,
        MALFORMED_RESPONSE
    }
}
