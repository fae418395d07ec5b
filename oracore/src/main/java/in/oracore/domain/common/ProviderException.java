package in.oracore.domain.common;

/**
 * Transient market-data provider failure: network error, throttling or a 5xx response.
 * Callers retry with backoff before giving up on the stream for the cycle.
 */
public class ProviderException extends RuntimeException {
    private final int statusCode;

    public ProviderException(String message) {
        this(message, -1, null);
    }

    public ProviderException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status that triggered the failure, or -1 when there was no response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Client errors other than throttling (bad key, unknown ticker) will not succeed on retry.
     */
    public boolean isRetryable() {
        return statusCode < 400 || statusCode == 429 || statusCode >= 500;
    }
}
