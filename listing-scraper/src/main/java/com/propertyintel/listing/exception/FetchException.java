package com.propertyintel.listing.exception;

/**
 * A source API call that did not produce a usable response.
 * Retryable failures (429, 5xx, I/O) are retried with backoff; others fail the page at once.
 */
public class FetchException extends RuntimeException {

    private final int statusCode;
    private final boolean retryable;

    public FetchException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.retryable = true;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static FetchException rateLimited(String url) {
        return new FetchException("Rate limited (429) by source API: " + url, 429, true);
    }

    public static FetchException serverError(String url, int status) {
        return new FetchException("Source API returned HTTP " + status + ": " + url, status, true);
    }

    public static FetchException clientError(String url, int status) {
        return new FetchException("Source API rejected request with HTTP " + status + ": " + url, status, false);
    }
}
