package io.statsheets.season;

/**
 * The request could not be sent, timed out, or the service answered with a non-2xx status.
 */
public class TransportException extends StatsheetException {
    private final String endpoint;
    private final int status;

    public TransportException(String endpoint, String message, Throwable cause) {
        super(endpoint + ": " + message, cause);
        this.endpoint = endpoint;
        this.status = -1;
    }

    public TransportException(String endpoint, int status, String message) {
        super(endpoint + ": HTTP " + status + " " + message);
        this.endpoint = endpoint;
        this.status = status;
    }

    public String endpoint() { return endpoint; }

    /** HTTP status, or -1 when no response arrived. */
    public int status() { return status; }
}
