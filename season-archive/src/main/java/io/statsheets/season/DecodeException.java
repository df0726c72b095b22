package io.statsheets.season;

/** Response body is not a JSON array of records carrying the required fields. */
public class DecodeException extends StatsheetException {
    private final String endpoint;

    public DecodeException(String endpoint, String message, Throwable cause) {
        super(endpoint + ": " + message, cause);
        this.endpoint = endpoint;
    }

    public String endpoint() { return endpoint; }
}
