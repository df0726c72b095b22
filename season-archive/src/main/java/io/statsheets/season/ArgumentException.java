package io.statsheets.season;

/** Missing or malformed season argument or configuration value. */
public class ArgumentException extends StatsheetException {
    public ArgumentException(String message) {
        super(message);
    }

    public ArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
