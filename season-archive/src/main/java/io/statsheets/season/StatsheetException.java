package io.statsheets.season;

/**
 * Base of every error the archiver reports. Unchecked so it can travel through {@code CompletableFuture} chains.
 */
public class StatsheetException extends RuntimeException {
    public StatsheetException(String message) {
        super(message);
    }

    public StatsheetException(String message, Throwable cause) {
        super(message, cause);
    }
}
