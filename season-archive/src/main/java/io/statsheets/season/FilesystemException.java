package io.statsheets.season;

import java.nio.file.Path;

/** Creating an output directory or writing a record file failed. */
public class FilesystemException extends StatsheetException {
    private final Path path;

    public FilesystemException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public FilesystemException(Path path, Throwable cause) {
        this(path, "could not write record", cause);
    }

    public Path path() { return path; }
}
