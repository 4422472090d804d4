package org.example.mjcf;

/**
 * Base class of every failure that aborts an export. None of the subclasses
 * are recovered inside the exporter; the command layer reports the message
 * and moves on to the next input file.
 */
public abstract class ExportException extends RuntimeException {

    protected ExportException(String message) {
        super(message);
    }

    protected ExportException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short tag used in command output, e.g. {@code configuration}. */
    public abstract String kind();
}
