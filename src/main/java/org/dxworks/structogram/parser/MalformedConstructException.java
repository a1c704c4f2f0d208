package org.dxworks.structogram.parser;

/**
 * Raised when a paired construct (if/else, try/catch, repeat/while) is assembled from blocks
 * that do not form a valid pair.
 */
public class MalformedConstructException extends RuntimeException {

    private final int lineNumber;

    public MalformedConstructException(String message, int lineNumber) {
        super(message + " (line " + lineNumber + ")");
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
