package com.entity.integration.bulk;

/**
 * Thrown when an input file cannot be read or is not a usable extraction document.
 */
public class DocumentLoadException extends RuntimeException {

    private final String source;

    public DocumentLoadException(String source, String message) {
        super(message);
        this.source = source;
    }

    public DocumentLoadException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * The file or stream name the failure relates to.
     */
    public String getSource() {
        return source;
    }
}
