package org.assetlink.service.ingestion;

public class SourceParseException extends Exception {

    public SourceParseException(String message) {
        super(message);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
