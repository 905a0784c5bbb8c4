package org.assetlink.service;

public class SourceNotFoundException extends RuntimeException {

    public SourceNotFoundException(String sourceId) {
        super("Source not found: " + sourceId);
    }
}
