package org.assetlink.service.ingestion;

import java.nio.charset.Charset;
import java.util.concurrent.CompletableFuture;

public interface RecordExtractor {

    boolean supports(String fileName);

    ParsedSource extract(String fileName, byte[] content, Charset charset) throws SourceParseException;

    /**
     * Runs {@link #extract} on the parse executor. Failures complete the future exceptionally.
     */
    CompletableFuture<ParsedSource> extractAsync(String fileName, byte[] content, Charset charset);
}
