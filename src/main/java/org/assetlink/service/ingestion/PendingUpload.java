package org.assetlink.service.ingestion;

/**
 * A file received for import, already read into memory, with the label chosen for it.
 */
public record PendingUpload(
        String fileName,
        String label,
        byte[] content
) {
}
