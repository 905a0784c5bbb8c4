package org.assetlink.models.enums;

public enum ResolutionMode {
    /**
     * First matching key in MAC, hostname, IP, generic id order; existing assets are never merged.
     */
    PRIORITY,
    /**
     * Rows sharing any key, directly or through other rows, become one asset.
     */
    TRANSITIVE
}
