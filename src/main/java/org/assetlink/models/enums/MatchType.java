package org.assetlink.models.enums;

public enum MatchType {
    MAC,
    HOSTNAME,
    IP
}
