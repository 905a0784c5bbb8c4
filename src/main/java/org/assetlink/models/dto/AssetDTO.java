package org.assetlink.models.dto;

import org.assetlink.models.enums.MatchType;

import java.util.List;

public record AssetDTO(
        int key,
        String id,
        String mac,
        String formattedMac,
        String hostname,
        String ip,
        String manufacturer,
        MatchType matchType,
        boolean synced,
        List<String> sources,
        int sourceCount
) {
}
