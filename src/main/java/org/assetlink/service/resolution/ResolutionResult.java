package org.assetlink.service.resolution;

import org.assetlink.models.domain.NormalizedAsset;

import java.util.List;

public record ResolutionResult(
        List<NormalizedAsset> assets,
        int rowsConsumed,
        int rowsDropped
) {

    public static ResolutionResult empty() {
        return new ResolutionResult(List.of(), 0, 0);
    }
}
