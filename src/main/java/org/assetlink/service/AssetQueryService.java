package org.assetlink.service;

import lombok.RequiredArgsConstructor;
import org.assetlink.models.domain.NormalizedAsset;
import org.assetlink.models.domain.Source;
import org.assetlink.models.dto.AssetSummaryDTO;
import org.assetlink.models.dto.SourceCoverageDTO;
import org.assetlink.service.resolution.ResolutionResult;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side over the resolved assets: filtering, lookup and summary statistics.
 */
@Service
@RequiredArgsConstructor
public class AssetQueryService {

    private final AssetResolutionService resolutionService;
    private final SourceRegistry sourceRegistry;

    public List<NormalizedAsset> search(AssetQuery query) {
        return filter(resolutionService.currentAssets(), query);
    }

    /**
     * Looks an asset up by its key. Ids are not unique across assets, keys are.
     */
    public Optional<NormalizedAsset> findByKey(int key) {
        List<NormalizedAsset> assets = resolutionService.currentAssets();
        if (key < 0 || key >= assets.size()) {
            return Optional.empty();
        }
        return Optional.of(assets.get(key));
    }

    public AssetSummaryDTO summarize() {
        ResolutionResult result = resolutionService.current();
        List<NormalizedAsset> assets = result.assets();
        long synced = assets.stream().filter(NormalizedAsset::isSynced).count();

        List<SourceCoverageDTO> coverage = sourceRegistry.list().stream()
                .map(source -> coverageOf(source, assets))
                .toList();

        return new AssetSummaryDTO(
                assets.size(),
                synced,
                assets.size() - synced,
                result.rowsConsumed(),
                result.rowsDropped(),
                resolutionService.getMode(),
                coverage
        );
    }

    /**
     * Keeps the original order of {@code assets}.
     */
    public static List<NormalizedAsset> filter(List<NormalizedAsset> assets, AssetQuery query) {
        AssetQuery effective = query == null ? AssetQuery.all() : query;
        return assets.stream().filter(effective::matches).toList();
    }

    private static SourceCoverageDTO coverageOf(Source source, List<NormalizedAsset> assets) {
        long count = assets.stream()
                .filter(asset -> asset.getSources().contains(source.getId()))
                .count();
        double share = assets.isEmpty() ? 0.0 : (double) count / assets.size();
        return new SourceCoverageDTO(source.getId(), source.getLabel(), source.getColor(), count, share);
    }
}
