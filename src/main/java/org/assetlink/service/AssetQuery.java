package org.assetlink.service;

import org.assetlink.models.domain.NormalizedAsset;
import org.assetlink.models.enums.CardinalityMode;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Filter over resolved assets. The text, source and cardinality predicates are ANDed.
 * <p>
 * The source predicate passes when no sources are selected or the asset was reported by any of them.
 */
public record AssetQuery(
        String term,
        Set<String> sourceIds,
        CardinalityMode mode
) {

    private static final Pattern MAC_SEPARATORS = Pattern.compile("[:\\-.]");

    public AssetQuery {
        term = term == null ? "" : term;
        sourceIds = sourceIds == null ? Set.of() : Set.copyOf(sourceIds);
        mode = mode == null ? CardinalityMode.ALL : mode;
    }

    public static AssetQuery all() {
        return new AssetQuery("", Set.of(), CardinalityMode.ALL);
    }

    public boolean matches(NormalizedAsset asset) {
        return matchesText(asset) && matchesSource(asset) && mode.matches(asset.getSources().size());
    }

    private boolean matchesText(NormalizedAsset asset) {
        if (term.isEmpty()) {
            return true;
        }
        String lowerTerm = term.toLowerCase(Locale.ROOT).trim();
        String macTerm = MAC_SEPARATORS.matcher(term).replaceAll("").toLowerCase(Locale.ROOT).trim();
        return contains(asset.getMac(), macTerm)
                || contains(asset.getHostname(), lowerTerm)
                || contains(asset.getIp(), lowerTerm)
                || contains(asset.getManufacturer(), lowerTerm)
                || contains(asset.getId(), lowerTerm);
    }

    private boolean matchesSource(NormalizedAsset asset) {
        return sourceIds.isEmpty() || sourceIds.stream().anyMatch(asset.getSources()::contains);
    }

    private static boolean contains(String value, String lowerTerm) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(lowerTerm);
    }
}
