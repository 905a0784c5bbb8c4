package org.assetlink.service;

import org.assetlink.models.domain.NormalizedAsset;
import org.assetlink.models.enums.CardinalityMode;
import org.assetlink.service.resolution.IdentityResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assetlink.TestSources.row;
import static org.assetlink.TestSources.source;
import static org.assetlink.TestSources.sources;

/**
 * Tests for {@link AssetQuery} and {@link AssetQueryService#filter}.
 */
class AssetQueryTest {

    private List<NormalizedAsset> assets;

    @BeforeEach
    void setUp() {
        assets = IdentityResolver.resolve(sources(
                source("a",
                        row("mac", "0B:5A:A8:00:01:02", "hostname", "core-switch", "vendor", "Cisco"),
                        row("hostname", "web-01", "ip", "10.20.0.15")),
                source("b",
                        row("mac", "0b5aa8000102", "ip", "10.20.0.1"),
                        row("serial", "SN-777", "manufacturer", "Lenovo")))).assets();
    }

    @Test
    void blankTerm_matchesEverythingInOriginalOrder() {
        List<NormalizedAsset> result = AssetQueryService.filter(assets, AssetQuery.all());

        assertThat(result).containsExactlyElementsOf(assets);
    }

    @Test
    void macSearch_ignoresSeparatorsAndCase() {
        assertThat(ids(query("0B:5A:A8", Set.of(), CardinalityMode.ALL))).containsExactly("0b5aa8000102");
        assertThat(ids(query("a8-00-01", Set.of(), CardinalityMode.ALL))).containsExactly("0b5aa8000102");
    }

    @Test
    void textSearch_coversHostnameIpManufacturerAndId() {
        assertThat(ids(query("WEB", Set.of(), CardinalityMode.ALL))).containsExactly("web-01");
        assertThat(ids(query("10.20.0.1", Set.of(), CardinalityMode.ALL)))
                .containsExactly("0b5aa8000102", "web-01");
        assertThat(ids(query("cisco", Set.of(), CardinalityMode.ALL))).containsExactly("0b5aa8000102");
        assertThat(ids(query("sn-7", Set.of(), CardinalityMode.ALL))).containsExactly("SN-777");
    }

    @Test
    void sourceFilter_matchesAssetsReportedByAnySelectedSource() {
        assertThat(ids(query("", Set.of("a"), CardinalityMode.ALL))).containsExactly("0b5aa8000102", "web-01");
        assertThat(ids(query("", Set.of("b"), CardinalityMode.ALL))).containsExactly("0b5aa8000102", "SN-777");
        assertThat(ids(query("", Set.of("a", "b"), CardinalityMode.ALL))).hasSize(3);
    }

    @Test
    void cardinality_separatesSyncedFromUniqueAssets() {
        assertThat(ids(query("", Set.of(), CardinalityMode.MULTIPLE))).containsExactly("0b5aa8000102");
        assertThat(ids(query("", Set.of(), CardinalityMode.UNIQUE))).containsExactly("web-01", "SN-777");
    }

    @Test
    void predicates_areCombinedWithAnd() {
        assertThat(ids(query("10.20", Set.of("b"), CardinalityMode.UNIQUE))).isEmpty();
        assertThat(ids(query("10.20", Set.of("a"), CardinalityMode.UNIQUE))).containsExactly("web-01");
    }

    private List<String> ids(AssetQuery query) {
        return AssetQueryService.filter(assets, query).stream().map(NormalizedAsset::getId).toList();
    }

    private static AssetQuery query(String term, Set<String> sources, CardinalityMode mode) {
        return new AssetQuery(term, sources, mode);
    }
}
