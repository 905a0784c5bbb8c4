package org.assetlink.service.resolution;

import org.assetlink.models.domain.NormalizedAsset;
import org.assetlink.models.domain.Source;
import org.assetlink.models.domain.SourceDetail;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assetlink.TestSources.row;
import static org.assetlink.TestSources.source;
import static org.assetlink.TestSources.sources;

/**
 * Tests for {@link IdentityResolver}.
 */
class IdentityResolverTest {

    @Test
    void resolve_noSources_yieldsNoAssets() {
        ResolutionResult result = IdentityResolver.resolve(List.of());

        assertThat(result.assets()).isEmpty();
        assertThat(result.rowsConsumed()).isZero();
    }

    @Test
    void resolve_sameMacInDifferentFormats_convergesToOneAsset() {
        Source a = source("a", row("MAC", "AA:BB:CC:DD:EE:FF", "Hostname", "srv1"));
        Source b = source("b", row("Physical Address", "aabb.ccdd.eeff", "IP", "10.0.0.9"));

        ResolutionResult result = IdentityResolver.resolve(sources(a, b));

        assertThat(result.assets()).hasSize(1);
        NormalizedAsset asset = result.assets().get(0);
        assertThat(asset.getId()).isEqualTo("aabbccddeeff");
        assertThat(asset.getSources()).containsExactly("a", "b");
        assertThat(asset.getSourceDetails()).hasSize(2);
        assertThat(asset.getIp()).isEqualTo("10.0.0.9");
        assertThat(asset.isSynced()).isTrue();
    }

    @Test
    void resolve_hostnameLearnedByMacAsset_linksLaterHostnameOnlyRow() {
        Source a = source("a", row("MAC", "AA:BB:CC:DD:EE:01", "Host", "srv1"));
        Source b = source("b", row("Hostname", "srv1", "IP", "10.0.0.5"));

        ResolutionResult result = IdentityResolver.resolve(sources(a, b));

        assertThat(result.assets()).hasSize(1);
        NormalizedAsset asset = result.assets().get(0);
        assertThat(asset.getSources()).hasSize(2);
        assertThat(asset.getMac()).isEqualTo("aabbccddee01");
        assertThat(asset.getHostname()).isEqualTo("srv1");
        assertThat(asset.getIp()).isEqualTo("10.0.0.5");
    }

    @Test
    void resolve_fieldValues_areFirstWriterWins() {
        Source a = source("a",
                row("mac", "aa:bb:cc:00:00:01"),
                row("mac", "aa:bb:cc:00:00:01", "hostname", "first-name", "vendor", "Dell"),
                row("mac", "aa:bb:cc:00:00:01", "hostname", "second-name", "vendor", "HP"));

        ResolutionResult result = IdentityResolver.resolve(sources(a));

        assertThat(result.assets()).hasSize(1);
        NormalizedAsset asset = result.assets().get(0);
        assertThat(asset.getHostname()).isEqualTo("first-name");
        assertThat(asset.getManufacturer()).isEqualTo("Dell");
        assertThat(asset.getSources()).containsExactly("a");
        assertThat(asset.getSourceDetails()).hasSize(3);
    }

    @Test
    void resolve_ignoredLaterValue_isNotRegisteredAsKey() {
        Source a = source("a",
                row("mac", "aa:bb:cc:00:00:01", "hostname", "kept"),
                row("mac", "aa:bb:cc:00:00:01", "hostname", "ignored"),
                row("hostname", "ignored"));

        ResolutionResult result = IdentityResolver.resolve(sources(a));

        assertThat(result.assets()).extracting(NormalizedAsset::getId)
                .containsExactly("aabbcc000001", "ignored");
    }

    @Test
    void resolve_macMatchTakesPriority_andDistinctClustersAreNotMerged() {
        Source a = source("a",
                row("mac", "aa:bb:cc:00:00:01"),
                row("hostname", "h1"));
        Source b = source("b", row("mac", "aa:bb:cc:00:00:01", "hostname", "h1"));

        ResolutionResult result = IdentityResolver.resolve(sources(a, b));

        assertThat(result.assets()).hasSize(2);
        NormalizedAsset macAsset = result.assets().get(0);
        NormalizedAsset hostAsset = result.assets().get(1);
        assertThat(macAsset.getSources()).containsExactly("a", "b");
        assertThat(macAsset.getHostname()).isEqualTo("h1");
        assertThat(hostAsset.getSources()).containsExactly("a");
        assertThat(hostAsset.getSourceDetails()).hasSize(1);
    }

    @Test
    void resolve_learnedKey_pointsAtLearningAsset_forLaterRows() {
        Source a = source("a",
                row("mac", "aa:bb:cc:00:00:01"),
                row("hostname", "h1"),
                row("mac", "aa:bb:cc:00:00:01", "hostname", "h1"),
                row("hostname", "h1", "ip", "10.1.1.1"));

        ResolutionResult result = IdentityResolver.resolve(sources(a));

        assertThat(result.assets()).hasSize(2);
        assertThat(result.assets().get(0).getSourceDetails()).hasSize(3);
        assertThat(result.assets().get(0).getIp()).isEqualTo("10.1.1.1");
        assertThat(result.assets().get(1).getSourceDetails()).hasSize(1);
    }

    @Test
    void resolve_rowWithoutIdentity_isDroppedEverywhere() {
        Source a = source("a",
                row("Location", "Rack 1", "mac", "00:00:00:00:00:00", "hostname", "unknown", "ip", "127.0.0.1"),
                row("hostname", "srv1"));

        ResolutionResult result = IdentityResolver.resolve(sources(a));

        assertThat(result.rowsDropped()).isEqualTo(1);
        assertThat(result.rowsConsumed()).isEqualTo(1);
        assertThat(result.assets()).hasSize(1);
        assertThat(result.assets().get(0).getSourceDetails())
                .extracting(detail -> detail.row().get("hostname").asText())
                .containsExactly("srv1");
    }

    @Test
    void resolve_idFollowsKeyPriority() {
        Source a = source("a",
                row("ip", "10.0.0.1", "hostname", "web", "mac", "aa:bb:cc:00:00:09", "id", "X1"),
                row("ip", "10.0.0.2", "serial", "X2"),
                row("Asset Tag", "X3"));

        ResolutionResult result = IdentityResolver.resolve(sources(a));

        assertThat(result.assets()).extracting(NormalizedAsset::getId)
                .containsExactly("aabbcc000009", "10.0.0.2", "X3");
    }

    @Test
    void resolve_genericIdLinksRowsWithoutNetworkFields() {
        Source a = source("a", row("Serial Number", "SN-1", "Vendor", "Lenovo"));
        Source b = source("b", row("serial", "SN-1", "Computer Name", "LAPTOP-7"));
        Source c = source("c", row("hostname", "laptop-7"));

        ResolutionResult result = IdentityResolver.resolve(sources(a, b, c));

        assertThat(result.assets()).hasSize(1);
        NormalizedAsset asset = result.assets().get(0);
        assertThat(asset.getId()).isEqualTo("SN-1");
        assertThat(asset.getHostname()).isEqualTo("laptop-7");
        assertThat(asset.getManufacturer()).isEqualTo("Lenovo");
        assertThat(asset.getSources()).containsExactly("a", "b", "c");
    }

    @Test
    void resolve_sourceContributingSeveralRows_isCountedOnce() {
        Source a = source("a",
                row("mac", "aa:bb:cc:00:00:01"),
                row("mac", "AA-BB-CC-00-00-01"));

        NormalizedAsset asset = IdentityResolver.resolve(sources(a)).assets().get(0);

        assertThat(asset.getSources()).containsExactly("a");
        assertThat(asset.getSourceDetails()).hasSize(2);
        assertThat(asset.isSynced()).isFalse();
    }

    @Test
    void resolve_provenanceCarriesSourceMetadataAndRawRow() {
        Source a = source("a", "Scanner", row("MAC", "AA:BB:CC:DD:EE:01", "Notes", "core switch"));

        SourceDetail detail = IdentityResolver.resolve(sources(a)).assets().get(0).getSourceDetails().get(0);

        assertThat(detail.sourceId()).isEqualTo("a");
        assertThat(detail.sourceLabel()).isEqualTo("Scanner");
        assertThat(detail.sourceColor()).isEqualTo("#0B5AA8");
        assertThat(detail.row().toRawMap())
                .containsEntry("MAC", "AA:BB:CC:DD:EE:01")
                .containsEntry("Notes", "core switch");
    }

    @Test
    void resolve_sameInputTwice_isDeterministic() {
        List<Source> input = sources(
                source("a", row("mac", "aa:bb:cc:00:00:01", "hostname", "h1"), row("ip", "10.0.0.7")),
                source("b", row("hostname", "h1"), row("hostname", "h2", "ip", "10.0.0.7")),
                source("c", row("id", "T-1"), row("mac", "aa:bb:cc:00:00:02")));

        ResolutionResult first = IdentityResolver.resolve(input);
        ResolutionResult second = IdentityResolver.resolve(input);

        assertThat(second.assets()).extracting(NormalizedAsset::getId)
                .containsExactlyElementsOf(first.assets().stream().map(NormalizedAsset::getId).toList());
        for (int i = 0; i < first.assets().size(); i++) {
            assertThat(second.assets().get(i).getSourceDetails())
                    .containsExactlyElementsOf(first.assets().get(i).getSourceDetails());
        }
    }

    @Test
    void resolve_sameValueAsIpAndAsSerial_yieldsTwoAssetsWithDistinctKeys() {
        Source a = source("a",
                row("IP", "10.0.0.1", "Vendor", "Dell"),
                row("Serial", "10.0.0.1", "Vendor", "HP"));

        List<NormalizedAsset> assets = IdentityResolver.resolve(sources(a)).assets();

        assertThat(assets).extracting(NormalizedAsset::getId).containsExactly("10.0.0.1", "10.0.0.1");
        assertThat(assets).extracting(NormalizedAsset::getKey).containsExactly(0, 1);
        assertThat(assets).extracting(NormalizedAsset::getManufacturer).containsExactly("Dell", "HP");
    }

    @Test
    void resolve_integralJsonNumberLinksWithCsvText() {
        Source json = source("json", row("Serial", 1042.0, "Vendor", "Lenovo"));
        Source csv = source("csv", row("Asset Tag", "1042", "Hostname", "laptop-9"));

        List<NormalizedAsset> assets = IdentityResolver.resolve(sources(json, csv)).assets();

        assertThat(assets).singleElement().satisfies(asset -> {
            assertThat(asset.getId()).isEqualTo("1042");
            assertThat(asset.getSources()).containsExactly("json", "csv");
        });
    }
}
