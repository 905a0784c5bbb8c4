package org.assetlink.service.resolution;

import org.assetlink.models.domain.NormalizedAsset;
import org.assetlink.models.domain.Source;
import org.assetlink.models.domain.SourceDetail;
import org.assetlink.models.domain.SourceRow;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Opt-in resolution that links rows through any shared identity key, directly or through a chain
 * of rows, so a row carrying the keys of two clusters joins them into one asset.
 * <p>
 * Rows are grouped with a disjoint-set over row positions whose representative is always the
 * lowest position in the group. Assets are emitted in order of their first row, take their id from
 * that row, and learn field values first-writer-wins in row order.
 */
public final class TransitiveIdentityResolver {

    private static final List<FieldType> LINK_FIELDS =
            List.of(FieldType.MAC, FieldType.HOSTNAME, FieldType.IP, FieldType.GENERIC_ID);

    private TransitiveIdentityResolver() {
    }

    public static ResolutionResult resolve(List<Source> sources) {
        if (sources == null || sources.isEmpty()) {
            return ResolutionResult.empty();
        }

        List<LinkedRow> rows = new ArrayList<>();
        int dropped = 0;
        for (Source source : sources) {
            for (SourceRow row : source.getRows()) {
                IdentityCandidates candidates = IdentityCandidates.from(row);
                if (candidates.hasIdentity()) {
                    rows.add(new LinkedRow(source, row, candidates));
                } else {
                    dropped++;
                }
            }
        }

        int[] parent = new int[rows.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }

        Map<FieldType, Map<String, Integer>> firstSeen = new EnumMap<>(FieldType.class);
        LINK_FIELDS.forEach(field -> firstSeen.put(field, new HashMap<>()));
        for (int i = 0; i < rows.size(); i++) {
            IdentityCandidates candidates = rows.get(i).candidates();
            for (FieldType field : LINK_FIELDS) {
                String value = candidates.valueOf(field);
                if (value == null) {
                    continue;
                }
                Integer previous = firstSeen.get(field).putIfAbsent(value, i);
                if (previous != null) {
                    union(parent, previous, i);
                }
            }
        }

        Map<Integer, NormalizedAsset> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            LinkedRow linked = rows.get(i);
            NormalizedAsset asset = byRoot.computeIfAbsent(find(parent, i), root -> new NormalizedAsset(
                    byRoot.size(),
                    rows.get(root).candidates().primaryKey().orElseGet(() -> UUID.randomUUID().toString())));
            IdentityCandidates candidates = linked.candidates();
            asset.assignMacIfAbsent(candidates.mac());
            asset.assignHostnameIfAbsent(candidates.hostname());
            asset.assignIpIfAbsent(candidates.ip());
            asset.assignManufacturerIfAbsent(candidates.manufacturer());
            asset.addProvenance(SourceDetail.of(linked.source(), linked.row()));
        }

        return new ResolutionResult(List.copyOf(byRoot.values()), rows.size(), dropped);
    }

    private static int find(int[] parent, int node) {
        int root = node;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[node] != root) {
            int next = parent[node];
            parent[node] = root;
            node = next;
        }
        return root;
    }

    private static void union(int[] parent, int left, int right) {
        int leftRoot = find(parent, left);
        int rightRoot = find(parent, right);
        if (leftRoot == rightRoot) {
            return;
        }
        if (leftRoot < rightRoot) {
            parent[rightRoot] = leftRoot;
        } else {
            parent[leftRoot] = rightRoot;
        }
    }

    private record LinkedRow(Source source, SourceRow row, IdentityCandidates candidates) {
    }
}
