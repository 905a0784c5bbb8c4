package org.assetlink.service.resolution;

import org.assetlink.models.domain.NormalizedAsset;
import org.assetlink.models.domain.Source;
import org.assetlink.models.domain.SourceDetail;
import org.assetlink.models.domain.SourceRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Single-pass identity resolution over all rows of all sources, in source order then row order.
 * <p>
 * Each row is attached to the asset reached by the first of its keys (MAC, hostname, IP, generic id)
 * already indexed, or starts a new asset. Once attached, a row only teaches its asset the
 * MAC/hostname/IP/manufacturer values the asset is still missing. Two assets that already exist are
 * never merged, even when a later row carries keys of both; see {@link TransitiveIdentityResolver}
 * for the variant that does merge them.
 */
public final class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private static final List<FieldType> KEY_PRIORITY =
            List.of(FieldType.MAC, FieldType.HOSTNAME, FieldType.IP, FieldType.GENERIC_ID);

    private IdentityResolver() {
    }

    public static ResolutionResult resolve(List<Source> sources) {
        if (sources == null || sources.isEmpty()) {
            return ResolutionResult.empty();
        }
        FoldState state = new FoldState();
        for (Source source : sources) {
            for (SourceRow row : source.getRows()) {
                state.accept(source, row);
            }
        }
        return new ResolutionResult(List.copyOf(state.assets), state.consumed, state.dropped);
    }

    /**
     * Owned by one {@link #resolve(List)} call and never shared.
     */
    private static final class FoldState {

        private final List<NormalizedAsset> assets = new ArrayList<>();
        private final Map<FieldType, Map<String, Integer>> indices = new EnumMap<>(FieldType.class);
        private int consumed;
        private int dropped;

        private FoldState() {
            KEY_PRIORITY.forEach(field -> indices.put(field, new HashMap<>()));
        }

        private void accept(Source source, SourceRow row) {
            IdentityCandidates candidates = IdentityCandidates.from(row);
            if (!candidates.hasIdentity()) {
                dropped++;
                return;
            }
            consumed++;

            Integer target = lookup(candidates);
            if (target != null) {
                attach(target, source, row, candidates);
            } else {
                create(source, row, candidates);
            }
        }

        private Integer lookup(IdentityCandidates candidates) {
            for (FieldType field : KEY_PRIORITY) {
                String value = candidates.valueOf(field);
                if (value == null) {
                    continue;
                }
                Integer position = indices.get(field).get(value);
                if (position != null) {
                    log.debug("Row matched asset #{} by {} {}", position, field, value);
                    return position;
                }
            }
            return null;
        }

        private void attach(int position, Source source, SourceRow row, IdentityCandidates candidates) {
            NormalizedAsset asset = assets.get(position);
            asset.addProvenance(SourceDetail.of(source, row));
            if (asset.assignMacIfAbsent(candidates.mac())) {
                indices.get(FieldType.MAC).put(candidates.mac(), position);
            }
            if (asset.assignHostnameIfAbsent(candidates.hostname())) {
                indices.get(FieldType.HOSTNAME).put(candidates.hostname(), position);
            }
            if (asset.assignIpIfAbsent(candidates.ip())) {
                indices.get(FieldType.IP).put(candidates.ip(), position);
            }
            asset.assignManufacturerIfAbsent(candidates.manufacturer());
        }

        private void create(Source source, SourceRow row, IdentityCandidates candidates) {
            int position = assets.size();
            NormalizedAsset asset = new NormalizedAsset(
                    position,
                    candidates.primaryKey().orElseGet(() -> UUID.randomUUID().toString()));
            asset.assignMacIfAbsent(candidates.mac());
            asset.assignHostnameIfAbsent(candidates.hostname());
            asset.assignIpIfAbsent(candidates.ip());
            asset.assignManufacturerIfAbsent(candidates.manufacturer());
            asset.addProvenance(SourceDetail.of(source, row));
            assets.add(asset);

            for (FieldType field : KEY_PRIORITY) {
                String value = candidates.valueOf(field);
                if (value != null) {
                    indices.get(field).put(value, position);
                }
            }
            log.debug("Created asset #{} with id {}", position, asset.getId());
        }
    }
}
