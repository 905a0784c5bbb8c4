package org.assetlink.models.domain;

import lombok.Getter;
import org.assetlink.models.enums.MatchType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A physical asset inferred from one or more source rows.
 * <p>
 * The identity attributes are write-once: the first row that supplies a value wins and later
 * values are ignored. Instances are only mutated by the resolution pass that created them.
 */
@Getter
public class NormalizedAsset {

    private final int key;
    private final String id;
    private String mac;
    private String hostname;
    private String ip;
    private String manufacturer;

    private final Set<String> sources = new LinkedHashSet<>();
    private final List<SourceDetail> sourceDetails = new ArrayList<>();

    /**
     * @param key position of the asset in its resolution result, unique within that result
     * @param id  display identifier taken from the creating row; several assets may share it
     */
    public NormalizedAsset(int key, String id) {
        this.key = key;
        this.id = id;
    }

    public boolean assignMacIfAbsent(String value) {
        if (mac != null || value == null) {
            return false;
        }
        mac = value;
        return true;
    }

    public boolean assignHostnameIfAbsent(String value) {
        if (hostname != null || value == null) {
            return false;
        }
        hostname = value;
        return true;
    }

    public boolean assignIpIfAbsent(String value) {
        if (ip != null || value == null) {
            return false;
        }
        ip = value;
        return true;
    }

    public boolean assignManufacturerIfAbsent(String value) {
        if (manufacturer != null || value == null) {
            return false;
        }
        manufacturer = value;
        return true;
    }

    public void addProvenance(SourceDetail detail) {
        sources.add(detail.sourceId());
        sourceDetails.add(detail);
    }

    public Set<String> getSources() {
        return Collections.unmodifiableSet(sources);
    }

    public List<SourceDetail> getSourceDetails() {
        return Collections.unmodifiableList(sourceDetails);
    }

    public boolean isSynced() {
        return sources.size() > 1;
    }

    public Optional<MatchType> matchType() {
        if (mac != null) {
            return Optional.of(MatchType.MAC);
        }
        if (hostname != null) {
            return Optional.of(MatchType.HOSTNAME);
        }
        if (ip != null) {
            return Optional.of(MatchType.IP);
        }
        return Optional.empty();
    }
}
