package org.assetlink.service;

import lombok.extern.slf4j.Slf4j;
import org.assetlink.models.domain.Source;
import org.assetlink.models.domain.SourceRow;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The sources loaded into the running workspace, in import order. Nothing is persisted.
 * <p>
 * Every change bumps {@link #revision()} so resolved assets can be rebuilt from scratch.
 */
@Slf4j
@Service
public class SourceRegistry {

    public static final List<String> PALETTE = List.of(
            "#0B5AA8",
            "#40A7DB",
            "emerald-600",
            "amber-600",
            "rose-600",
            "indigo-600",
            "cyan-600",
            "orange-600",
            "teal-600",
            "violet-600"
    );

    private final int maxSources;
    private final List<Source> sources = new ArrayList<>();
    private long revision;

    public SourceRegistry(@Value("${assetlink.sources.max-sources:10}") int maxSources) {
        if (maxSources < 1) {
            throw new IllegalArgumentException("assetlink.sources.max-sources must be positive");
        }
        this.maxSources = maxSources;
    }

    public synchronized List<Source> list() {
        return List.copyOf(sources);
    }

    public synchronized long revision() {
        return revision;
    }

    public synchronized int remainingCapacity() {
        return maxSources - sources.size();
    }

    public synchronized Source get(String id) {
        return sources.stream()
                .filter(source -> source.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new SourceNotFoundException(id));
    }

    /**
     * Appends a source. The colour cycles through {@link #PALETTE} by the source's position at import time.
     *
     * @throws IllegalStateException when the registry already holds the maximum number of sources
     */
    public synchronized Source register(String label, String fileName, List<String> headers, List<SourceRow> rows) {
        if (sources.size() >= maxSources) {
            throw new IllegalStateException("Source limit of " + maxSources + " reached");
        }
        String resolvedLabel = StringUtils.hasText(label) ? label.trim() : defaultLabel(fileName);
        Source source = new Source(
                newId(),
                resolvedLabel,
                fileName,
                headers,
                rows,
                PALETTE.get(sources.size() % PALETTE.size())
        );
        sources.add(source);
        revision++;
        log.info("Registered source {} '{}' from {} with {} rows", source.getId(), resolvedLabel, fileName, rows.size());
        return source;
    }

    public synchronized Source relabel(String id, String label) {
        if (!StringUtils.hasText(label)) {
            throw new IllegalArgumentException("Label must not be blank");
        }
        Source source = get(id);
        source.setLabel(label.trim());
        revision++;
        return source;
    }

    public synchronized void remove(String id) {
        boolean removed = sources.removeIf(source -> source.getId().equals(id));
        if (!removed) {
            throw new SourceNotFoundException(id);
        }
        revision++;
        log.info("Removed source {}", id);
    }

    public synchronized void clear() {
        sources.clear();
        revision++;
    }

    public static String defaultLabel(String fileName) {
        if (!StringUtils.hasText(fileName)) {
            return "source";
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 9);
    }
}
