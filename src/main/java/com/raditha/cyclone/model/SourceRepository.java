package com.raditha.cyclone.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * The input for one side of a comparison: source text keyed by file
 * identifier. Files are kept sorted by identifier so every traversal is
 * deterministic.
 *
 * @param id    Repository identifier used in reports
 * @param files File identifier to source text
 */
public record SourceRepository(String id, Map<String, String> files) {

    public SourceRepository {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("repository id cannot be blank");
        }
        files = files == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(files));
    }

    public int fileCount() {
        return files.size();
    }
}
