package com.raditha.cyclone.extraction;

import com.raditha.cyclone.model.Pattern;
import com.raditha.cyclone.model.UnmatchedPattern;

import java.util.List;

/**
 * Patterns extracted from one file, plus the ones rejected by the size guard.
 *
 * @param patterns  patterns in anchor pre-order
 * @param unmatched patterns too large to index
 */
public record ExtractionResult(List<Pattern> patterns, List<UnmatchedPattern> unmatched) {

    public ExtractionResult {
        patterns = List.copyOf(patterns);
        unmatched = List.copyOf(unmatched);
    }
}
