package com.raditha.cyclone.model;

/**
 * A pattern left out of matching because it exceeded a resource guard.
 *
 * @param repositoryId Repository containing the pattern
 * @param span         Anchor span of the pattern
 * @param size         Node count of the pattern
 * @param reason       Which guard was hit
 */
public record UnmatchedPattern(
        String repositoryId,
        SourceSpan span,
        int size,
        String reason) {
}
