package com.raditha.cyclone.index;

import com.raditha.cyclone.model.RoleToken;
import com.raditha.cyclone.normalization.NormalizedTree;

/**
 * Computes 64-bit fingerprints of normalized trees.
 * <p>
 * Hashes are built bottom-up: a node's hash mixes its kind, its label or role
 * token, its child count and the hashes of its children in order. Swapping
 * two siblings therefore changes the fingerprint. Only stable inputs are
 * mixed (enum ordinals and character data), never identity hash codes, so a
 * fingerprint is the same in every run.
 */
public final class StructuralHasher {

    private static final long SEED = 0x9e3779b97f4a7c15L; // Golden ratio constant
    private static final long NULL_LABEL = 0x2545f4914f6cdd1dL;

    private StructuralHasher() {
    }

    /**
     * Fingerprint over kinds, structural labels and role tokens.
     */
    public static long fingerprint(NormalizedTree tree) {
        return hash(tree, false);
    }

    /**
     * Fingerprint over kinds, structural labels and the original identifier
     * and literal values. Two patterns with equal fingerprints are verbatim
     * copies exactly when their literal fingerprints are equal too.
     */
    public static long literalFingerprint(NormalizedTree tree) {
        return hash(tree, true);
    }

    private static long hash(NormalizedTree tree, boolean originalValues) {
        int n = tree.size();
        long[] hashes = new long[n];
        // children always have larger indices than their parent
        for (int node = n - 1; node >= 0; node--) {
            long h = mix(SEED, tree.kind(node).ordinal() + 1L);
            RoleToken token = tree.roleToken(node);
            if (token == null) {
                h = mix(h, hashString(tree.label(node)));
            } else if (originalValues) {
                h = mix(h, token.roleClass().ordinal());
                h = mix(h, hashString(tree.originalValue(node)));
            } else {
                h = mix(h, token.roleClass().ordinal());
                h = mix(h, token.ordinal());
            }
            int children = tree.childCount(node);
            h = mix(h, children);
            for (int k = 0; k < children; k++) {
                h = mix(h, hashes[tree.child(node, k)]);
            }
            hashes[node] = finish(h);
        }
        return hashes[0];
    }

    private static long mix(long hash, long value) {
        hash ^= value;
        hash *= 0xff51afd7ed558ccdL; // MurmurHash3 constant
        hash ^= (hash >>> 33);
        return hash;
    }

    /**
     * MurmurHash3 finalizer.
     */
    private static long finish(long h) {
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }

    private static long hashString(String s) {
        if (s == null) {
            return NULL_LABEL;
        }
        long h = SEED ^ s.length();
        for (int i = 0; i < s.length(); i++) {
            h = mix(h, s.charAt(i));
        }
        return h;
    }
}
