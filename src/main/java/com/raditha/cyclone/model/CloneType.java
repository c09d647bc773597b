package com.raditha.cyclone.model;

/**
 * Classification of a clone.
 * Constants are declared from strongest to weakest so that the ordinal grows
 * with weakness.
 */
public enum CloneType {
    /** Verbatim copy; only whitespace, comments or redundant grouping differ. */
    TYPE1,

    /** Identifiers and/or literals renamed, structure identical. */
    TYPE2,

    /** Near-miss copy with inserted, deleted, relabelled or reordered nodes. */
    TYPE3;

    /**
     * The weaker of two clone types.
     */
    public static CloneType weakest(CloneType a, CloneType b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * The stronger of two clone types.
     */
    public static CloneType strongest(CloneType a, CloneType b) {
        return a.ordinal() <= b.ordinal() ? a : b;
    }

    /**
     * Short label for reports ("Type 1" ...).
     */
    public String displayName() {
        return "Type " + (ordinal() + 1);
    }
}
