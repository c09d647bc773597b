package com.raditha.cyclone.model;

/**
 * One step of an edit script turning a pattern of A into a pattern of B.
 *
 * @param type      kind of edit
 * @param fromLabel node of A, null for insertions
 * @param toLabel   node of B, null for deletions
 * @param lineA     source line of the node in A, 0 if none
 * @param lineB     source line of the node in B, 0 if none
 */
public record EditOperation(Type type, String fromLabel, String toLabel, int lineA, int lineB) {

    public enum Type {
        INSERT,
        DELETE,
        RELABEL
    }

    public static EditOperation insert(String label, int lineB) {
        return new EditOperation(Type.INSERT, null, label, 0, lineB);
    }

    public static EditOperation delete(String label, int lineA) {
        return new EditOperation(Type.DELETE, label, null, lineA, 0);
    }

    public static EditOperation relabel(String from, String to, int lineA, int lineB) {
        return new EditOperation(Type.RELABEL, from, to, lineA, lineB);
    }

    public String toDisplayString() {
        return switch (type) {
            case INSERT -> "insert " + toLabel + " (B:" + lineB + ")";
            case DELETE -> "delete " + fromLabel + " (A:" + lineA + ")";
            case RELABEL -> "relabel " + fromLabel + " -> " + toLabel + " (A:" + lineA + ", B:" + lineB + ")";
        };
    }
}
