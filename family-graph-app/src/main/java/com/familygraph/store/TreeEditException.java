package com.familygraph.store;

import com.familygraph.model.TreeEdit;

/**
 * A structural edit that would break a tree invariant. The store is left as it was
 * before the offending edit.
 */
public class TreeEditException extends RuntimeException {

    public enum Violation {
        DUPLICATE_ID,
        DUPLICATE_RELATION,
        MISSING_RELATION,
        ALREADY_PARENTED,
        LAYER_ADJACENCY,
        LAYER_RANGE,
        LAYER_NOT_EMPTY,
        STALE_NODE,
        DANGLING_RELATION,
        POSITION_MISMATCH,
        STALE_VALUE,
        UNKNOWN_DEFINITION,
        CROSSED_FAMILIES
    }

    private final Violation violation;
    private final TreeEdit edit;

    public TreeEditException(Violation violation, TreeEdit edit, String message) {
        super(edit != null ? message + " (" + edit.describe() + ")" : message);
        this.violation = violation;
        this.edit = edit;
    }

    public Violation getViolation() { return violation; }

    /** The rejected edit, or {@code null} when a builder refused before producing one. */
    public TreeEdit getEdit() { return edit; }
}
