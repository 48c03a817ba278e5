package com.familygraph.model;

import java.util.List;

/**
 * Read-only snapshot of one node, as handed to rendering and UI collaborators.
 */
public record NodeSummary(
    int id,
    Card card,
    int parentId,
    List<Integer> childIds,
    int y,
    int x,
    List<Integer> generationIndices
) {
    public boolean hasParent() {
        return parentId >= 0;
    }
}
