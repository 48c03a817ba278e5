package com.familygraph.service;

import com.familygraph.store.NodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Horizontal drawing coordinates for every node of a forest.
 *
 * A Reingold-Tilford style contour packing, generalized to a forest of layers: subtrees
 * are built bottom-up one layer at a time, a parent sits at the mean of its children, and
 * each subtree is pushed right until its left contour clears the right contour of its
 * left neighbour. Siblings are 1 unit apart, nodes of different parents (or two roots)
 * 1.5 units. Passes repeat until no adjacent pair in any layer is too close.
 *
 * A parent's mean is snapped to a 1/65536 grid. Every seed, spacing and shift is then a
 * multiple of that grid, so contour sums and the final spacing check are exact.
 *
 * The store is only read. Converting coordinates to pixels is up to the renderer.
 */
@Service
public class TreeLayoutService {

    private static final Logger log = LoggerFactory.getLogger(TreeLayoutService.class);

    public static final double SIBLING_SPACING = 1.0;
    public static final double SUBTREE_SPACING = 1.5;

    static final double GRID = 1 << 16;

    private final int maxPasses;

    public TreeLayoutService(@Value("${familygraph.layout.max-passes:100}") int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1, got " + maxPasses);
        }
        this.maxPasses = maxPasses;
    }

    /**
     * Compute the x coordinate of every node, keyed by id in layer-major order.
     *
     * @param store the forest to lay out
     * @return id to x, empty when the store has no layers
     */
    public Map<Integer, Double> computeCoordinates(NodeStore store) {
        Map<Integer, Double> xs = new LinkedHashMap<>();
        if (store.layerCount() == 0) {
            return xs;
        }

        Map<Integer, Cell> cells = new HashMap<>();
        for (int id : store.ids()) {
            cells.put(id, new Cell());
        }
        List<Integer> deepest = store.layer(store.layerCount() - 1);
        for (int x = 0; x < deepest.size(); x++) {
            cells.get(deepest.get(x)).x = x + 0.5;
        }

        int passes = 0;
        do {
            pack(store, cells);
            passes++;
        } while (passes < maxPasses && hasOverlap(store, cells));

        if (hasOverlap(store, cells)) {
            log.warn("Layout still overlapping after {} passes ({} nodes, {} layers)",
                passes, store.size(), store.layerCount());
        } else {
            log.debug("Layout settled after {} passes", passes);
        }

        for (int id : store.ids()) {
            xs.put(id, cells.get(id).x);
        }
        return xs;
    }

    /** One full pass: contours and shifts bottom-up, then shifts pushed top-down. */
    private void pack(NodeStore store, Map<Integer, Cell> cells) {
        for (int y = store.layerCount() - 1; y >= 0; y--) {
            List<Integer> layer = store.layer(y);
            for (int id : layer) {
                Cell cell = cells.get(id);
                List<Integer> childIds = store.childIds(id);
                if (!childIds.isEmpty()) {
                    double sum = 0;
                    for (int childId : childIds) {
                        Cell child = cells.get(childId);
                        sum += child.x + child.shift;
                    }
                    cell.x = snapToGrid(sum / childIds.size());
                }
                updateContour(cell, childIds, cells);
            }
            for (int i = 1; i < layer.size(); i++) {
                compareAndShift(store, layer.get(i - 1), layer.get(i), cells);
            }
        }

        for (int y = 0; y < store.layerCount(); y++) {
            for (int id : store.layer(y)) {
                Cell cell = cells.get(id);
                cell.x += cell.shift;
                for (int childId : store.childIds(id)) {
                    cells.get(childId).shift += cell.shift;
                }
                cell.shift = 0;
            }
        }
    }

    /**
     * Splice a node's contours from its extreme children: own x, then the outer child's
     * contour, then whatever the inner child's contour has beyond it.
     */
    private void updateContour(Cell cell, List<Integer> childIds, Map<Integer, Cell> cells) {
        if (childIds.isEmpty()) {
            cell.left = new double[] {cell.x};
            cell.right = new double[] {cell.x};
            return;
        }
        Cell first = cells.get(childIds.get(0));
        Cell last = cells.get(childIds.get(childIds.size() - 1));
        cell.left = splice(cell.x, first.left, last.left);
        cell.right = splice(cell.x, last.right, first.right);
    }

    private double[] splice(double head, double[] outer, double[] inner) {
        int length = 1 + Math.max(outer.length, inner.length);
        double[] contour = new double[length];
        contour[0] = head;
        System.arraycopy(outer, 0, contour, 1, outer.length);
        if (inner.length > outer.length) {
            System.arraycopy(inner, outer.length, contour, 1 + outer.length, inner.length - outer.length);
        }
        return contour;
    }

    private void compareAndShift(NodeStore store, int leftId, int rightId, Map<Integer, Cell> cells) {
        Cell left = cells.get(leftId);
        Cell right = cells.get(rightId);
        double spacing = requiredSpacing(store, leftId, rightId);
        int depth = Math.min(left.right.length, right.left.length);
        double minGap = Double.POSITIVE_INFINITY;
        for (int i = 0; i < depth; i++) {
            minGap = Math.min(minGap, right.left[i] - left.right[i]);
        }
        right.shift = minGap < spacing ? spacing - minGap : 0;
        if (right.shift != 0) {
            for (int i = 0; i < right.left.length; i++) {
                right.left[i] += right.shift;
            }
            for (int i = 0; i < right.right.length; i++) {
                right.right[i] += right.shift;
            }
        }
    }

    private boolean hasOverlap(NodeStore store, Map<Integer, Cell> cells) {
        for (int y = 0; y < store.layerCount(); y++) {
            List<Integer> layer = store.layer(y);
            for (int i = 1; i < layer.size(); i++) {
                int leftId = layer.get(i - 1);
                int rightId = layer.get(i);
                if (cells.get(leftId).x > cells.get(rightId).x - requiredSpacing(store, leftId, rightId)) {
                    return true;
                }
            }
        }
        return false;
    }

    static double snapToGrid(double x) {
        return Math.round(x * GRID) / GRID;
    }

    static double requiredSpacing(NodeStore store, int leftId, int rightId) {
        int leftParent = store.parentId(leftId);
        return leftParent >= 0 && leftParent == store.parentId(rightId) ? SIBLING_SPACING : SUBTREE_SPACING;
    }

    /** Per-node working state: x, pending shift for the subtree, left and right contours. */
    private static class Cell {
        double x;
        double shift;
        double[] left = new double[0];
        double[] right = new double[0];
    }
}
