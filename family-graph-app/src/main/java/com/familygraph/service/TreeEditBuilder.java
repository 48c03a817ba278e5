package com.familygraph.service;

import com.familygraph.model.Card;
import com.familygraph.model.NodePosition;
import com.familygraph.model.TreeEdit;
import com.familygraph.model.TreeEdit.DeleteLayer;
import com.familygraph.model.TreeEdit.DeleteRightmostNode;
import com.familygraph.model.TreeEdit.ModifyCard;
import com.familygraph.model.TreeEdit.ModifyGenerationIndex;
import com.familygraph.model.TreeEdit.MoveNode;
import com.familygraph.model.TreeEdit.NewLayer;
import com.familygraph.model.TreeEdit.NewRightmostNode;
import com.familygraph.model.TreeEdit.SetAsChild;
import com.familygraph.model.TreeEdit.UnsetAsChild;
import com.familygraph.store.NodeStore;
import com.familygraph.store.TreeEditException;
import com.familygraph.store.TreeEditException.Violation;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the atomic edit sequences behind each user-level operation.
 *
 * Builders read the current store and return edits without applying them. New nodes are
 * always appended at the right end of their layer and then moved into place, and removed
 * nodes are first moved to the right end, so every edit stays a simple invertible step.
 * The only store state touched here is the id counter.
 */
@Service
public class TreeEditBuilder {

    // ========== INSERTION ==========

    /**
     * New node in layer {@code y}. {@code -1} and {@code layerCount} open a new layer above
     * or below the existing ones.
     */
    public List<TreeEdit> insertNodeAtLayer(NodeStore store, int y, Card card) {
        int layerCount = store.layerCount();
        if (y < -1 || y > layerCount) {
            throw new IllegalArgumentException("Invalid layer " + y + ", valid range: [-1, " + layerCount + "]");
        }
        List<TreeEdit> edits = new ArrayList<>();
        int targetY = y;
        if (y == -1) {
            targetY = 0;
            edits.add(new NewLayer(0));
        } else if (y == layerCount) {
            edits.add(new NewLayer(layerCount));
        }
        edits.add(new NewRightmostNode(targetY, store.obtainId(), card));
        return edits;
    }

    /** New node as the last child of {@code parentId}. */
    public List<TreeEdit> insertChild(NodeStore store, int parentId, Card card) {
        NodePosition parentPos = store.position(parentId);
        int childY = parentPos.y() + 1;
        List<TreeEdit> edits = new ArrayList<>();
        int appendX;
        if (childY == store.layerCount()) {
            edits.add(new NewLayer(childY));
            appendX = 0;
        } else {
            appendX = store.layerSize(childY);
        }
        int id = store.obtainId();
        edits.add(new NewRightmostNode(childY, id, card));
        edits.add(new MoveNode(id, appendX, newChildX(store, parentId)));
        edits.add(new SetAsChild(parentId, id));
        return edits;
    }

    /** New node as the parent of the parentless node {@code childId}. */
    public List<TreeEdit> insertParent(NodeStore store, int childId, Card card) {
        requireParentless(store, childId);
        NodePosition childPos = store.position(childId);
        List<TreeEdit> edits = new ArrayList<>();
        int parentY;
        int appendX;
        int targetX;
        if (childPos.y() == 0) {
            edits.add(new NewLayer(0));
            parentY = 0;
            appendX = 0;
            targetX = 0;
        } else {
            parentY = childPos.y() - 1;
            appendX = store.layerSize(parentY);
            targetX = newParentX(store, childId);
        }
        int id = store.obtainId();
        edits.add(new NewRightmostNode(parentY, id, card));
        edits.add(new MoveNode(id, appendX, targetX));
        edits.add(new SetAsChild(id, childId));
        return edits;
    }

    /**
     * Make the existing parentless node {@code childId} the last child of {@code parentId},
     * relocating it by the same placement policy as a newly inserted child. A node with
     * children of its own is only linked where it already stands.
     */
    public List<TreeEdit> linkChild(NodeStore store, int parentId, int childId) {
        requireParentless(store, childId);
        NodePosition parentPos = store.position(parentId);
        NodePosition childPos = store.position(childId);
        if (childPos.y() != parentPos.y() + 1) {
            throw new TreeEditException(Violation.LAYER_ADJACENCY, null,
                "Node " + childId + " is not in the layer below node " + parentId);
        }
        // insertion slot counts the child itself; it vacates its own slot first
        int slot = newChildX(store, parentId);
        int targetX = childPos.x() < slot ? slot - 1 : slot;
        if (targetX != childPos.x() && !store.childIds(childId).isEmpty()) {
            // moving a subtree root alone would cross its children with their new neighbours
            throw new TreeEditException(Violation.CROSSED_FAMILIES, null,
                "Node " + childId + " has children and would have to move from x=" + childPos.x()
                    + " to x=" + targetX + " under node " + parentId);
        }
        List<TreeEdit> edits = new ArrayList<>();
        edits.add(new MoveNode(childId, childPos.x(), targetX));
        edits.add(new SetAsChild(parentId, childId));
        return edits;
    }

    /** Break the relation between {@code parentId} and {@code childId}, keeping positions. */
    public List<TreeEdit> unlinkChild(NodeStore store, int parentId, int childId) {
        if (store.parentId(childId) != parentId) {
            throw new TreeEditException(Violation.MISSING_RELATION, null,
                "Node " + childId + " is not a child of node " + parentId);
        }
        List<TreeEdit> edits = new ArrayList<>();
        detachFromParent(store, parentId, childId, edits);
        return edits;
    }

    // ========== REMOVAL ==========

    /**
     * Remove a node with all of its relations. Children are left parentless and layers
     * are never collapsed here; see {@link #collapseEmptyEdgeLayers(NodeStore)}.
     */
    public List<TreeEdit> deleteNode(NodeStore store, int id) {
        NodePosition position = store.position(id);
        List<TreeEdit> edits = new ArrayList<>();
        int parentId = store.parentId(id);
        if (parentId >= 0) {
            detachFromParent(store, parentId, id, edits);
        }
        List<Integer> childIds = store.childIds(id);
        for (int i = childIds.size() - 1; i >= 0; i--) {
            edits.add(new UnsetAsChild(id, childIds.get(i)));
        }
        int lastX = store.layerSize(position.y()) - 1;
        edits.add(new MoveNode(id, position.x(), lastX));
        edits.add(new DeleteRightmostNode(position.y(), id, store.card(id)));
        return edits;
    }

    /** Drop empty layers at the top and bottom of the stack. Inner empty layers stay. */
    public List<TreeEdit> collapseEmptyEdgeLayers(NodeStore store) {
        List<TreeEdit> edits = new ArrayList<>();
        int top = 0;
        int bottom = store.layerCount() - 1;
        while (bottom >= top && store.layerSize(bottom) == 0) {
            edits.add(new DeleteLayer(bottom));
            bottom--;
        }
        // deleting layer 0 repeatedly pulls the next one up to index 0
        while (top <= bottom && store.layerSize(top) == 0) {
            edits.add(new DeleteLayer(0));
            top++;
        }
        return edits;
    }

    // ========== IN-PLACE CHANGES ==========

    /**
     * Move a node to {@code newX} inside its layer. The parent's child list is re-ordered
     * afterwards so it keeps matching the left-to-right order of the children.
     */
    public List<TreeEdit> moveNode(NodeStore store, int id, int newX) {
        NodePosition position = store.position(id);
        if (newX < 0 || newX >= store.layerSize(position.y())) {
            throw new IllegalArgumentException("Invalid x " + newX + " for layer " + position.y());
        }
        List<TreeEdit> edits = new ArrayList<>();
        edits.add(new MoveNode(id, position.x(), newX));

        int parentId = store.parentId(id);
        if (parentId < 0) {
            return edits;
        }
        List<Integer> layerAfter = new ArrayList<>(store.layer(position.y()));
        layerAfter.remove(position.x());
        layerAfter.add(newX, id);
        List<Integer> current = store.childIds(parentId);
        List<Integer> wanted = new ArrayList<>(current);
        wanted.sort(Comparator.comparingInt(layerAfter::indexOf));

        int first = 0;
        while (first < current.size() && current.get(first).equals(wanted.get(first))) {
            first++;
        }
        // unset the differing tail last-first so the inverse re-appends it in its old order
        for (int i = current.size() - 1; i >= first; i--) {
            edits.add(new UnsetAsChild(parentId, current.get(i)));
        }
        for (int i = first; i < wanted.size(); i++) {
            edits.add(new SetAsChild(parentId, wanted.get(i)));
        }
        return edits;
    }

    public List<TreeEdit> setCard(NodeStore store, int id, Card card) {
        return List.of(new ModifyCard(id, store.card(id), card));
    }

    public List<TreeEdit> setGenerationIndex(NodeStore store, int id, int giIndex, int value) {
        if (!store.generationSettings().hasDefinition(giIndex)) {
            throw new TreeEditException(Violation.UNKNOWN_DEFINITION, null,
                "No generation index definition #" + giIndex);
        }
        return List.of(new ModifyGenerationIndex(id, giIndex, store.generationIndex(id, giIndex), value));
    }

    // ========== PLACEMENT POLICY ==========

    /**
     * Insertion x in the layer below {@code parentId}: right of the rightmost child of the
     * nearest node at or left of the parent that has children, else 0.
     */
    int newChildX(NodeStore store, int parentId) {
        NodePosition parentPos = store.position(parentId);
        for (int x = parentPos.x(); x >= 0; x--) {
            List<Integer> refChildIds = store.childIds(store.idAt(parentPos.y(), x));
            if (!refChildIds.isEmpty()) {
                int maxX = refChildIds.stream()
                    .mapToInt(childId -> store.position(childId).x())
                    .max()
                    .getAsInt();
                return maxX + 1;
            }
        }
        return 0;
    }

    /**
     * Insertion x in the layer above {@code childId}: right of the parent of the nearest
     * node at or left of the child that has a parent, else 0.
     */
    int newParentX(NodeStore store, int childId) {
        NodePosition childPos = store.position(childId);
        for (int x = childPos.x(); x >= 0; x--) {
            int refParentId = store.parentId(store.idAt(childPos.y(), x));
            if (refParentId >= 0) {
                return store.position(refParentId).x() + 1;
            }
        }
        return 0;
    }

    // ========== HELPERS ==========

    /**
     * Unset {@code childId} from its parent. Later siblings are unset and set again so that
     * undoing restores the parent's exact child order.
     */
    private void detachFromParent(NodeStore store, int parentId, int childId, List<TreeEdit> edits) {
        List<Integer> siblings = store.childIds(parentId);
        int index = siblings.indexOf(childId);
        for (int i = siblings.size() - 1; i >= index; i--) {
            edits.add(new UnsetAsChild(parentId, siblings.get(i)));
        }
        for (int i = index + 1; i < siblings.size(); i++) {
            edits.add(new SetAsChild(parentId, siblings.get(i)));
        }
    }

    private void requireParentless(NodeStore store, int childId) {
        int parentId = store.parentId(childId);
        if (parentId >= 0) {
            throw new TreeEditException(Violation.ALREADY_PARENTED, null,
                "Node " + childId + " already has parent " + parentId);
        }
    }
}
