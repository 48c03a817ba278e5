package com.familygraph.store;

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
import com.familygraph.store.TreeEditException.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The only way to mutate a {@link NodeStore}. Each edit is validated against the current
 * store before anything changes, so a rejected edit leaves the store untouched.
 *
 * Applying a list is not transactional: when edit k fails, edits before k stay applied.
 * Callers that need rollback apply {@link TreeEdit#invert(List)} of the applied prefix.
 */
public class EditEngine {

    private static final Logger log = LoggerFactory.getLogger(EditEngine.class);

    private final NodeStore store;

    public EditEngine(NodeStore store) {
        this.store = store;
    }

    public void apply(List<? extends TreeEdit> edits) {
        for (TreeEdit edit : edits) {
            apply(edit);
        }
    }

    public void apply(TreeEdit edit) {
        log.debug("Applying edit: {}", edit.describe());
        if (edit instanceof NewRightmostNode e) {
            newRightmostNode(e);
        } else if (edit instanceof DeleteRightmostNode e) {
            deleteRightmostNode(e);
        } else if (edit instanceof NewLayer e) {
            newLayer(e);
        } else if (edit instanceof DeleteLayer e) {
            deleteLayer(e);
        } else if (edit instanceof SetAsChild e) {
            setAsChild(e);
        } else if (edit instanceof UnsetAsChild e) {
            unsetAsChild(e);
        } else if (edit instanceof MoveNode e) {
            moveNode(e);
        } else if (edit instanceof ModifyCard e) {
            modifyCard(e);
        } else if (edit instanceof ModifyGenerationIndex e) {
            modifyGenerationIndex(e);
        } else {
            throw new IllegalStateException("Unhandled edit type: " + edit.getClass().getName());
        }
    }

    // ========== NODES ==========

    private void newRightmostNode(NewRightmostNode edit) {
        requireLayer(edit, edit.y());
        if (store.contains(edit.id())) {
            throw new TreeEditException(Violation.DUPLICATE_ID, edit, "Node id already in use");
        }
        store.appendNode(edit.y(), new Node(edit.id(), edit.card()));
    }

    private void deleteRightmostNode(DeleteRightmostNode edit) {
        requireLayer(edit, edit.y());
        if (store.layerSize(edit.y()) == 0) {
            throw new TreeEditException(Violation.STALE_NODE, edit, "Layer is empty");
        }
        int lastId = store.idAt(edit.y(), store.layerSize(edit.y()) - 1);
        Node last = store.node(lastId);
        if (lastId != edit.id() || !last.getCard().equals(edit.card())) {
            throw new TreeEditException(Violation.STALE_NODE, edit,
                "Rightmost node " + lastId + " does not match the edit");
        }
        if (last.hasParent() || last.hasChildren()) {
            throw new TreeEditException(Violation.DANGLING_RELATION, edit,
                "Node still has parent or children");
        }
        store.removeLastNode(edit.y());
    }

    // ========== LAYERS ==========

    private void newLayer(NewLayer edit) {
        if (edit.y() < 0 || edit.y() > store.layerCount()) {
            throw new TreeEditException(Violation.LAYER_RANGE, edit,
                "Layer must be within [0, " + store.layerCount() + "]");
        }
        store.insertLayer(edit.y());
    }

    private void deleteLayer(DeleteLayer edit) {
        requireLayer(edit, edit.y());
        if (store.layerSize(edit.y()) != 0) {
            throw new TreeEditException(Violation.LAYER_NOT_EMPTY, edit, "Layer still holds nodes");
        }
        store.removeLayer(edit.y());
    }

    // ========== RELATIONS ==========

    private void setAsChild(SetAsChild edit) {
        Node parent = store.node(edit.parentId());
        Node child = store.node(edit.childId());
        if (parent.getChildIds().contains(edit.childId()) || child.getParentId() == edit.parentId()) {
            throw new TreeEditException(Violation.DUPLICATE_RELATION, edit, "Relation already exists");
        }
        if (child.hasParent()) {
            throw new TreeEditException(Violation.ALREADY_PARENTED, edit,
                "Child already has parent " + child.getParentId());
        }
        requireAdjacent(edit, edit.parentId(), edit.childId());
        parent.addChild(edit.childId());
        child.setParentId(edit.parentId());
    }

    private void unsetAsChild(UnsetAsChild edit) {
        Node parent = store.node(edit.parentId());
        Node child = store.node(edit.childId());
        if (!parent.getChildIds().contains(edit.childId()) || child.getParentId() != edit.parentId()) {
            throw new TreeEditException(Violation.MISSING_RELATION, edit, "No such relation");
        }
        requireAdjacent(edit, edit.parentId(), edit.childId());
        parent.removeChild(edit.childId());
        child.setParentId(Node.NO_PARENT);
    }

    // ========== IN-PLACE CHANGES ==========

    private void moveNode(MoveNode edit) {
        NodePosition position = store.position(edit.id());
        if (edit.oldX() == edit.newX()) {
            return;
        }
        if (position.x() != edit.oldX()) {
            throw new TreeEditException(Violation.POSITION_MISMATCH, edit,
                "Node is at x=" + position.x() + ", not x=" + edit.oldX());
        }
        if (edit.newX() < 0 || edit.newX() >= store.layerSize(position.y())) {
            throw new TreeEditException(Violation.LAYER_RANGE, edit,
                "Target x outside layer " + position.y());
        }
        store.relocate(edit.id(), edit.newX());
    }

    private void modifyCard(ModifyCard edit) {
        Node node = store.node(edit.id());
        if (!node.getCard().equals(edit.oldCard())) {
            throw new TreeEditException(Violation.STALE_VALUE, edit, "Card has changed since the edit was built");
        }
        node.setCard(edit.newCard());
    }

    private void modifyGenerationIndex(ModifyGenerationIndex edit) {
        GenerationIndexSettings settings = store.generationSettings();
        if (!settings.hasDefinition(edit.giIndex())) {
            throw new TreeEditException(Violation.UNKNOWN_DEFINITION, edit,
                "No generation index definition #" + edit.giIndex());
        }
        int y = store.position(edit.id()).y();
        if (settings.compute(y, edit.giIndex()) != edit.oldGi()) {
            throw new TreeEditException(Violation.STALE_VALUE, edit,
                "Generation index has changed since the edit was built");
        }
        settings.solveBase(y, edit.giIndex(), edit.newGi());
    }

    // ========== HELPERS ==========

    private void requireLayer(TreeEdit edit, int y) {
        if (y < 0 || y >= store.layerCount()) {
            throw new TreeEditException(Violation.LAYER_RANGE, edit, "No layer " + y);
        }
    }

    private void requireAdjacent(TreeEdit edit, int parentId, int childId) {
        int parentY = store.position(parentId).y();
        int childY = store.position(childId).y();
        if (childY != parentY + 1) {
            throw new TreeEditException(Violation.LAYER_ADJACENCY, edit,
                "Child layer " + childY + " is not parent layer " + parentY + " plus 1");
        }
    }
}
