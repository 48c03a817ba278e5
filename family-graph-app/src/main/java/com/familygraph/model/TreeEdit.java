package com.familygraph.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Atomic, independently reversible edit of a node store.
 *
 * Every variant carries exactly the data needed to apply it and to build its inverse,
 * so an applied list of edits can be undone by {@link #invert(List)} without consulting
 * anything but the store it is applied to.
 */
public sealed interface TreeEdit {

    TreeEdit inverse();

    String describe();

    /**
     * Inverse of an edit sequence: each edit inverted, list order reversed.
     */
    static List<TreeEdit> invert(List<TreeEdit> edits) {
        List<TreeEdit> inverted = new ArrayList<>(edits.size());
        for (int i = edits.size() - 1; i >= 0; i--) {
            inverted.add(edits.get(i).inverse());
        }
        return inverted;
    }

    // ========== NODES ==========

    /** Append a node at the right end of layer {@code y}. The layer must exist. */
    record NewRightmostNode(int y, int id, Card card) implements TreeEdit {
        @Override
        public DeleteRightmostNode inverse() {
            return new DeleteRightmostNode(y, id, card);
        }

        @Override
        public String describe() {
            return "new rightmost node " + id + " '" + card.name() + "' in layer " + y;
        }
    }

    /** Remove the last node of layer {@code y}; it must match id and card exactly. */
    record DeleteRightmostNode(int y, int id, Card card) implements TreeEdit {
        @Override
        public NewRightmostNode inverse() {
            return new NewRightmostNode(y, id, card);
        }

        @Override
        public String describe() {
            return "delete rightmost node " + id + " '" + card.name() + "' in layer " + y;
        }
    }

    // ========== LAYERS ==========

    /** Insert an empty layer at {@code y}, pushing deeper layers down by one. */
    record NewLayer(int y) implements TreeEdit {
        @Override
        public DeleteLayer inverse() {
            return new DeleteLayer(y);
        }

        @Override
        public String describe() {
            return "new layer " + y;
        }
    }

    /** Remove the empty layer at {@code y}, pulling deeper layers up by one. */
    record DeleteLayer(int y) implements TreeEdit {
        @Override
        public NewLayer inverse() {
            return new NewLayer(y);
        }

        @Override
        public String describe() {
            return "delete layer " + y;
        }
    }

    // ========== RELATIONS ==========

    record SetAsChild(int parentId, int childId) implements TreeEdit {
        @Override
        public UnsetAsChild inverse() {
            return new UnsetAsChild(parentId, childId);
        }

        @Override
        public String describe() {
            return "set " + childId + " as child of " + parentId;
        }
    }

    record UnsetAsChild(int parentId, int childId) implements TreeEdit {
        @Override
        public SetAsChild inverse() {
            return new SetAsChild(parentId, childId);
        }

        @Override
        public String describe() {
            return "unset " + childId + " as child of " + parentId;
        }
    }

    // ========== IN-PLACE CHANGES ==========

    /** Relocate a node within its own layer. */
    record MoveNode(int id, int oldX, int newX) implements TreeEdit {
        @Override
        public MoveNode inverse() {
            return new MoveNode(id, newX, oldX);
        }

        @Override
        public String describe() {
            return "move node " + id + " from x=" + oldX + " to x=" + newX;
        }
    }

    record ModifyCard(int id, Card oldCard, Card newCard) implements TreeEdit {
        @Override
        public ModifyCard inverse() {
            return new ModifyCard(id, newCard, oldCard);
        }

        @Override
        public String describe() {
            return "modify card of " + id + " from '" + oldCard.name() + "' to '" + newCard.name() + "'";
        }
    }

    /** Re-solve the shared generation-index base so node {@code id} reads {@code newGi}. */
    record ModifyGenerationIndex(int id, int giIndex, int oldGi, int newGi) implements TreeEdit {
        @Override
        public ModifyGenerationIndex inverse() {
            return new ModifyGenerationIndex(id, giIndex, newGi, oldGi);
        }

        @Override
        public String describe() {
            return "set generation index #" + giIndex + " of " + id + " from " + oldGi + " to " + newGi;
        }
    }
}
