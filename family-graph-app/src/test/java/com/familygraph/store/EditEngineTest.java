package com.familygraph.store;

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
import com.familygraph.service.TreeTextCodec;
import com.familygraph.store.TreeEditException.Violation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EditEngineTest {

    private final TreeTextCodec codec = new TreeTextCodec();

    private NodeStore store;
    private EditEngine engine;

    @BeforeEach
    void setUp() {
        store = new NodeStore();
        engine = new EditEngine(store);
    }

    /**
     * Builds:
     * <pre>
     *        c
     *      ┌─┴─┐
     *      a   d
     *      │
     *      b
     *    ┌─┴─┐
     *    e   f
     * </pre>
     */
    private List<TreeEdit> sixNodeEdits() {
        List<TreeEdit> edits = new ArrayList<>(List.of(
            new NewLayer(0),
            new NewLayer(1),
            new NewRightmostNode(0, store.obtainId(), Card.named("c")),
            new NewRightmostNode(1, store.obtainId(), Card.named("b")),
            new NewLayer(1),
            new NewRightmostNode(1, store.obtainId(), Card.named("a")),
            new NewLayer(3),
            new NewRightmostNode(3, store.obtainId(), Card.named("f")),
            new NewRightmostNode(3, store.obtainId(), Card.named("e"))
        ));
        edits.add(new MoveNode(store.lastId(), 1, 0));
        edits.add(new NewRightmostNode(1, store.obtainId(), Card.named("d")));
        int c = 0, b = 1, a = 2, f = 3, e = 4, d = 5;
        edits.addAll(List.of(
            new SetAsChild(c, a),
            new SetAsChild(c, d),
            new SetAsChild(a, b),
            new SetAsChild(b, e),
            new SetAsChild(b, f)
        ));
        return edits;
    }

    private static Map<Integer, String> snapshot(NodeStore store) {
        Map<Integer, String> snapshot = new LinkedHashMap<>();
        for (int id : store.ids()) {
            snapshot.put(id, store.card(id) + "|" + store.parentId(id) + "|" + store.childIds(id)
                + "|" + store.position(id));
        }
        snapshot.put(-1, "layers=" + store.layerCount() + " base=" + store.generationSettings().getBase());
        return snapshot;
    }

    @Nested
    @DisplayName("edit sequences")
    class Sequences {

        @Test
        void buildsSixNodeTree() {
            engine.apply(sixNodeEdits());

            assertThat(codec.encode(store)).isEqualTo("c(a,d);a(b),d;b(e,f);e,f;");
        }

        @Test
        void reversingTailRestoresFirstFourEdits() {
            List<TreeEdit> edits = sixNodeEdits();
            engine.apply(edits);

            engine.apply(TreeEdit.invert(edits.subList(4, edits.size())));

            assertThat(codec.encode(store)).isEqualTo("c;b;");
        }

        @Test
        void invertingWholeSequenceEmptiesStore() {
            List<TreeEdit> edits = sixNodeEdits();
            engine.apply(edits);

            engine.apply(TreeEdit.invert(edits));

            assertThat(store.layerCount()).isZero();
            assertThat(store.size()).isZero();
        }

        @Test
        void inverseRestoresEveryQueryableField() {
            NodeStore decoded = codec.decode("a(b,c),g(h);b(d),c(e,f),h(i),l,r;d,e,f,i,s;");
            EditEngine decodedEngine = new EditEngine(decoded);
            Map<Integer, String> before = snapshot(decoded);
            List<TreeEdit> edits = List.of(
                new MoveNode(3, 1, 4),
                new ModifyCard(0, Card.named("a"), new Card("a", 1900, 1970, "bio")),
                new UnsetAsChild(1, 4),
                new NewLayer(0),
                new ModifyGenerationIndex(0, 0, 2, 10),
                new NewRightmostNode(0, decoded.obtainId(), Card.named("root")),
                new SetAsChild(decoded.lastId(), 1)
            );

            decodedEngine.apply(edits);
            assertThat(snapshot(decoded)).isNotEqualTo(before);
            decodedEngine.apply(TreeEdit.invert(edits));

            assertThat(snapshot(decoded)).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("NewRightmostNode / DeleteRightmostNode")
    class RightmostNodes {

        @Test
        void requiresExistingLayer() {
            assertThatThrownBy(() -> engine.apply(new NewRightmostNode(0, 0, Card.named("a"))))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.LAYER_RANGE);
        }

        @Test
        void rejectsDuplicateId() {
            engine.apply(List.of(new NewLayer(0), new NewRightmostNode(0, 0, Card.named("a"))));

            assertThatThrownBy(() -> engine.apply(new NewRightmostNode(0, 0, Card.named("b"))))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.DUPLICATE_ID);
        }

        @Test
        void deleteRejectsStaleCard() {
            engine.apply(List.of(new NewLayer(0), new NewRightmostNode(0, 0, Card.named("a"))));

            DeleteRightmostNode stale = new DeleteRightmostNode(0, 0, Card.named("renamed"));

            assertThatThrownBy(() -> engine.apply(stale))
                .isInstanceOf(TreeEditException.class)
                .satisfies(e -> {
                    TreeEditException ex = (TreeEditException) e;
                    assertThat(ex.getViolation()).isEqualTo(Violation.STALE_NODE);
                    assertThat(ex.getEdit()).isEqualTo(stale);
                });
            assertThat(store.contains(0)).isTrue();
        }

        @Test
        void deleteRejectsNodeThatIsNotRightmost() {
            engine.apply(List.of(
                new NewLayer(0),
                new NewRightmostNode(0, 0, Card.named("a")),
                new NewRightmostNode(0, 1, Card.named("b"))));

            assertThatThrownBy(() -> engine.apply(new DeleteRightmostNode(0, 0, Card.named("a"))))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.STALE_NODE);
        }

        @Test
        void deleteRejectsNodeWithRelations() {
            NodeStore decoded = codec.decode("a(b);b;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new DeleteRightmostNode(1, 1, Card.named("b"))))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.DANGLING_RELATION);
        }
    }

    @Nested
    @DisplayName("NewLayer / DeleteLayer")
    class Layers {

        @Test
        void newLayerShiftsDeeperNodesDown() {
            NodeStore decoded = codec.decode("a(b);b;");

            new EditEngine(decoded).apply(new NewLayer(1));

            assertThat(decoded.position(0)).isEqualTo(new NodePosition(0, 0));
            assertThat(decoded.position(1)).isEqualTo(new NodePosition(2, 0));
            assertThat(decoded.layerSize(1)).isZero();
        }

        @Test
        void newLayerRejectsGap() {
            assertThatThrownBy(() -> engine.apply(new NewLayer(1)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.LAYER_RANGE);
        }

        @Test
        void deleteLayerRequiresEmptyLayer() {
            NodeStore decoded = codec.decode("a;b;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new DeleteLayer(0)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.LAYER_NOT_EMPTY);
        }

        @Test
        void deleteLayerShiftsDeeperNodesUp() {
            NodeStore decoded = codec.decode("a;;b;");

            new EditEngine(decoded).apply(new DeleteLayer(1));

            assertThat(decoded.layerCount()).isEqualTo(2);
            assertThat(decoded.position(1)).isEqualTo(new NodePosition(1, 0));
        }
    }

    @Nested
    @DisplayName("SetAsChild / UnsetAsChild")
    class Relations {

        @Test
        void rejectsDuplicateRelation() {
            NodeStore decoded = codec.decode("a(b);b;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new SetAsChild(0, 1)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.DUPLICATE_RELATION);
        }

        @Test
        void rejectsSecondParent() {
            NodeStore decoded = codec.decode("a(c),b;c;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new SetAsChild(1, 2)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.ALREADY_PARENTED);
            assertThat(decoded.childIds(1)).isEmpty();
        }

        @Test
        void rejectsNonAdjacentLayers() {
            NodeStore decoded = codec.decode("a;b;c;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new SetAsChild(0, 2)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.LAYER_ADJACENCY);
        }

        @Test
        void rejectsSameLayer() {
            NodeStore decoded = codec.decode("a,b;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new SetAsChild(0, 1)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.LAYER_ADJACENCY);
        }

        @Test
        void unsetRejectsMissingRelation() {
            NodeStore decoded = codec.decode("a,b(c);c;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new UnsetAsChild(0, 2)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.MISSING_RELATION);
        }

        @Test
        void unsetClearsBothSides() {
            NodeStore decoded = codec.decode("a(b,c);b,c;");

            new EditEngine(decoded).apply(new UnsetAsChild(0, 1));

            assertThat(decoded.childIds(0)).containsExactly(2);
            assertThat(decoded.parentId(1)).isEqualTo(Node.NO_PARENT);
        }
    }

    @Nested
    @DisplayName("MoveNode")
    class Moves {

        @Test
        void movesRightAndShiftsNodesBetweenLeft() {
            NodeStore decoded = codec.decode("a,b,c,d;");

            new EditEngine(decoded).apply(new MoveNode(0, 0, 2));

            assertThat(decoded.layer(0)).containsExactly(1, 2, 0, 3);
            assertThat(decoded.position(1).x()).isZero();
            assertThat(decoded.position(2).x()).isEqualTo(1);
            assertThat(decoded.position(0).x()).isEqualTo(2);
            assertThat(decoded.position(3).x()).isEqualTo(3);
        }

        @Test
        void movesLeftAndShiftsNodesBetweenRight() {
            NodeStore decoded = codec.decode("a,b,c,d;");

            new EditEngine(decoded).apply(new MoveNode(3, 3, 1));

            assertThat(decoded.layer(0)).containsExactly(0, 3, 1, 2);
            for (int x = 0; x < 4; x++) {
                assertThat(decoded.position(decoded.idAt(0, x)).x()).isEqualTo(x);
            }
        }

        @Test
        void sameXIsNoOp() {
            NodeStore decoded = codec.decode("a,b;");

            new EditEngine(decoded).apply(new MoveNode(1, 1, 1));

            assertThat(decoded.layer(0)).containsExactly(0, 1);
        }

        @Test
        void rejectsWrongOldX() {
            NodeStore decoded = codec.decode("a,b,c;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new MoveNode(1, 0, 2)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.POSITION_MISMATCH);
        }

        @Test
        void rejectsTargetOutsideLayer() {
            NodeStore decoded = codec.decode("a,b;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new MoveNode(0, 0, 2)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.LAYER_RANGE);
        }
    }

    @Nested
    @DisplayName("ModifyCard / ModifyGenerationIndex")
    class Modifications {

        @Test
        void modifyCardReplacesWholesale() {
            NodeStore decoded = codec.decode("a;");
            Card card = new Card("Alice", 1901, 1988, "Farmer");

            new EditEngine(decoded).apply(new ModifyCard(0, Card.named("a"), card));

            assertThat(decoded.card(0)).isEqualTo(card);
        }

        @Test
        void modifyCardRejectsStaleOldCard() {
            NodeStore decoded = codec.decode("a;");

            assertThatThrownBy(() -> new EditEngine(decoded)
                .apply(new ModifyCard(0, Card.named("x"), Card.named("y"))))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.STALE_VALUE);
        }

        @Test
        void modifyGenerationIndexSolvesBase() {
            NodeStore decoded = codec.decode("a;b;c;");

            new EditEngine(decoded).apply(new ModifyGenerationIndex(2, 0, 3, 30));

            assertThat(decoded.generationSettings().getBase()).isEqualTo(28);
            assertThat(decoded.generationIndex(0, 0)).isEqualTo(28);
        }

        @Test
        void modifyGenerationIndexRejectsUnknownDefinition() {
            NodeStore decoded = codec.decode("a;");

            assertThatThrownBy(() -> new EditEngine(decoded).apply(new ModifyGenerationIndex(0, 3, 1, 5)))
                .isInstanceOf(TreeEditException.class)
                .extracting("violation").isEqualTo(Violation.UNKNOWN_DEFINITION);
        }
    }

    @Test
    void unknownIdIsContractViolation() {
        engine.apply(new NewLayer(0));

        assertThatThrownBy(() -> engine.apply(new SetAsChild(7, 8)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown node id");
    }
}
