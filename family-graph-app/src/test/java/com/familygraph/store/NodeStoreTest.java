package com.familygraph.store;

import com.familygraph.model.GenerationIndexDefinition;
import com.familygraph.model.NodeSummary;
import com.familygraph.model.TreeEdit.ModifyGenerationIndex;
import com.familygraph.service.TreeTextCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeStoreTest {

    private final TreeTextCodec codec = new TreeTextCodec();

    @Nested
    @DisplayName("Queries")
    class Queries {

        private NodeStore store;

        @BeforeEach
        void setUp() {
            store = codec.decode("a(b,c);b(d),c;d;");
        }

        @Test
        void idsAreLayerMajor() {
            assertThat(store.ids()).containsExactly(0, 1, 2, 3);
            assertThat(store.size()).isEqualTo(4);
            assertThat(store.layerCount()).isEqualTo(3);
        }

        @Test
        void findByNameReturnsId() {
            assertThat(store.findByName("c")).contains(2);
            assertThat(store.findByName("zz")).isEmpty();
        }

        @Test
        void summaryCarriesRelationsAndPosition() {
            NodeSummary summary = store.summary(1);

            assertThat(summary.card().name()).isEqualTo("b");
            assertThat(summary.parentId()).isZero();
            assertThat(summary.childIds()).containsExactly(3);
            assertThat(summary.y()).isEqualTo(1);
            assertThat(summary.x()).isZero();
            assertThat(summary.generationIndices()).containsExactly(2);
        }

        @Test
        void rootHasNoParent() {
            assertThat(store.parentId(0)).isEqualTo(Node.NO_PARENT);
            assertThat(store.summary(0).hasParent()).isFalse();
        }

        @Test
        void childIdsAreReadOnly() {
            List<Integer> childIds = store.childIds(0);

            assertThatThrownBy(() -> childIds.add(9))
                .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void unknownIdThrows() {
            assertThatThrownBy(() -> store.card(42))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown node id: 42");
            assertThatThrownBy(() -> store.position(42))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void obtainIdNeverRepeats() {
            int first = store.obtainId();
            int second = store.obtainId();

            assertThat(first).isEqualTo(4);
            assertThat(second).isEqualTo(5);
            assertThat(store.lastId()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("Generation index")
    class GenerationIndex {

        private NodeStore store;
        private EditEngine engine;

        @BeforeEach
        void setUp() {
            store = codec.decode("a(b,c,d);b(e,f),c(),d(g);e(),f(h),g();h()");
            store.addGenerationIndexDefinition("Ancient", -10);
            engine = new EditEngine(store);
        }

        @Test
        void computesEveryDefinition() {
            int b = 1;

            assertThat(store.generationIndices(b)).containsExactly(2, -8);
        }

        @Test
        void settingOneNodeShiftsWholeTree() {
            int b = 1, h = 7;

            engine.apply(new ModifyGenerationIndex(h, 0, store.generationIndex(h, 0), 17));
            assertThat(store.generationIndices(b)).containsExactly(15, 5);
            assertThat(store.generationIndex(h, 0)).isEqualTo(17);

            engine.apply(new ModifyGenerationIndex(h, 1, store.generationIndex(h, 1), 6));
            assertThat(store.generationIndices(b)).containsExactly(14, 4);
            assertThat(store.generationIndex(h, 1)).isEqualTo(6);
        }

        @Test
        void sameLayerSharesIndices() {
            engine.apply(new ModifyGenerationIndex(7, 0, store.generationIndex(7, 0), 40));

            for (int id : store.layer(2)) {
                assertThat(store.generationIndices(id)).isEqualTo(store.generationIndicesOfLayer(2));
            }
        }

        @Test
        void unknownLayerThrows() {
            assertThatThrownBy(() -> store.generationIndicesOfLayer(4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown layer");
        }
    }

    @Test
    void settingsRequireAtLeastOneDefinition() {
        assertThatThrownBy(() -> new GenerationIndexSettings(1, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void customSettingsAreUsed() {
        GenerationIndexSettings settings = new GenerationIndexSettings(10,
            List.of(new GenerationIndexDefinition("Clan", 3)));

        NodeStore store = codec.decode("a;b;", () -> settings);

        assertThat(store.generationIndex(1, 0)).isEqualTo(14);
    }
}
