package com.familygraph.store;

import com.familygraph.model.Card;
import com.familygraph.model.GenerationIndexDefinition;
import com.familygraph.model.NodePosition;
import com.familygraph.model.NodeSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every node of one family forest and its layered arrangement.
 *
 * Layer {@code y} is a generation row, {@code x} the left-to-right rank inside it.
 * The reverse index caches each node's (y, x) so position lookups are constant time.
 * All structural mutation goes through {@link EditEngine}; this class only exposes
 * queries publicly.
 *
 * Looking up an id that is not in the store is a programming error and throws
 * {@link IllegalArgumentException}.
 */
public class NodeStore {

    private int lastId = -1;
    private final Map<Integer, Node> nodes = new HashMap<>();
    private final List<List<Integer>> layers = new ArrayList<>();
    private final Map<Integer, NodePosition> positions = new HashMap<>();
    private final GenerationIndexSettings generationSettings;

    public NodeStore() {
        this(new GenerationIndexSettings());
    }

    public NodeStore(GenerationIndexSettings generationSettings) {
        this.generationSettings = generationSettings;
    }

    // ========== IDS ==========

    /** Fresh id, never handed out before by this store. */
    public int obtainId() {
        return ++lastId;
    }

    public int lastId() {
        return lastId;
    }

    // ========== QUERIES ==========

    public int layerCount() {
        return layers.size();
    }

    public int layerSize(int y) {
        return layers.get(y).size();
    }

    public List<Integer> layer(int y) {
        return Collections.unmodifiableList(layers.get(y));
    }

    public int idAt(int y, int x) {
        return layers.get(y).get(x);
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    /** All ids in layer-major, left-to-right order. */
    public List<Integer> ids() {
        List<Integer> ids = new ArrayList<>(nodes.size());
        for (List<Integer> layer : layers) {
            ids.addAll(layer);
        }
        return ids;
    }

    public Node node(int id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return node;
    }

    public Card card(int id) {
        return node(id).getCard();
    }

    public int parentId(int id) {
        return node(id).getParentId();
    }

    public List<Integer> childIds(int id) {
        return node(id).getChildIds();
    }

    public NodePosition position(int id) {
        NodePosition position = positions.get(id);
        if (position == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return position;
    }

    public Optional<Integer> findByName(String name) {
        for (List<Integer> layer : layers) {
            for (int id : layer) {
                if (nodes.get(id).getCard().name().equals(name)) {
                    return Optional.of(id);
                }
            }
        }
        return Optional.empty();
    }

    public NodeSummary summary(int id) {
        Node node = node(id);
        NodePosition position = position(id);
        return new NodeSummary(
            id,
            node.getCard(),
            node.getParentId(),
            List.copyOf(node.getChildIds()),
            position.y(),
            position.x(),
            generationIndices(id)
        );
    }

    // ========== GENERATION INDEX ==========

    public GenerationIndexSettings generationSettings() {
        return generationSettings;
    }

    /** Every generation index of the node, one per definition. */
    public List<Integer> generationIndices(int id) {
        return generationSettings.computeAll(position(id).y());
    }

    public int generationIndex(int id, int giIndex) {
        return generationSettings.compute(position(id).y(), giIndex);
    }

    public List<Integer> generationIndicesOfLayer(int y) {
        if (y < 0 || y >= layers.size()) {
            throw new IllegalArgumentException("Unknown layer: " + y);
        }
        return generationSettings.computeAll(y);
    }

    public void addGenerationIndexDefinition(String name, int offset) {
        generationSettings.addDefinition(new GenerationIndexDefinition(name, offset));
    }

    // ========== PRIMITIVES (EditEngine only) ==========

    void appendNode(int y, Node node) {
        List<Integer> layer = layers.get(y);
        nodes.put(node.getId(), node);
        positions.put(node.getId(), new NodePosition(y, layer.size()));
        layer.add(node.getId());
    }

    void removeLastNode(int y) {
        List<Integer> layer = layers.get(y);
        int id = layer.remove(layer.size() - 1);
        nodes.remove(id);
        positions.remove(id);
    }

    void insertLayer(int y) {
        shiftLayers(y, +1);
        layers.add(y, new ArrayList<>());
    }

    void removeLayer(int y) {
        shiftLayers(y + 1, -1);
        layers.remove(y);
    }

    /** Move a node to {@code newX} within its layer, re-indexing the nodes in between. */
    void relocate(int id, int newX) {
        NodePosition position = positions.get(id);
        List<Integer> layer = layers.get(position.y());
        layer.remove(position.x());
        layer.add(newX, id);
        int from = Math.min(position.x(), newX);
        int to = Math.max(position.x(), newX);
        for (int x = from; x <= to; x++) {
            int shifted = layer.get(x);
            positions.put(shifted, new NodePosition(position.y(), x));
        }
    }

    private void shiftLayers(int fromY, int delta) {
        for (int y = fromY; y < layers.size(); y++) {
            for (int id : layers.get(y)) {
                positions.put(id, positions.get(id).withY(y + delta));
            }
        }
    }
}
