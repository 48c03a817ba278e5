package com.familygraph.store;

import com.familygraph.model.GenerationIndexDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tree-wide generation numbering: one shared base for layer 0 and a list of definitions,
 * each offset from that base. Definition 0 is the default numbering.
 */
public class GenerationIndexSettings {

    public static final int DEFAULT_BASE = 1;
    public static final String DEFAULT_DEFINITION_NAME = "Generation";

    private int base;
    private final List<GenerationIndexDefinition> definitions = new ArrayList<>();

    public GenerationIndexSettings() {
        this(DEFAULT_BASE, List.of(new GenerationIndexDefinition(DEFAULT_DEFINITION_NAME, 0)));
    }

    public GenerationIndexSettings(int base, List<GenerationIndexDefinition> definitions) {
        if (definitions.isEmpty()) {
            throw new IllegalArgumentException("At least one generation index definition is required");
        }
        this.base = base;
        this.definitions.addAll(definitions);
    }

    public int getBase() { return base; }
    public List<GenerationIndexDefinition> getDefinitions() { return Collections.unmodifiableList(definitions); }

    public void addDefinition(GenerationIndexDefinition definition) {
        definitions.add(definition);
    }

    public boolean hasDefinition(int giIndex) {
        return giIndex >= 0 && giIndex < definitions.size();
    }

    public int offset(int giIndex) {
        return definitions.get(giIndex).offset();
    }

    /** Generation index of layer {@code y} under definition {@code giIndex}. */
    public int compute(int y, int giIndex) {
        return base + y + offset(giIndex);
    }

    public List<Integer> computeAll(int y) {
        List<Integer> indices = new ArrayList<>(definitions.size());
        for (GenerationIndexDefinition definition : definitions) {
            indices.add(base + y + definition.offset());
        }
        return indices;
    }

    /** Solve the base so that layer {@code y} reads {@code gi} under definition {@code giIndex}. */
    void solveBase(int y, int giIndex, int gi) {
        this.base = gi - offset(giIndex) - y;
    }
}
