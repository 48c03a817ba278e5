package com.familygraph.config;

import com.familygraph.model.GenerationIndexDefinition;
import com.familygraph.model.TreeSeed;
import com.familygraph.store.GenerationIndexSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for sessions, generation numbering and seeded trees.
 * Defined in application.yml under 'familygraph'; the layout pass cap is read directly
 * by {@link com.familygraph.service.TreeLayoutService}.
 */
@Configuration
@ConfigurationProperties(prefix = "familygraph")
public class FamilyGraphConfig {

    private Session session = new Session();
    private GenerationIndex generationIndex = new GenerationIndex();
    private List<TreeDefinition> trees = new ArrayList<>();

    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }

    public GenerationIndex getGenerationIndex() { return generationIndex; }
    public void setGenerationIndex(GenerationIndex generationIndex) { this.generationIndex = generationIndex; }

    public List<TreeDefinition> getTrees() { return trees; }
    public void setTrees(List<TreeDefinition> trees) { this.trees = trees; }

    public List<TreeSeed> getTreeSeeds() {
        return trees.stream()
            .map(TreeDefinition::toSeed)
            .toList();
    }

    /** Fresh settings for a new tree; every tree owns its own base. */
    public GenerationIndexSettings newGenerationIndexSettings() {
        List<GenerationIndexDefinition> definitions = generationIndex.getDefinitions().stream()
            .map(DefinitionEntry::toDefinition)
            .toList();
        if (definitions.isEmpty()) {
            definitions = List.of(new GenerationIndexDefinition(GenerationIndexSettings.DEFAULT_DEFINITION_NAME, 0));
        }
        return new GenerationIndexSettings(generationIndex.getBase(), definitions);
    }

    public static class Session {
        private boolean collapseEmptyEdgeLayers = false;

        public boolean isCollapseEmptyEdgeLayers() { return collapseEmptyEdgeLayers; }
        public void setCollapseEmptyEdgeLayers(boolean collapseEmptyEdgeLayers) {
            this.collapseEmptyEdgeLayers = collapseEmptyEdgeLayers;
        }
    }

    public static class GenerationIndex {
        private int base = GenerationIndexSettings.DEFAULT_BASE;
        private List<DefinitionEntry> definitions = new ArrayList<>();

        public int getBase() { return base; }
        public void setBase(int base) { this.base = base; }

        public List<DefinitionEntry> getDefinitions() { return definitions; }
        public void setDefinitions(List<DefinitionEntry> definitions) { this.definitions = definitions; }
    }

    public static class DefinitionEntry {
        private String name;
        private int offset;

        public GenerationIndexDefinition toDefinition() {
            return new GenerationIndexDefinition(name, offset);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getOffset() { return offset; }
        public void setOffset(int offset) { this.offset = offset; }
    }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class TreeDefinition {
        private String slug;
        private String displayName;
        private String shape = "";

        public TreeSeed toSeed() {
            return new TreeSeed(slug, displayName, shape);
        }

        public String getSlug() { return slug; }
        public void setSlug(String slug) { this.slug = slug; }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getShape() { return shape; }
        public void setShape(String shape) { this.shape = shape; }
    }
}
