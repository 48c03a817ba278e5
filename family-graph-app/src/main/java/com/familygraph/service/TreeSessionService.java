package com.familygraph.service;

import com.familygraph.config.FamilyGraphConfig;
import com.familygraph.model.Card;
import com.familygraph.model.NodeSummary;
import com.familygraph.model.TreeEdit;
import com.familygraph.model.TreeEdit.NewRightmostNode;
import com.familygraph.model.TreeSeed;
import com.familygraph.store.NodeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named editable trees and the composite operations on them.
 *
 * Every command builds its edit sequence with {@link TreeEditBuilder} and performs it on
 * the session, so each one is a single undoable step. Commands that create a node return
 * the new node's id.
 */
@Service
public class TreeSessionService {

    private static final Logger log = LoggerFactory.getLogger(TreeSessionService.class);

    private final FamilyGraphConfig config;
    private final TreeEditBuilder editBuilder;
    private final TreeTextCodec textCodec;
    private final TreeLayoutService layoutService;
    private final Map<String, TreeSession> sessions = new ConcurrentHashMap<>();

    public TreeSessionService(FamilyGraphConfig config,
                              TreeEditBuilder editBuilder,
                              TreeTextCodec textCodec,
                              TreeLayoutService layoutService) {
        this.config = config;
        this.editBuilder = editBuilder;
        this.textCodec = textCodec;
        this.layoutService = layoutService;
        for (TreeSeed seed : config.getTreeSeeds()) {
            createSession(seed.slug(), seed.displayName(), seed.shape());
        }
    }

    // ========== SESSIONS ==========

    /**
     * Create (or replace) a session from a text shape.
     *
     * @throws TreeTextCodec.TreeFormatException if the shape does not parse
     */
    public TreeSession createSession(String slug, String displayName, String shape) {
        NodeStore store = textCodec.decode(shape, config::newGenerationIndexSettings);
        TreeSession session = new TreeSession(slug, displayName != null ? displayName : slug, store);
        if (sessions.put(slug, session) != null) {
            log.info("Replaced session '{}' ({} nodes)", slug, store.size());
        } else {
            log.info("Created session '{}' ({} nodes)", slug, store.size());
        }
        return session;
    }

    public Optional<TreeSession> findSession(String slug) {
        return Optional.ofNullable(sessions.get(slug));
    }

    public List<TreeSession> listSessions() {
        return sessions.values().stream()
            .sorted(Comparator.comparing(TreeSession::getSlug))
            .toList();
    }

    public boolean deleteSession(String slug) {
        boolean removed = sessions.remove(slug) != null;
        if (removed) {
            log.info("Deleted session '{}'", slug);
        }
        return removed;
    }

    // ========== COMMANDS ==========

    public int addNodeAtLayer(TreeSession session, int y, Card card) {
        List<TreeEdit> edits = session.perform("add node to layer " + y,
            store -> editBuilder.insertNodeAtLayer(store, y, card));
        return createdId(edits);
    }

    public int addChild(TreeSession session, int parentId, Card card) {
        List<TreeEdit> edits = session.perform("add child to " + parentId,
            store -> editBuilder.insertChild(store, parentId, card));
        return createdId(edits);
    }

    public int addParent(TreeSession session, int childId, Card card) {
        List<TreeEdit> edits = session.perform("add parent to " + childId,
            store -> editBuilder.insertParent(store, childId, card));
        return createdId(edits);
    }

    public void linkChild(TreeSession session, int parentId, int childId) {
        session.perform("link " + childId + " under " + parentId,
            store -> editBuilder.linkChild(store, parentId, childId));
    }

    public void unlinkChild(TreeSession session, int parentId, int childId) {
        session.perform("unlink " + childId + " from " + parentId,
            store -> editBuilder.unlinkChild(store, parentId, childId));
    }

    public void moveNode(TreeSession session, int id, int newX) {
        session.perform("move " + id + " to x=" + newX,
            store -> editBuilder.moveNode(store, id, newX));
    }

    /**
     * Delete a node. Its children become roots. Empty edge layers are collapsed in the same
     * undoable step when {@code familygraph.session.collapse-empty-edge-layers} is set.
     */
    public void deleteNode(TreeSession session, int id) {
        String description = "delete " + id;
        if (config.getSession().isCollapseEmptyEdgeLayers()) {
            session.perform(description,
                store -> editBuilder.deleteNode(store, id),
                editBuilder::collapseEmptyEdgeLayers);
        } else {
            session.perform(description, store -> editBuilder.deleteNode(store, id));
        }
    }

    public void setCard(TreeSession session, int id, Card card) {
        session.perform("edit card of " + id,
            store -> editBuilder.setCard(store, id, card));
    }

    public void setGenerationIndex(TreeSession session, int id, int giIndex, int value) {
        session.perform("set generation index #" + giIndex + " of " + id + " to " + value,
            store -> editBuilder.setGenerationIndex(store, id, giIndex, value));
    }

    public void addGenerationIndexDefinition(TreeSession session, String name, int offset) {
        session.addGenerationIndexDefinition(name, offset);
    }

    public boolean undo(TreeSession session) {
        return session.undo();
    }

    public boolean redo(TreeSession session) {
        return session.redo();
    }

    // ========== QUERIES ==========

    public Optional<NodeSummary> getNode(TreeSession session, int id) {
        return session.read(store -> store.contains(id) ? Optional.of(store.summary(id)) : Optional.empty());
    }

    public List<NodeSummary> getNodes(TreeSession session) {
        return session.read(store -> store.ids().stream().map(store::summary).toList());
    }

    public Map<Integer, Double> computeLayout(TreeSession session) {
        return session.read(layoutService::computeCoordinates);
    }

    public String encode(TreeSession session) {
        return session.read(textCodec::encode);
    }

    private int createdId(List<TreeEdit> edits) {
        return edits.stream()
            .filter(NewRightmostNode.class::isInstance)
            .map(NewRightmostNode.class::cast)
            .map(NewRightmostNode::id)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Operation created no node"));
    }
}
