package com.familygraph.service;

import com.familygraph.model.TreeEdit;
import com.familygraph.store.EditEngine;
import com.familygraph.store.NodeStore;
import com.familygraph.store.TreeEditException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * One editable tree with its undo and redo history.
 *
 * Every operation is an edit sequence. Performing one pushes it on the undo stack and
 * clears the redo stack; undo applies the inverted sequence and moves it to redo; redo
 * re-applies it forward and moves it back. A sequence that fails half-way is rolled back
 * before the error propagates, so the tree is never left between two operations.
 *
 * Methods are synchronized: a session is single-writer, but web requests may arrive on
 * different threads.
 */
public class TreeSession {

    private static final Logger log = LoggerFactory.getLogger(TreeSession.class);

    private final String slug;
    private final String displayName;
    private final NodeStore store;
    private final EditEngine engine;
    private final Deque<Operation> undoStack = new ArrayDeque<>();
    private final Deque<Operation> redoStack = new ArrayDeque<>();

    public TreeSession(String slug, String displayName, NodeStore store) {
        this.slug = slug;
        this.displayName = displayName;
        this.store = store;
        this.engine = new EditEngine(store);
    }

    public String getSlug() { return slug; }
    public String getDisplayName() { return displayName; }

    /** The session's store. Read it freely; mutate it only through {@link #perform}. */
    public NodeStore getStore() { return store; }

    /**
     * Build an edit sequence from the current state and perform it, both under the session
     * lock.
     *
     * @return the performed edits
     */
    public synchronized List<TreeEdit> perform(String description, Function<NodeStore, List<TreeEdit>> builder) {
        List<TreeEdit> edits = builder.apply(store);
        perform(description, edits);
        return edits;
    }

    /**
     * Perform {@code builder}'s edits, then the edits {@code followUp} derives from the
     * resulting state, recorded together as one undoable operation.
     */
    public synchronized List<TreeEdit> perform(String description,
                                               Function<NodeStore, List<TreeEdit>> builder,
                                               Function<NodeStore, List<TreeEdit>> followUp) {
        List<TreeEdit> edits = new ArrayList<>(builder.apply(store));
        applyAtomically(edits);
        List<TreeEdit> more = followUp.apply(store);
        try {
            applyAtomically(more);
        } catch (TreeEditException e) {
            engine.apply(TreeEdit.invert(edits));
            throw e;
        }
        edits.addAll(more);
        record(description, edits);
        return edits;
    }

    public synchronized void perform(String description, List<TreeEdit> edits) {
        applyAtomically(edits);
        record(description, edits);
    }

    public synchronized boolean undo() {
        Operation operation = undoStack.peek();
        if (operation == null) {
            return false;
        }
        applyAtomically(TreeEdit.invert(operation.edits()));
        undoStack.pop();
        redoStack.push(operation);
        log.info("[{}] undid '{}'", slug, operation.description());
        return true;
    }

    public synchronized boolean redo() {
        Operation operation = redoStack.peek();
        if (operation == null) {
            return false;
        }
        applyAtomically(operation.edits());
        redoStack.pop();
        undoStack.push(operation);
        log.info("[{}] redid '{}'", slug, operation.description());
        return true;
    }

    /**
     * Append a generation index definition. Definitions are tree settings, not structure,
     * so this is not recorded for undo.
     */
    public synchronized void addGenerationIndexDefinition(String name, int offset) {
        store.addGenerationIndexDefinition(name, offset);
        log.info("[{}] added generation index definition '{}' (offset {})", slug, name, offset);
    }

    public synchronized boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public synchronized boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public synchronized List<String> undoHistory() {
        return undoStack.stream().map(Operation::description).toList();
    }

    /**
     * Run {@code body} while holding the session lock, for reads that must see one
     * consistent state.
     */
    public synchronized <T> T read(Function<NodeStore, T> body) {
        return body.apply(store);
    }

    private void record(String description, List<TreeEdit> edits) {
        undoStack.push(new Operation(description, List.copyOf(edits)));
        redoStack.clear();
        log.debug("[{}] performed '{}' ({} edits)", slug, description, edits.size());
    }

    private void applyAtomically(List<TreeEdit> edits) {
        int applied = 0;
        try {
            for (TreeEdit edit : edits) {
                engine.apply(edit);
                applied++;
            }
        } catch (TreeEditException e) {
            log.error("[{}] edit {} of {} rejected, rolling back: {}", slug, applied + 1, edits.size(), e.getMessage());
            engine.apply(TreeEdit.invert(edits.subList(0, applied)));
            throw e;
        }
    }

    private record Operation(String description, List<TreeEdit> edits) {}
}
