package com.familygraph.store;

import com.familygraph.model.Card;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One person in the forest. Relations are ids resolved through the owning {@link NodeStore}.
 * Only {@link EditEngine} mutates a node.
 */
public class Node {

    public static final int NO_PARENT = -1;

    private final int id;
    private Card card;
    private int parentId = NO_PARENT;
    // left-to-right visual order
    private final List<Integer> childIds = new ArrayList<>();

    Node(int id, Card card) {
        this.id = id;
        this.card = card;
    }

    public int getId() { return id; }
    public Card getCard() { return card; }
    public int getParentId() { return parentId; }
    public List<Integer> getChildIds() { return Collections.unmodifiableList(childIds); }

    public boolean hasParent() {
        return parentId >= 0;
    }

    public boolean hasChildren() {
        return !childIds.isEmpty();
    }

    void setCard(Card card) { this.card = card; }
    void setParentId(int parentId) { this.parentId = parentId; }
    void addChild(int childId) { childIds.add(childId); }
    void removeChild(int childId) { childIds.remove(Integer.valueOf(childId)); }
}
