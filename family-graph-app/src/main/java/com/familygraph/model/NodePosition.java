package com.familygraph.model;

/**
 * Cell of a node in the layered arrangement: layer {@code y}, left-to-right rank {@code x}.
 */
public record NodePosition(int y, int x) {

    public NodePosition withY(int y) {
        return new NodePosition(y, x);
    }
}
