package com.familygraph.model;

/**
 * A named generation numbering, offset from the tree's base generation index.
 */
public record GenerationIndexDefinition(
    String name,
    int offset
) {}
