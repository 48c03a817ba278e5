package com.familygraph.model;

/**
 * A tree created at startup from configuration.
 */
public record TreeSeed(
    String slug,           // URL-safe identifier, e.g. "zhang"
    String displayName,    // Display name, e.g. "Zhang Family"
    String shape           // text form, e.g. "a(b,c);b,c;"
) {}
