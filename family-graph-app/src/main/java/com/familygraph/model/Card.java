package com.familygraph.model;

/**
 * Value data for one person. Owned by exactly one node and always replaced wholesale.
 */
public record Card(
    String name,
    Integer birthYear,
    Integer deathYear,
    String biography
) {
    public static final String UNKNOWN_NAME = "Unknown";

    public Card {
        if (name == null) name = UNKNOWN_NAME;
        if (biography == null) biography = "";
    }

    public static Card named(String name) {
        return new Card(name, null, null, "");
    }
}
