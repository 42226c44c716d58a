// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.ddbench.life;

/** Restriction of the post states to those with some symmetry. */
public enum Symmetry {
    NONE("None"),
    /** Left and right half mirror each other (vertical axis). */
    MIRROR("Mirror (Vertical)");

    private final String description;

    Symmetry(String description) { this.description = description; }

    @Override
    public String toString() { return description; }
}
