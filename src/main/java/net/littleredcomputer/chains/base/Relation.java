// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import java.util.Objects;

/**
 * A kind of link between two terms. The type is the abstract name used throughout
 * the engine (e.g. "causal"); the description is meant for people and the surface
 * form for rendering the relation in text.
 */
public final class Relation {
    private final String type;
    private final String description;
    private final String surfaceForm;

    public Relation(String type, String description, String surfaceForm) {
        this.type = Objects.requireNonNull(type);
        this.description = Objects.requireNonNull(description);
        this.surfaceForm = Objects.requireNonNull(surfaceForm);
    }

    public String type() { return type; }
    public String description() { return description; }
    public String surfaceForm() { return surfaceForm; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relation)) return false;
        Relation r = (Relation) o;
        return type.equals(r.type) && description.equals(r.description) && surfaceForm.equals(r.surfaceForm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, description, surfaceForm);
    }

    @Override
    public String toString() {
        return type;
    }
}
