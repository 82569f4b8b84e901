// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import java.util.Objects;

/**
 * A relation placeholder (e.g. "R0") between two variables, before any relation type
 * has been chosen for it.
 */
public final class GenericTemplate {
    private final String sourceId;
    private final String relationId;
    private final String targetId;

    public GenericTemplate(String sourceId, String relationId, String targetId) {
        this.sourceId = Objects.requireNonNull(sourceId);
        this.relationId = Objects.requireNonNull(relationId);
        this.targetId = Objects.requireNonNull(targetId);
    }

    public String sourceId() { return sourceId; }
    public String relationId() { return relationId; }
    public String targetId() { return targetId; }

    public RelationalTemplate withRelationType(String relationType) {
        return new RelationalTemplate(sourceId, relationType, targetId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericTemplate)) return false;
        GenericTemplate t = (GenericTemplate) o;
        return sourceId.equals(t.sourceId) && relationId.equals(t.relationId) && targetId.equals(t.targetId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, relationId, targetId);
    }

    @Override
    public String toString() {
        return "(" + sourceId + " " + relationId + " " + targetId + ")";
    }
}
