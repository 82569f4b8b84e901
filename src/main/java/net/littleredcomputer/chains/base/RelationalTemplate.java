// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import java.util.Objects;

/**
 * A (source, relation type, target) triple over variable identifiers. This is the unit
 * the reducer and the beam search work with.
 */
public final class RelationalTemplate {
    private final String sourceId;
    private final String relationType;
    private final String targetId;

    public RelationalTemplate(String sourceId, String relationType, String targetId) {
        this.sourceId = Objects.requireNonNull(sourceId);
        this.relationType = Objects.requireNonNull(relationType);
        this.targetId = Objects.requireNonNull(targetId);
    }

    public String sourceId() { return sourceId; }
    public String relationType() { return relationType; }
    public String targetId() { return targetId; }

    public boolean contains(String variableId) {
        return sourceId.equals(variableId) || targetId.equals(variableId);
    }

    /**
     * @return the endpoint opposite to variableId
     * @throws IllegalArgumentException if variableId is not an endpoint of this template
     */
    public String partnerOf(String variableId) {
        if (sourceId.equals(variableId)) return targetId;
        if (targetId.equals(variableId)) return sourceId;
        throw new IllegalArgumentException(variableId + " is not an endpoint of " + this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelationalTemplate)) return false;
        RelationalTemplate t = (RelationalTemplate) o;
        return sourceId.equals(t.sourceId) && relationType.equals(t.relationType) && targetId.equals(t.targetId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, relationType, targetId);
    }

    @Override
    public String toString() {
        return "(" + sourceId + " " + relationType + " " + targetId + ")";
    }
}
