// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.reduce;

import java.util.Objects;

/**
 * A variable reachable as an answer, and the number of reductions it took to get there
 * (-1 when no reducer was involved).
 */
public final class AnswerId {
    private final String variableId;
    private final int reasoningHops;

    public AnswerId(String variableId, int reasoningHops) {
        this.variableId = Objects.requireNonNull(variableId);
        this.reasoningHops = reasoningHops;
    }

    public String variableId() { return variableId; }
    public int reasoningHops() { return reasoningHops; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnswerId)) return false;
        AnswerId a = (AnswerId) o;
        return variableId.equals(a.variableId) && reasoningHops == a.reasoningHops;
    }

    @Override
    public int hashCode() { return Objects.hash(variableId, reasoningHops); }

    @Override
    public String toString() { return variableId + "@" + reasoningHops; }
}
