// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import java.util.Objects;

/**
 * A tree variable fixed to a term taken from a QA sample.
 */
public final class Pairing {
    private final String variableId;
    private final String term;

    public Pairing(String variableId, String term) {
        this.variableId = Objects.requireNonNull(variableId);
        this.term = Objects.requireNonNull(term);
    }

    public String variableId() { return variableId; }
    public String term() { return term; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Pairing)) return false;
        Pairing p = (Pairing) o;
        return variableId.equals(p.variableId) && term.equals(p.term);
    }

    @Override
    public int hashCode() { return Objects.hash(variableId, term); }

    @Override
    public String toString() { return variableId + "=" + term; }
}
