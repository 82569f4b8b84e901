// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * A tree variable, optionally bound to a term.
 */
public final class Variable {
    private final String identifier;
    @Nullable private final String term;

    public Variable(String identifier) { this(identifier, null); }

    public Variable(String identifier, @Nullable String term) {
        this.identifier = Objects.requireNonNull(identifier);
        this.term = term;
    }

    public String identifier() { return identifier; }
    public Optional<String> term() { return Optional.ofNullable(term); }
    public boolean isBound() { return term != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable v = (Variable) o;
        return identifier.equals(v.identifier) && Objects.equals(term, v.term);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, term);
    }

    @Override
    public String toString() {
        return term == null ? identifier : identifier + "=" + term;
    }
}
