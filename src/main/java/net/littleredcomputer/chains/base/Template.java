// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import java.util.Objects;

/**
 * A fully resolved (source, relation, target) triple.
 */
public final class Template {
    private final Variable source;
    private final Relation relation;
    private final Variable target;

    public Template(Variable source, Relation relation, Variable target) {
        this.source = Objects.requireNonNull(source);
        this.relation = Objects.requireNonNull(relation);
        this.target = Objects.requireNonNull(target);
    }

    public Variable source() { return source; }
    public Relation relation() { return relation; }
    public Variable target() { return target; }

    public Template withRelation(Relation r) {
        return new Template(source, r, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Template)) return false;
        Template t = (Template) o;
        return source.equals(t.source) && relation.equals(t.relation) && target.equals(t.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, relation, target);
    }

    @Override
    public String toString() {
        return "(" + source + " " + relation + " " + target + ")";
    }
}
