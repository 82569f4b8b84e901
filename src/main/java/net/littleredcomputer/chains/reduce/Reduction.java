// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.reduce;

import java.util.Objects;

/**
 * The relation type two linked relations compose into, and the order of the outer
 * endpoints in the composed relation.
 */
public final class Reduction {
    private final String relationType;
    private final ReductionOrder order;

    public Reduction(String relationType, ReductionOrder order) {
        this.relationType = Objects.requireNonNull(relationType);
        this.order = Objects.requireNonNull(order);
    }

    public String relationType() { return relationType; }
    public ReductionOrder order() { return order; }

    public Reduction inverse() {
        return new Reduction(relationType, order.inverse());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reduction)) return false;
        Reduction r = (Reduction) o;
        return relationType.equals(r.relationType) && order == r.order;
    }

    @Override
    public int hashCode() { return Objects.hash(relationType, order); }

    @Override
    public String toString() { return relationType + "/" + order; }
}
