// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.reduce;

/**
 * Whether the outer endpoints of a composed pair keep their order or swap.
 */
public enum ReductionOrder {
    MAINTAIN,
    REVERSE;

    public ReductionOrder inverse() {
        switch (this) {
            case MAINTAIN: return REVERSE;
            case REVERSE: return MAINTAIN;
            default: throw new IllegalArgumentException("unsupported reduction order: " + this);
        }
    }
}
