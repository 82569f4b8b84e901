// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

public enum InstantiatorVariant {
    FACTUAL,
    ANTI_FACTUAL,
}
