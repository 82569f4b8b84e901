// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

import javax.annotation.Nullable;

/**
 * Measures how far a candidate term is, semantically, from the context of the query
 * that produced it. All terms passed in are already formatted.
 */
public interface SemanticDistanceCalculator {
    double distance(String candidate, Query query, @Nullable String existingTerm);
}
