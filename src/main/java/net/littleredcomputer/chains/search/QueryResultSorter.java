// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Set;

/**
 * Ranks the candidate terms for one variable. A collection is opened with
 * {@link #newCollection}, fed one query result per constraining template, and closed by
 * {@link #sortCollection}, which may only return terms present in every result fed to it,
 * best first.
 */
public interface QueryResultSorter {
    void newCollection(InstantiatorVariant variant);

    /**
     * @param existingTerm the term the variable currently holds, when a factual term is
     *                     being replaced by an anti-factual one
     */
    void addQueryResult(Set<String> result, Query query, @Nullable String existingTerm);

    List<String> sortCollection();
}
