// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

import net.littleredcomputer.chains.SGBRandom;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps the terms common to every result and returns them in random order.
 */
public class RandomUnSorter implements QueryResultSorter {
    private final SGBRandom random;
    @Nullable private TreeSet<String> common;
    private boolean open = false;

    public RandomUnSorter(SGBRandom random) {
        this.random = random;
    }

    @Override
    public void newCollection(InstantiatorVariant variant) {
        common = null;
        open = true;
    }

    @Override
    public void addQueryResult(Set<String> result, Query query, @Nullable String existingTerm) {
        if (!open) throw new IllegalStateException("no open collection");
        if (common == null) common = new TreeSet<>(result);
        else common.retainAll(result);
    }

    @Override
    public List<String> sortCollection() {
        if (!open) throw new IllegalStateException("no open collection");
        // Sorting first makes the shuffle depend only on the seed.
        List<String> terms = common == null ? new ArrayList<>() : new ArrayList<>(common);
        random.shuffle(terms);
        common = null;
        open = false;
        return terms;
    }
}
