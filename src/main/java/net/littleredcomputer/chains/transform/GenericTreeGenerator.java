// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import net.littleredcomputer.chains.base.Case;
import net.littleredcomputer.chains.base.GenericCaseLink;
import net.littleredcomputer.chains.base.GenericTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Enumerates the generic trees with a given number of relations: every assignment of
 * a {@link Case} to every pair of placeholders R0..R(n-1) is tried, and those that the
 * {@link GenericTreeBuilder} accepts are kept.
 */
public class GenericTreeGenerator {
    private final GenericTreeBuilder builder = new GenericTreeBuilder();
    private final GeneratorFilter filter;

    public GenericTreeGenerator() { this(GeneratorFilter.passAll()); }

    /**
     * @param filter applied to case link assignments before they are built
     */
    public GenericTreeGenerator(GeneratorFilter filter) {
        this.filter = filter;
    }

    public static List<String> relationIds(int size) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < size; ++i) ids.add("R" + i);
        return ids;
    }

    /**
     * @return valid trees, lazily; assignments are visited with the first pair's case
     * varying slowest
     */
    public Stream<GenericTree> generate(int size) {
        if (size < 2) throw new IllegalArgumentException("trees need at least two relations");
        List<String> ids = relationIds(size);
        List<String[]> pairs = new ArrayList<>();
        for (int i = 0; i < size; ++i) {
            for (int j = i + 1; j < size; ++j) pairs.add(new String[]{ids.get(i), ids.get(j)});
        }
        List<List<Case>> assignments = Lists.cartesianProduct(
                Collections.nCopies(pairs.size(), ImmutableList.copyOf(Case.values())));
        return filter.filter(assignments.stream().map(cases -> {
                    List<GenericCaseLink> links = new ArrayList<>(cases.size());
                    for (int k = 0; k < cases.size(); ++k) {
                        links.add(new GenericCaseLink(pairs.get(k)[0], pairs.get(k)[1], cases.get(k)));
                    }
                    return links;
                }))
                .map(builder::build)
                .filter(Optional::isPresent)
                .map(Optional::get);
    }
}
