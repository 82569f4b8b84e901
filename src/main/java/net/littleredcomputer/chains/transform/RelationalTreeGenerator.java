// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import net.littleredcomputer.chains.ProgressReporter;
import net.littleredcomputer.chains.base.GenericTree;
import net.littleredcomputer.chains.base.Relation;
import net.littleredcomputer.chains.base.RelationalTree;
import net.littleredcomputer.chains.reduce.Reducer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns generic trees into relational trees with every possible choice of relation per
 * position, then drops isomorphic duplicates. Only trees using the same set of relation
 * types can be isomorphic, so duplicates are looked for within those groups only.
 */
public class RelationalTreeGenerator {
    private static final Logger log = LogManager.getFormatterLogger(RelationalTreeGenerator.class);

    private final List<Relation> relations;
    @Nullable private final Reducer reducer;
    private final Map<Integer, GeneratorFilter> hopFilters;
    private Duration logInterval = Duration.ofMillis(1000);

    public RelationalTreeGenerator(List<Relation> relations, @Nullable Reducer reducer, Map<Integer, GeneratorFilter> hopFilters) {
        this.relations = ImmutableList.copyOf(relations);
        this.reducer = reducer;
        this.hopFilters = hopFilters;
    }

    public RelationalTreeGenerator setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /**
     * @param trees generic trees, all of the same size
     * @return the distinct relational trees, grouped by relation type set in order of
     * first appearance
     */
    public List<RelationalTree> generate(List<GenericTree> trees) {
        if (trees.isEmpty()) return Collections.emptyList();
        final int size = trees.get(0).size();
        Map<Set<String>, List<RelationalTree>> groups = new LinkedHashMap<>();
        ProgressReporter progress = new ProgressReporter("relational").setLogInterval(logInterval);
        progress.start();
        for (List<Relation> choice : Lists.cartesianProduct(Collections.nCopies(size, relations))) {
            RelationalTransform transform = new RelationalTransform(choice, reducer, hopFilters);
            ImmutableSortedSet.Builder<String> key = ImmutableSortedSet.naturalOrder();
            for (Relation r : choice) key.add(r.type());
            List<RelationalTree> group = groups.computeIfAbsent(key.build(), k -> new ArrayList<>());
            for (GenericTree tree : trees) {
                Optional<RelationalTree> t = transform.apply(tree);
                t.ifPresent(group::add);
                progress.step(() -> group.size() + " trees in " + choice);
            }
        }
        progress.finish();
        List<RelationalTree> unique = new ArrayList<>();
        for (List<RelationalTree> group : groups.values()) unique.addAll(removeIsomorphic(group));
        log.info("%d distinct relational trees of size %d", unique.size(), size);
        return unique;
    }

    static List<RelationalTree> removeIsomorphic(List<RelationalTree> group) {
        List<RelationalTree> unique = new ArrayList<>();
        for (RelationalTree tree : group) {
            boolean duplicate = false;
            for (RelationalTree u : unique) {
                if (TreeIsomorphism.isomorphic(tree, u)) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) unique.add(tree);
        }
        return unique;
    }
}
