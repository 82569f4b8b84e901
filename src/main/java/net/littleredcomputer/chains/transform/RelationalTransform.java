// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.chains.base.GenericTemplate;
import net.littleredcomputer.chains.base.GenericTree;
import net.littleredcomputer.chains.base.Relation;
import net.littleredcomputer.chains.base.RelationalTemplate;
import net.littleredcomputer.chains.base.RelationalTree;
import net.littleredcomputer.chains.reduce.Reducer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gives each template of a generic tree a relation type, position by position. With a
 * reducer, the resulting tree is also passed through the filter registered for its
 * maximum reasoning hop count (trees whose count has no filter are always kept).
 */
public class RelationalTransform {
    private static final Logger log = LogManager.getFormatterLogger(RelationalTransform.class);

    private final ImmutableList<Relation> relations;
    @Nullable private final Reducer reducer;
    private final ImmutableMap<Integer, GeneratorFilter> hopFilters;

    public RelationalTransform(List<Relation> relations, @Nullable Reducer reducer, Map<Integer, GeneratorFilter> hopFilters) {
        this.relations = ImmutableList.copyOf(relations);
        this.reducer = reducer;
        this.hopFilters = ImmutableMap.copyOf(hopFilters);
    }

    /**
     * @return the relational tree, or empty if it was filtered out
     * @throws IllegalArgumentException if the tree and relation list differ in length
     */
    public Optional<RelationalTree> apply(GenericTree tree) {
        if (tree.size() != relations.size()) {
            throw new IllegalArgumentException("number of relations must match number of tree templates");
        }
        List<RelationalTemplate> templates = new ArrayList<>();
        for (int i = 0; i < relations.size(); ++i) {
            GenericTemplate t = tree.templates().get(i);
            templates.add(t.withRelationType(relations.get(i).type()));
        }
        RelationalTree result = new RelationalTree(templates);
        if (reducer == null) return Optional.of(result);
        int hops = reducer.maxReasoningHops(result);
        if (hopFilters.getOrDefault(hops, GeneratorFilter.passAll()).passes()) return Optional.of(result);
        log.debug("filtered out %s (max hops %d)", result, hops);
        return Optional.empty();
    }
}
