// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import net.littleredcomputer.chains.base.RelationalTemplate;
import net.littleredcomputer.chains.base.RelationalTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finds term assignments for every variable of a relational tree, starting from a seed
 * mapping (normally the pairing and answer variables).
 * <p>
 * The search grows the mapping one frontier at a time. The frontier is the set of
 * unmapped variables linked by some template to a mapped one. For each frontier
 * variable, every template linking it to a mapped partner is turned into a
 * {@link Query}; the sorter intersects and ranks the results and the best topK
 * survive. Every combination of surviving candidates across the frontier is then
 * explored depth first. Mappings that give one term to two variables are dropped as
 * soon as they appear, and a complete mapping is re-checked template by template
 * before it is produced.
 * <p>
 * Results are produced lazily; consumers may stop at any point.
 */
public class BeamSearch {
    private static final Logger log = LogManager.getFormatterLogger(BeamSearch.class);

    private final Instantiator factual;
    private final Instantiator antiFactual;
    private final BeamSearchProtocol protocol;
    private final QueryResultSorter sorter;
    private final int topK;

    /**
     * @param topK maximum number of candidates kept per frontier variable; 0 keeps all
     */
    public BeamSearch(Instantiator factual,
                      Instantiator antiFactual,
                      BeamSearchProtocol protocol,
                      QueryResultSorter sorter,
                      int topK) {
        if (topK < 0) throw new IllegalArgumentException("topK must be nonnegative");
        this.factual = factual;
        this.antiFactual = antiFactual;
        this.protocol = protocol;
        this.sorter = sorter;
        this.topK = topK;
    }

    public BeamSearchProtocol protocol() { return protocol; }

    /**
     * @param tree the tree to instantiate
     * @param antiFactualIds variables to instantiate anti-factually (may be empty)
     * @param seedMapping the variables fixed in advance and their terms
     * @return complete mappings with pairwise distinct terms
     */
    public Stream<Map<String, String>> search(RelationalTree tree,
                                              Collection<String> antiFactualIds,
                                              Map<String, String> seedMapping) {
        Set<String> variables = tree.variableIds();
        for (String id : seedMapping.keySet()) {
            if (!variables.contains(id)) throw new IllegalArgumentException("seed variable not in tree: " + id);
        }
        ImmutableSet<String> af = ImmutableSet.copyOf(antiFactualIds);
        switch (protocol) {
            case AF_IN_LINE:
                return expand(tree, af, seedMapping, true);
            case AF_POST_HOC:
                return expand(tree, af, seedMapping, false).flatMap(m -> antiFactualVariants(tree, af, m));
            default:
                throw new IllegalArgumentException("unsupported beam search protocol: " + protocol);
        }
    }

    private Stream<Map<String, String>> expand(RelationalTree tree,
                                               Set<String> antiFactualIds,
                                               Map<String, String> seedMapping,
                                               boolean inLine) {
        return StreamSupport.stream(new Expansion(tree, antiFactualIds, seedMapping, inLine), false);
    }

    /**
     * Replaces the anti-factual variables of a factual mapping by every valid
     * combination of anti-factual terms.
     */
    private Stream<Map<String, String>> antiFactualVariants(RelationalTree tree,
                                                            Set<String> antiFactualIds,
                                                            Map<String, String> mapping) {
        if (antiFactualIds.isEmpty()) {
            return hasDistinctTerms(mapping) ? Stream.of(mapping) : Stream.empty();
        }
        List<String> keys = ImmutableList.copyOf(antiFactualIds);
        List<List<String>> values = Lists.newArrayListWithCapacity(keys.size());
        for (String id : keys) {
            sorter.newCollection(InstantiatorVariant.ANTI_FACTUAL);
            String existing = mapping.get(id);
            for (RelationalTemplate t : tree.templates()) {
                if (!t.contains(id)) continue;
                Query q = new Query(t, id, mapping.get(t.partnerOf(id)));
                sorter.addQueryResult(antiFactual.query(q), q, existing);
            }
            values.add(truncate(sorter.sortCollection()));
        }
        return Lists.cartesianProduct(values).stream()
                .map(combination -> overlay(mapping, keys, combination))
                .filter(BeamSearch::hasDistinctTerms);
    }

    private List<String> truncate(List<String> ranked) {
        ImmutableList<String> distinct = ImmutableSet.copyOf(ranked).asList();
        return 0 < topK && topK < distinct.size() ? distinct.subList(0, topK) : distinct;
    }

    private static Map<String, String> overlay(Map<String, String> base, List<String> keys, List<String> values) {
        Map<String, String> m = new LinkedHashMap<>(base);
        for (int i = 0; i < keys.size(); ++i) m.put(keys.get(i), values.get(i));
        return ImmutableMap.copyOf(m);
    }

    static boolean hasDistinctTerms(Map<String, String> mapping) {
        return new HashSet<>(mapping.values()).size() == mapping.size();
    }

    private class Expansion implements Spliterator<Map<String, String>> {
        private class Frame {
            final Map<String, String> mapping;
            final Map<String, Integer> order;  // search depth at which each variable was fixed
            final int depth;
            @Nullable final List<String> keys;  // null: nothing left to expand
            @Nullable final Iterator<List<String>> combinations;

            Frame(Map<String, String> mapping, Map<String, Integer> order, int depth,
                  @Nullable List<String> keys, @Nullable Iterator<List<String>> combinations) {
                this.mapping = mapping;
                this.order = order;
                this.depth = depth;
                this.keys = keys;
                this.combinations = combinations;
            }
        }

        private final RelationalTree tree;
        private final Set<String> antiFactualIds;
        private final boolean inLine;
        private final Deque<Frame> stack = new ArrayDeque<>();

        Expansion(RelationalTree tree, Set<String> antiFactualIds, Map<String, String> seedMapping, boolean inLine) {
            this.tree = tree;
            this.antiFactualIds = antiFactualIds;
            this.inLine = inLine;
            Map<String, Integer> order = new HashMap<>();
            for (String id : seedMapping.keySet()) order.put(id, 0);
            stack.push(frame(ImmutableMap.copyOf(seedMapping), order, 1));
        }

        private Frame frame(Map<String, String> mapping, Map<String, Integer> order, int depth) {
            Map<String, List<String>> candidates = queryFrontier(mapping);
            if (candidates.isEmpty()) return new Frame(mapping, order, depth, null, null);
            List<String> keys = ImmutableList.copyOf(candidates.keySet());
            List<List<String>> values = ImmutableList.copyOf(candidates.values());
            return new Frame(mapping, order, depth, keys, Lists.cartesianProduct(values).iterator());
        }

        @Override
        public boolean tryAdvance(Consumer<? super Map<String, String>> action) {
            while (!stack.isEmpty()) {
                Frame f = stack.peek();
                if (f.combinations == null) {
                    stack.pop();
                    if (isComplete(f.mapping) && hasDistinctTerms(f.mapping) && isValidMapping(f.mapping, f.order)) {
                        action.accept(f.mapping);
                        return true;
                    }
                    continue;
                }
                if (!f.combinations.hasNext()) {
                    stack.pop();
                    continue;
                }
                Map<String, String> m = overlay(f.mapping, f.keys, f.combinations.next());
                if (!hasDistinctTerms(m)) continue;
                Map<String, Integer> order = new HashMap<>(f.order);
                for (String k : f.keys) order.put(k, f.depth);
                stack.push(frame(m, order, f.depth + 1));
            }
            return false;
        }

        private boolean isComplete(Map<String, String> mapping) {
            if (mapping.keySet().containsAll(tree.variableIds())) return true;
            log.debug("frontier exhausted before %s was fully mapped: %s", tree, mapping);
            return false;
        }

        /**
         * @return candidate terms for each frontier variable, in frontier discovery order
         * @throws IllegalStateException if a frontier variable is linked twice to the same
         * mapped partner, which cannot happen in a poly-tree
         */
        private Map<String, List<String>> queryFrontier(Map<String, String> mapping) {
            Map<String, Map<String, RelationalTemplate>> frontier = new LinkedHashMap<>();
            for (RelationalTemplate t : tree.templates()) {
                link(frontier, mapping, t.sourceId(), t.targetId(), t);
                link(frontier, mapping, t.targetId(), t.sourceId(), t);
            }
            Map<String, List<String>> candidates = new LinkedHashMap<>();
            for (Map.Entry<String, Map<String, RelationalTemplate>> e : frontier.entrySet()) {
                String id = e.getKey();
                boolean af = inLine && antiFactualIds.contains(id);
                Instantiator instantiator = af ? antiFactual : factual;
                sorter.newCollection(af ? InstantiatorVariant.ANTI_FACTUAL : InstantiatorVariant.FACTUAL);
                for (Map.Entry<String, RelationalTemplate> p : e.getValue().entrySet()) {
                    Query q = new Query(p.getValue(), id, mapping.get(p.getKey()));
                    sorter.addQueryResult(instantiator.query(q), q, null);
                }
                List<String> c = truncate(sorter.sortCollection());
                if (c.isEmpty()) log.debug("no candidates for %s given %s", id, mapping);
                candidates.put(id, c);
            }
            return candidates;
        }

        private void link(Map<String, Map<String, RelationalTemplate>> frontier,
                          Map<String, String> mapping, String partner, String id, RelationalTemplate t) {
            if (!mapping.containsKey(partner) || mapping.containsKey(id)) return;
            Map<String, RelationalTemplate> templates = frontier.computeIfAbsent(id, k -> new LinkedHashMap<>());
            if (templates.containsKey(partner)) {
                throw new IllegalStateException("relational tree has a cycle through " + id + " and " + partner + ": " + tree);
            }
            templates.put(partner, t);
        }

        /**
         * Checks every template against the factual instantiator. The variable fixed later
         * is the one the template constrained, so it decides whether the template must
         * hold (factual) or must not (anti-factual, in-line protocol only). Variables
         * fixed at the same depth must agree: both factual and the template holds, or
         * both anti-factual and it does not. Without in-line anti-factual terms every
         * template must hold.
         */
        private boolean isValidMapping(Map<String, String> mapping, Map<String, Integer> order) {
            for (RelationalTemplate t : tree.templates()) {
                String s = t.sourceId(), d = t.targetId();
                Query q = new Query(t, s, mapping.get(d));
                boolean holds = factual.query(q).contains(mapping.get(s));
                int os = order.get(s), od = order.get(d);
                boolean ok;
                if (os != od) {
                    String later = os > od ? s : d;
                    ok = inLine && antiFactualIds.contains(later) ? !holds : holds;
                } else if (inLine) {
                    boolean as = antiFactualIds.contains(s), ad = antiFactualIds.contains(d);
                    ok = as == ad && (as ? !holds : holds);
                } else {
                    ok = holds;
                }
                if (!ok) {
                    log.debug("rejecting %s: %s fails", mapping, t);
                    return false;
                }
            }
            return true;
        }

        @Override
        public Spliterator<Map<String, String>> trySplit() {
            return null;
        }

        @Override
        public long estimateSize() {
            return Long.MAX_VALUE;
        }

        @Override
        public int characteristics() {
            return NONNULL;
        }
    }
}
