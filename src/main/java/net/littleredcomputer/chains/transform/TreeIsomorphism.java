// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.transform;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.chains.base.RelationalTemplate;
import net.littleredcomputer.chains.base.RelationalTree;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Isomorphism of relational trees viewed as directed multigraphs over their variables.
 * Parallel edges u -> v match parallel edges u' -> v' when there are as many of them and
 * they carry the same set of relation types.
 */
final class TreeIsomorphism {
    private TreeIsomorphism() {}

    private static final class Edges {
        int count = 0;
        final Set<String> types = new TreeSet<>();

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Edges)) return false;
            Edges e = (Edges) o;
            return count == e.count && types.equals(e.types);
        }

        @Override
        public int hashCode() { return Objects.hash(count, types); }
    }

    private static final class Graph {
        final ImmutableList<String> nodes;
        final Map<String, Map<String, Edges>> out = new HashMap<>();
        final Map<String, Integer> inDegree = new HashMap<>();
        final Map<String, Integer> outDegree = new HashMap<>();

        Graph(RelationalTree tree) {
            nodes = tree.variableIds().asList();
            for (RelationalTemplate t : tree.templates()) {
                Edges e = out.computeIfAbsent(t.sourceId(), k -> new HashMap<>())
                        .computeIfAbsent(t.targetId(), k -> new Edges());
                ++e.count;
                e.types.add(t.relationType());
                outDegree.merge(t.sourceId(), 1, Integer::sum);
                inDegree.merge(t.targetId(), 1, Integer::sum);
            }
        }

        Edges edges(String u, String v) {
            Map<String, Edges> m = out.get(u);
            return m == null ? null : m.get(v);
        }

        int in(String u) { return inDegree.getOrDefault(u, 0); }
        int out(String u) { return outDegree.getOrDefault(u, 0); }
    }

    static boolean isomorphic(RelationalTree a, RelationalTree b) {
        if (a.size() != b.size()) return false;
        Graph ga = new Graph(a), gb = new Graph(b);
        if (ga.nodes.size() != gb.nodes.size()) return false;
        return extend(ga, gb, 0, new HashMap<>(), new HashSet<>());
    }

    private static boolean extend(Graph ga, Graph gb, int k, Map<String, String> f, Set<String> used) {
        if (k == ga.nodes.size()) return true;
        String u = ga.nodes.get(k);
        for (String v : gb.nodes) {
            if (used.contains(v) || ga.in(u) != gb.in(v) || ga.out(u) != gb.out(v)) continue;
            if (!Objects.equals(ga.edges(u, u), gb.edges(v, v))) continue;
            boolean consistent = true;
            for (Map.Entry<String, String> e : f.entrySet()) {
                String w = e.getKey(), x = e.getValue();
                if (!Objects.equals(ga.edges(u, w), gb.edges(v, x)) || !Objects.equals(ga.edges(w, u), gb.edges(x, v))) {
                    consistent = false;
                    break;
                }
            }
            if (!consistent) continue;
            f.put(u, v);
            used.add(v);
            if (extend(ga, gb, k + 1, f, used)) return true;
            f.remove(u);
            used.remove(v);
        }
        return false;
    }
}
