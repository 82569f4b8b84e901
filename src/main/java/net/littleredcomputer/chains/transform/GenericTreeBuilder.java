// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.transform;

import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.chains.base.GenericCaseLink;
import net.littleredcomputer.chains.base.GenericTemplate;
import net.littleredcomputer.chains.base.GenericTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds a generic tree from case links over relation placeholders.
 * <p>
 * Each placeholder gets a template with two fresh endpoints, numbered 2t (source) and
 * 2t+1 (target) for the t-th placeholder seen. A case link merges one endpoint of its
 * second relation into one endpoint of its first by making the first its parent. An
 * endpoint may have only one parent: two would mean it takes its term from two places.
 * Once all links are in, every endpoint is replaced by the root of its parent chain.
 * <p>
 * The result is accepted only if the graph of endpoints, with an edge per template and
 * an edge from every parented endpoint to its root, is a tree. Some cyclic link sets
 * describe sensible structures (three relations sharing one source, linked pairwise,
 * for example), but each of them has an acyclic equivalent with one link fewer, and
 * exhaustive enumeration of link sets will produce that one too; so cycles are simply
 * rejected.
 */
public class GenericTreeBuilder {
    private static final Logger log = LogManager.getFormatterLogger(GenericTreeBuilder.class);
    private static final int NONE = -1;

    /**
     * @return the tree, or empty if the links conflict or do not describe a poly-tree
     */
    public Optional<GenericTree> build(List<GenericCaseLink> caseLinks) {
        Map<String, Integer> templateIndex = new LinkedHashMap<>();
        for (GenericCaseLink l : caseLinks) {
            templateIndex.putIfAbsent(l.relationId1(), templateIndex.size());
            templateIndex.putIfAbsent(l.relationId2(), templateIndex.size());
        }
        final int n = 2 * templateIndex.size();
        if (n == 0) return Optional.empty();

        TIntArrayList parent = new TIntArrayList(n);
        for (int i = 0; i < n; ++i) parent.add(NONE);

        for (GenericCaseLink l : caseLinks) {
            int a = 2 * templateIndex.get(l.relationId1());
            int b = 2 * templateIndex.get(l.relationId2());
            int main, linked;
            switch (l.linkCase()) {
                case ZERO: continue;
                case ONE: main = a + 1; linked = b; break;
                case TWO: main = a + 1; linked = b + 1; break;
                case THREE: main = a; linked = b; break;
                case FOUR: main = a; linked = b + 1; break;
                default: throw new IllegalArgumentException("unsupported case: " + l.linkCase());
            }
            if (parent.get(linked) != NONE) {
                log.debug("rejecting %s: %s would give an endpoint a second parent", caseLinks, l);
                return Optional.empty();
            }
            if (root(parent, main) == linked) {
                log.debug("rejecting %s: %s closes a parent cycle", caseLinks, l);
                return Optional.empty();
            }
            parent.set(linked, main);
        }

        int[] representative = new int[n];
        for (int i = 0; i < n; ++i) representative[i] = compress(parent, i);

        // The endpoint graph is a tree iff it has n-1 edges and none of them closes a cycle.
        int edges = n / 2;
        for (int i = 0; i < n; ++i) if (parent.get(i) != NONE) ++edges;
        if (edges != n - 1) {
            log.debug("rejecting %s: %d edges over %d endpoints", caseLinks, edges, n);
            return Optional.empty();
        }
        TIntArrayList component = new TIntArrayList(n);
        for (int i = 0; i < n; ++i) component.add(NONE);
        for (int i = 0; i < n; i += 2) {
            if (!union(component, i, i + 1)) return rejectCycle(caseLinks);
        }
        for (int i = 0; i < n; ++i) {
            if (parent.get(i) != NONE && !union(component, i, representative[i])) return rejectCycle(caseLinks);
        }

        List<GenericTemplate> templates = new ArrayList<>();
        for (Map.Entry<String, Integer> e : templateIndex.entrySet()) {
            int t = 2 * e.getValue();
            templates.add(new GenericTemplate(name(representative[t]), e.getKey(), name(representative[t + 1])));
        }
        return Optional.of(new GenericTree(templates));
    }

    private static Optional<GenericTree> rejectCycle(List<GenericCaseLink> caseLinks) {
        log.debug("rejecting %s: endpoint graph has a cycle", caseLinks);
        return Optional.empty();
    }

    private static String name(int endpoint) {
        return "V" + endpoint;
    }

    private static int root(TIntArrayList parent, int i) {
        while (parent.get(i) != NONE) i = parent.get(i);
        return i;
    }

    private static int compress(TIntArrayList parent, int i) {
        int r = root(parent, i);
        while (parent.get(i) != NONE && parent.get(i) != r) {
            int next = parent.get(i);
            parent.set(i, r);
            i = next;
        }
        return r;
    }

    /**
     * Joins the components of i and j.
     * @return false if they were already joined
     */
    private static boolean union(TIntArrayList component, int i, int j) {
        int ri = compress(component, i), rj = compress(component, j);
        if (ri == rj) return false;
        component.set(ri, rj);
        return true;
    }
}
