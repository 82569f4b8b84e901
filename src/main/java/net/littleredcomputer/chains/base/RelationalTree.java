// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import java.util.List;

/**
 * Relational templates with shared variable identifiers. Valid trees form a poly-tree
 * over their variables; the engine never builds any other kind.
 */
public final class RelationalTree {
    private final ImmutableList<RelationalTemplate> templates;

    public RelationalTree(List<RelationalTemplate> templates) {
        this.templates = ImmutableList.copyOf(templates);
    }

    public ImmutableList<RelationalTemplate> templates() { return templates; }

    public int size() { return templates.size(); }

    /**
     * @return every variable identifier used by this tree, in natural order
     */
    public ImmutableSortedSet<String> variableIds() {
        ImmutableSortedSet.Builder<String> b = ImmutableSortedSet.naturalOrder();
        for (RelationalTemplate t : templates) {
            b.add(t.sourceId());
            b.add(t.targetId());
        }
        return b.build();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RelationalTree && templates.equals(((RelationalTree) o).templates));
    }

    @Override
    public int hashCode() { return templates.hashCode(); }

    @Override
    public String toString() { return Joiner.on(' ').join(templates); }
}
