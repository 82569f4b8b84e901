// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Relation placeholders whose shared variables form a poly-tree. Instances come out of
 * the generic tree builder, which is where the poly-tree property is checked.
 */
public final class GenericTree {
    private final ImmutableList<GenericTemplate> templates;

    public GenericTree(List<GenericTemplate> templates) {
        this.templates = ImmutableList.copyOf(templates);
    }

    public ImmutableList<GenericTemplate> templates() { return templates; }

    public int size() { return templates.size(); }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof GenericTree && templates.equals(((GenericTree) o).templates));
    }

    @Override
    public int hashCode() { return templates.hashCode(); }

    @Override
    public String toString() { return Joiner.on(' ').join(templates); }
}
