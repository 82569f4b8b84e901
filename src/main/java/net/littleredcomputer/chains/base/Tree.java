// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A fully instantiated tree, remembering which of its templates was paired with the
 * QA sample.
 */
public final class Tree {
    private final ImmutableList<Template> templates;
    private final Template pairingTemplate;

    public Tree(List<Template> templates, Template pairingTemplate) {
        this.templates = ImmutableList.copyOf(templates);
        this.pairingTemplate = Objects.requireNonNull(pairingTemplate);
        if (!this.templates.contains(pairingTemplate)) {
            throw new IllegalArgumentException("pairing template is not part of the tree");
        }
    }

    public ImmutableList<Template> templates() { return templates; }
    public Template pairingTemplate() { return pairingTemplate; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tree)) return false;
        Tree t = (Tree) o;
        return templates.equals(t.templates) && pairingTemplate.equals(t.pairingTemplate);
    }

    @Override
    public int hashCode() { return Objects.hash(templates, pairingTemplate); }

    @Override
    public String toString() { return templates.toString(); }
}
