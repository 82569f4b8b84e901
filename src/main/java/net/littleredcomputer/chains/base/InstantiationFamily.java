// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A relational tree together with the identifiers of its instantiations.
 */
public final class InstantiationFamily {
    private final RelationalTree tree;
    private final List<String> dataIds = new ArrayList<>();

    InstantiationFamily(RelationalTree tree) {
        this.tree = Objects.requireNonNull(tree);
    }

    public RelationalTree tree() { return tree; }
    public List<String> dataIds() { return Collections.unmodifiableList(dataIds); }

    void add(String dataId) { dataIds.add(dataId); }

    @Override
    public String toString() { return tree + " " + dataIds; }
}
