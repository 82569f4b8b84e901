// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One instantiation per answer choice of a QA sample, drawn from the same family.
 * A choice may carry a patched mapping, a copy of its instantiation's mapping with the
 * answer term replaced; otherwise the instantiation's own mapping applies.
 */
public final class QAGroup {
    private final String identifier;
    private final ImmutableMap<String, String> dataIds;  // label -> instantiation id
    private final ImmutableMap<String, ImmutableMap<String, String>> patchedMappings;  // label -> mapping

    public QAGroup(String identifier,
                   Map<String, String> dataIds,
                   Map<String, ? extends Map<String, String>> patchedMappings) {
        this.identifier = Objects.requireNonNull(identifier);
        this.dataIds = ImmutableMap.copyOf(dataIds);
        ImmutableMap.Builder<String, ImmutableMap<String, String>> b = ImmutableMap.builder();
        for (Map.Entry<String, ? extends Map<String, String>> e : patchedMappings.entrySet()) {
            if (!this.dataIds.containsKey(e.getKey())) {
                throw new IllegalArgumentException("patched mapping for unknown label: " + e.getKey());
            }
            b.put(e.getKey(), ImmutableMap.copyOf(e.getValue()));
        }
        this.patchedMappings = b.build();
    }

    public String identifier() { return identifier; }
    public ImmutableMap<String, String> dataIds() { return dataIds; }

    public Optional<ImmutableMap<String, String>> patchedMapping(String label) {
        return Optional.ofNullable(patchedMappings.get(label));
    }

    /**
     * @return the mapping that instantiates the tree for the given answer choice
     * @throws IllegalArgumentException if the label is not part of this group
     */
    public ImmutableMap<String, String> mapping(String label, InstantiationForest forest) {
        ImmutableMap<String, String> patched = patchedMappings.get(label);
        if (patched != null) return patched;
        String id = dataIds.get(label);
        if (id == null) throw new IllegalArgumentException("no instantiation for label " + label + " in " + identifier);
        InstantiationData d = forest.dataMap().get(id);
        if (d == null) throw new IllegalStateException("instantiation " + id + " not in forest");
        return d.mapping();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QAGroup)) return false;
        QAGroup g = (QAGroup) o;
        return identifier.equals(g.identifier) && dataIds.equals(g.dataIds) && patchedMappings.equals(g.patchedMappings);
    }

    @Override
    public int hashCode() { return Objects.hash(identifier, dataIds, patchedMappings); }

    @Override
    public String toString() { return identifier + " " + dataIds + (patchedMappings.isEmpty() ? "" : " " + patchedMappings); }
}
