// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything needed to turn a relational tree into a concrete one: which tree template
 * was paired with which QA template, the answer variable, the anti-factual variables
 * and the complete variable to term mapping. Instances never change; use
 * {@link #toBuilder()} to derive a variant.
 */
public final class InstantiationData {
    @Nullable private final String identifier;
    private final RelationalTemplate pairingTemplate;
    private final Pairing pairing;
    private final Template qaTemplate;
    private final String answerId;
    private final int reasoningHops;  // -1 if unknown
    private final ImmutableList<String> antiFactualIds;
    private final ImmutableMap<String, String> mapping;

    private InstantiationData(Builder b) {
        this.identifier = b.identifier;
        this.pairingTemplate = Objects.requireNonNull(b.pairingTemplate, "pairingTemplate");
        this.pairing = Objects.requireNonNull(b.pairing, "pairing");
        this.qaTemplate = Objects.requireNonNull(b.qaTemplate, "qaTemplate");
        this.answerId = Objects.requireNonNull(b.answerId, "answerId");
        this.reasoningHops = b.reasoningHops;
        this.antiFactualIds = ImmutableList.copyOf(b.antiFactualIds);
        this.mapping = ImmutableMap.copyOf(b.mapping);
        if (antiFactualIds.contains(pairing.variableId()) || antiFactualIds.contains(answerId)) {
            throw new IllegalArgumentException("pairing and answer variables cannot be anti-factual");
        }
    }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.identifier = identifier;
        b.pairingTemplate = pairingTemplate;
        b.pairing = pairing;
        b.qaTemplate = qaTemplate;
        b.answerId = answerId;
        b.reasoningHops = reasoningHops;
        b.antiFactualIds = antiFactualIds;
        b.mapping = mapping;
        return b;
    }

    @Nullable public String identifier() { return identifier; }
    public RelationalTemplate pairingTemplate() { return pairingTemplate; }
    public Pairing pairing() { return pairing; }
    public Template qaTemplate() { return qaTemplate; }
    public String answerId() { return answerId; }
    public int reasoningHops() { return reasoningHops; }
    public ImmutableList<String> antiFactualIds() { return antiFactualIds; }
    public ImmutableMap<String, String> mapping() { return mapping; }

    /**
     * Counts the variables whose terms differ between the two mappings. Answer and
     * pairing variables (of either side) are skipped unless asked for.
     */
    public int mappingDistance(InstantiationData other, boolean countAnswerIds, boolean countPairingIds) {
        Set<String> skip = new HashSet<>();
        if (!countAnswerIds) {
            skip.add(answerId);
            skip.add(other.answerId);
        }
        if (!countPairingIds) {
            skip.add(pairing.variableId());
            skip.add(other.pairing.variableId());
        }
        int count = 0;
        for (Map.Entry<String, String> e : mapping.entrySet()) {
            if (!skip.contains(e.getKey()) && !e.getValue().equals(other.mapping.get(e.getKey()))) ++count;
        }
        return count;
    }

    /**
     * Builds the concrete tree. The pairing template takes the QA template's relation
     * rather than the one from the relation map, since the QA sample may use a variant
     * of the relation with the same type.
     *
     * @throws IllegalStateException if the pairing template is not part of the tree
     */
    public Tree instantiate(RelationalTree tree, Map<String, Relation> relationMap) {
        List<Template> templates = new ArrayList<>();
        Template paired = null;
        for (RelationalTemplate t : tree.templates()) {
            Relation r = relationMap.get(t.relationType());
            if (r == null) throw new IllegalArgumentException("unknown relation type: " + t.relationType());
            Template u = new Template(bind(t.sourceId()), r, bind(t.targetId()));
            if (t.equals(pairingTemplate)) {
                u = u.withRelation(qaTemplate.relation());
                paired = u;
            }
            templates.add(u);
        }
        if (paired == null) throw new IllegalStateException("pairing template not found in " + tree);
        return new Tree(templates, paired);
    }

    private Variable bind(String id) {
        String term = mapping.get(id);
        if (term == null) throw new IllegalStateException("no term mapped for " + id);
        return new Variable(id, term);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstantiationData)) return false;
        InstantiationData d = (InstantiationData) o;
        return Objects.equals(identifier, d.identifier)
                && pairingTemplate.equals(d.pairingTemplate)
                && pairing.equals(d.pairing)
                && qaTemplate.equals(d.qaTemplate)
                && answerId.equals(d.answerId)
                && reasoningHops == d.reasoningHops
                && antiFactualIds.equals(d.antiFactualIds)
                && mapping.equals(d.mapping);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, pairingTemplate, pairing, qaTemplate, answerId, reasoningHops, antiFactualIds, mapping);
    }

    @Override
    public String toString() {
        return String.format("%s pairing=%s answer=%s hops=%d af=%s %s",
                identifier, pairing, answerId, reasoningHops, antiFactualIds, mapping);
    }

    public static final class Builder {
        private String identifier;
        private RelationalTemplate pairingTemplate;
        private Pairing pairing;
        private Template qaTemplate;
        private String answerId;
        private int reasoningHops = -1;
        private List<String> antiFactualIds = ImmutableList.of();
        private Map<String, String> mapping = ImmutableMap.of();

        private Builder() {}

        public Builder identifier(String identifier) { this.identifier = identifier; return this; }
        public Builder pairingTemplate(RelationalTemplate t) { this.pairingTemplate = t; return this; }
        public Builder pairing(Pairing p) { this.pairing = p; return this; }
        public Builder qaTemplate(Template t) { this.qaTemplate = t; return this; }
        public Builder answerId(String id) { this.answerId = id; return this; }
        public Builder reasoningHops(int hops) { this.reasoningHops = hops; return this; }
        public Builder antiFactualIds(List<String> ids) { this.antiFactualIds = ids; return this; }
        public Builder mapping(Map<String, String> m) { this.mapping = m; return this; }

        public InstantiationData build() { return new InstantiationData(this); }
    }
}
