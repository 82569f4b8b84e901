// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.search;

import net.littleredcomputer.chains.base.RelationalTemplate;

import java.util.Objects;

/**
 * Asks for the terms that can stand in for queryId in template, given that the other
 * endpoint of template is bound to partnerTerm.
 */
public final class Query {
    private final RelationalTemplate template;
    private final String queryId;
    private final String partnerTerm;

    public Query(RelationalTemplate template, String queryId, String partnerTerm) {
        this.template = Objects.requireNonNull(template);
        this.queryId = Objects.requireNonNull(queryId);
        this.partnerTerm = Objects.requireNonNull(partnerTerm);
        if (!template.contains(queryId)) {
            throw new IllegalArgumentException(queryId + " is not an endpoint of " + template);
        }
    }

    public RelationalTemplate template() { return template; }
    public String queryId() { return queryId; }
    public String partnerTerm() { return partnerTerm; }

    /**
     * @return whether the queried variable is the template's source (so the partner is its target)
     */
    public boolean queriesSource() { return template.sourceId().equals(queryId); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Query)) return false;
        Query q = (Query) o;
        return template.equals(q.template) && queryId.equals(q.queryId) && partnerTerm.equals(q.partnerTerm);
    }

    @Override
    public int hashCode() { return Objects.hash(template, queryId, partnerTerm); }

    @Override
    public String toString() { return queryId + "? " + template + " with " + partnerTerm; }
}
