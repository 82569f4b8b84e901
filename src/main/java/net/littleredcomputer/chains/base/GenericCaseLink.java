// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import java.util.Objects;

/**
 * A case applied to two relation placeholders (see {@link GenericTemplate}).
 */
public final class GenericCaseLink {
    private final String relationId1;
    private final String relationId2;
    private final Case linkCase;

    public GenericCaseLink(String relationId1, String relationId2, Case linkCase) {
        this.relationId1 = Objects.requireNonNull(relationId1);
        this.relationId2 = Objects.requireNonNull(relationId2);
        this.linkCase = Objects.requireNonNull(linkCase);
    }

    public String relationId1() { return relationId1; }
    public String relationId2() { return relationId2; }
    public Case linkCase() { return linkCase; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GenericCaseLink)) return false;
        GenericCaseLink l = (GenericCaseLink) o;
        return relationId1.equals(l.relationId1) && relationId2.equals(l.relationId2) && linkCase == l.linkCase;
    }

    @Override
    public int hashCode() {
        return Objects.hash(relationId1, relationId2, linkCase);
    }

    @Override
    public String toString() {
        return relationId1 + ":" + relationId2 + ":" + linkCase;
    }
}
