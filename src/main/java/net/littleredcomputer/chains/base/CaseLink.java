// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.base;

import java.util.Objects;

/**
 * A case applied to two relation types, independently of any particular variables.
 */
public final class CaseLink {
    private final String type1;
    private final String type2;
    private final Case linkCase;

    public CaseLink(String type1, String type2, Case linkCase) {
        this.type1 = Objects.requireNonNull(type1);
        this.type2 = Objects.requireNonNull(type2);
        this.linkCase = Objects.requireNonNull(linkCase);
    }

    public String type1() { return type1; }
    public String type2() { return type2; }
    public Case linkCase() { return linkCase; }

    /**
     * @return the same link seen with the two relations swapped
     */
    public CaseLink equivalent() {
        return new CaseLink(type2, type1, linkCase.equivalent());
    }

    /**
     * Classifies how two templates share an endpoint. A template linked to itself, or a
     * pair of templates sharing more than one endpoint, has no single classification
     * and is rejected.
     *
     * @throws IllegalArgumentException on circular configurations
     */
    public static CaseLink fromTemplates(RelationalTemplate t1, RelationalTemplate t2) {
        String s1 = t1.sourceId(), d1 = t1.targetId();
        String s2 = t2.sourceId(), d2 = t2.targetId();
        Case c;
        if (d1.equals(s2)) {
            if (s1.equals(d1) || s1.equals(d2) || d2.equals(s2)) throw circular(t1, t2);
            c = Case.ONE;
        } else if (d1.equals(d2)) {
            if (s1.equals(d1) || s1.equals(s2) || s2.equals(d2)) throw circular(t1, t2);
            c = Case.TWO;
        } else if (s1.equals(s2)) {
            if (d1.equals(s1) || d1.equals(d2) || d2.equals(s2)) throw circular(t1, t2);
            c = Case.THREE;
        } else if (s1.equals(d2)) {
            if (d1.equals(s1) || d1.equals(s2) || s2.equals(d2)) throw circular(t1, t2);
            c = Case.FOUR;
        } else {
            if (s1.equals(d1) || s2.equals(d2)) throw circular(t1, t2);
            c = Case.ZERO;
        }
        return new CaseLink(t1.relationType(), t2.relationType(), c);
    }

    private static IllegalArgumentException circular(RelationalTemplate t1, RelationalTemplate t2) {
        return new IllegalArgumentException("circular template link: " + t1 + " " + t2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaseLink)) return false;
        CaseLink l = (CaseLink) o;
        return type1.equals(l.type1) && type2.equals(l.type2) && linkCase == l.linkCase;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type1, type2, linkCase);
    }

    @Override
    public String toString() {
        return "(" + type1 + " " + type2 + " " + linkCase + ")";
    }
}
