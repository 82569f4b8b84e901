// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.transform;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Counters kept while a forest is built.
 */
public class ForestStatistics {
    private static final Logger log = LogManager.getFormatterLogger(ForestStatistics.class);

    /** Anti-factual set size and reasoning hop count of one search. */
    public static final class Bin implements Comparable<Bin> {
        private final int antiFactualCount;
        private final int reasoningHops;

        public Bin(int antiFactualCount, int reasoningHops) {
            this.antiFactualCount = antiFactualCount;
            this.reasoningHops = reasoningHops;
        }

        public int antiFactualCount() { return antiFactualCount; }
        public int reasoningHops() { return reasoningHops; }

        @Override
        public int compareTo(Bin o) {
            int c = Integer.compare(antiFactualCount, o.antiFactualCount);
            return c != 0 ? c : Integer.compare(reasoningHops, o.reasoningHops);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Bin)) return false;
            Bin b = (Bin) o;
            return antiFactualCount == b.antiFactualCount && reasoningHops == b.reasoningHops;
        }

        @Override
        public int hashCode() { return Objects.hash(antiFactualCount, reasoningHops); }

        @Override
        public String toString() { return "af=" + antiFactualCount + ",hops=" + reasoningHops; }
    }

    private int trees;
    private int familiesCreated;
    private final Multiset<Integer> pairings = HashMultiset.create();
    private final Multiset<Bin> attempts = HashMultiset.create();
    private final Multiset<Bin> instantiations = HashMultiset.create();

    void treeSeen() { ++trees; }
    void familyCreated() { ++familiesCreated; }
    void pairingFound(int reasoningHops) { pairings.add(reasoningHops); }
    void searchAttempted(Bin bin) { attempts.add(bin); }
    void instantiated(Bin bin) { instantiations.add(bin); }

    public int trees() { return trees; }
    public int families() { return familiesCreated; }
    public ImmutableMultiset<Integer> pairingsByHops() { return ImmutableMultiset.copyOf(pairings); }
    public ImmutableMultiset<Bin> attempts() { return ImmutableMultiset.copyOf(attempts); }
    public ImmutableMultiset<Bin> instantiations() { return ImmutableMultiset.copyOf(instantiations); }

    public void log() {
        log.info("%d trees, %d families, %d pairings, %d searches, %d instantiations",
                trees, familiesCreated, pairings.size(), attempts.size(), instantiations.size());
        for (Multiset.Entry<Integer> e : ImmutableMultiset.copyOf(pairings).entrySet()) {
            log.info("  pairings at %d hops: %d", e.getElement(), e.getCount());
        }
        attempts.elementSet().stream().sorted().forEach(b ->
                log.info("  %s: %d searches, %d instantiations", b, attempts.count(b), instantiations.count(b)));
    }
}
