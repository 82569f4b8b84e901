// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.MultimapBuilder;
import net.littleredcomputer.chains.SGBRandom;
import net.littleredcomputer.chains.base.InstantiationData;
import net.littleredcomputer.chains.base.InstantiationFamily;
import net.littleredcomputer.chains.base.InstantiationForest;
import net.littleredcomputer.chains.base.QAData;
import net.littleredcomputer.chains.base.QAGroup;
import net.littleredcomputer.chains.search.BeamSearchProtocol;
import net.littleredcomputer.chains.search.TermFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Assembles the instantiations of one family into QA groups, one instantiation per
 * answer choice.
 * <p>
 * Instantiations that agree on everything but their mapping (pairing, answer variable,
 * anti-factual set, templates) form a candidate set. With in-line anti-factual search
 * each choice has instantiations of its own, recognized by the answer term in the
 * mapping; groups take one of each. With post hoc search every instantiation holds the
 * correct answer, so the other choices are copies with the answer term patched.
 * <p>
 * An optional relatedness test restricts which instantiations may share a group with
 * the one holding the correct answer.
 */
public class QAGroupTransform {
    private static final Logger log = LogManager.getFormatterLogger(QAGroupTransform.class);

    private final BeamSearchProtocol protocol;
    private final TermFormatter formatter;
    private final String language;
    private final SGBRandom random;
    @Nullable private final BiPredicate<InstantiationData, InstantiationData> related;
    private int nextId = 0;

    public QAGroupTransform(BeamSearchProtocol protocol, TermFormatter formatter, String language, SGBRandom random) {
        this(protocol, formatter, language, random, null);
    }

    /**
     * @param related decides whether a second instantiation may join the group of one
     *                holding the correct answer; null admits any
     */
    public QAGroupTransform(BeamSearchProtocol protocol,
                            TermFormatter formatter,
                            String language,
                            SGBRandom random,
                            @Nullable BiPredicate<InstantiationData, InstantiationData> related) {
        this.protocol = protocol;
        this.formatter = formatter;
        this.language = language;
        this.random = random;
        this.related = related;
    }

    /**
     * Relates two instantiations whose mappings differ in one of the given numbers of
     * variables. A list of negative values stands for no restriction.
     *
     * @return the relatedness test, or empty if there is no restriction
     * @throws IllegalArgumentException if the list is empty or mixes negative and
     * non-negative values
     */
    public static Optional<BiPredicate<InstantiationData, InstantiationData>> mappingDistanceIn(
            Collection<Integer> distances, boolean countAnswerIds, boolean countPairingIds) {
        if (distances.isEmpty()) throw new IllegalArgumentException("no mapping distances given");
        boolean negative = distances.stream().anyMatch(d -> d < 0);
        boolean nonNegative = distances.stream().anyMatch(d -> d >= 0);
        if (negative && nonNegative) {
            throw new IllegalArgumentException("mapping distances mix negative and non-negative values: " + distances);
        }
        if (negative) return Optional.empty();
        Set<Integer> targets = ImmutableSet.copyOf(distances);
        BiPredicate<InstantiationData, InstantiationData> related =
                (d1, d2) -> targets.contains(d1.mappingDistance(d2, countAnswerIds, countPairingIds));
        return Optional.of(related);
    }

    public List<QAGroup> apply(QAData qa, InstantiationForest forest) {
        List<QAGroup> groups = new ArrayList<>();
        for (InstantiationFamily family : forest.families()) groups.addAll(apply(qa, forest, family));
        log.info("%d groups for %s", groups.size(), qa.identifier());
        return groups;
    }

    /**
     * @return the groups of one family, identified {@code G0, G1, ...} across calls
     */
    public List<QAGroup> apply(QAData qa, InstantiationForest forest, InstantiationFamily family) {
        List<QAGroup> groups = new ArrayList<>();
        for (List<InstantiationData> candidates : byAllButMapping(forest.familyData(family).values())) {
            switch (protocol) {
                case AF_IN_LINE:
                    if (related == null) simpleInLine(qa, candidates, groups);
                    else relatedInLine(qa, candidates, groups);
                    break;
                case AF_POST_HOC:
                    if (related == null) simplePostHoc(qa, candidates, groups);
                    else relatedPostHoc(qa, candidates, groups);
                    break;
                default:
                    throw new IllegalArgumentException("unsupported beam search protocol: " + protocol);
            }
        }
        return groups;
    }

    static Collection<List<InstantiationData>> byAllButMapping(Collection<InstantiationData> data) {
        ListMultimap<List<Object>, InstantiationData> groups = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        for (InstantiationData d : data) {
            groups.put(ImmutableList.<Object>of(d.pairingTemplate(), d.qaTemplate(), d.pairing(), d.answerId(),
                    ImmutableSortedSet.copyOf(d.antiFactualIds())), d);
        }
        List<List<InstantiationData>> result = new ArrayList<>();
        for (Collection<InstantiationData> g : groups.asMap().values()) result.add(new ArrayList<>(g));
        return result;
    }

    /**
     * Splits the candidates by the answer choice their answer variable holds.
     *
     * @return the candidates per label in choice order, or empty if some choice has none
     */
    private Optional<Map<String, List<InstantiationData>>> byLabel(QAData qa, List<InstantiationData> candidates) {
        Map<String, List<InstantiationData>> byLabel = new LinkedHashMap<>();
        for (Map.Entry<String, String> choice : qa.answerChoices().entrySet()) {
            String term = format(choice.getValue());
            List<InstantiationData> hits = new ArrayList<>();
            for (InstantiationData d : candidates) {
                if (term.equals(d.mapping().get(d.answerId()))) hits.add(d);
            }
            if (hits.isEmpty()) {
                log.debug("no instantiation answers %s among %d candidates", choice.getKey(), candidates.size());
                return Optional.empty();
            }
            byLabel.put(choice.getKey(), hits);
        }
        return Optional.of(byLabel);
    }

    private void simpleInLine(QAData qa, List<InstantiationData> candidates, List<QAGroup> groups) {
        byLabel(qa, candidates).ifPresent(byLabel -> zip(byLabel, groups));
    }

    private void relatedInLine(QAData qa, List<InstantiationData> candidates, List<QAGroup> groups) {
        Optional<Map<String, List<InstantiationData>>> byLabel = byLabel(qa, candidates);
        if (!byLabel.isPresent()) return;
        String correctLabel = qa.correctAnswerLabel();
        for (InstantiationData correct : byLabel.get().get(correctLabel)) {
            Map<String, List<InstantiationData>> choices = new LinkedHashMap<>();
            boolean complete = true;
            for (Map.Entry<String, List<InstantiationData>> e : byLabel.get().entrySet()) {
                if (e.getKey().equals(correctLabel)) {
                    choices.put(correctLabel, Lists.newArrayList(correct));
                    continue;
                }
                List<InstantiationData> others = new ArrayList<>();
                for (InstantiationData other : e.getValue()) {
                    if (related.test(correct, other)) others.add(other);
                }
                if (others.isEmpty()) {
                    complete = false;
                    break;
                }
                choices.put(e.getKey(), others);
            }
            if (complete) zip(choices, groups);
        }
    }

    /**
     * Shuffles each label's candidates, then takes the i-th of every label for the i-th
     * group until some label runs out.
     */
    private void zip(Map<String, List<InstantiationData>> byLabel, List<QAGroup> groups) {
        int n = Integer.MAX_VALUE;
        for (List<InstantiationData> l : byLabel.values()) {
            random.shuffle(l);
            n = Math.min(n, l.size());
        }
        for (int i = 0; i < n; ++i) {
            ImmutableMap.Builder<String, String> ids = ImmutableMap.builder();
            for (Map.Entry<String, List<InstantiationData>> e : byLabel.entrySet()) {
                ids.put(e.getKey(), e.getValue().get(i).identifier());
            }
            groups.add(new QAGroup("G" + nextId++, ids.build(), ImmutableMap.<String, Map<String, String>>of()));
        }
    }

    private void simplePostHoc(QAData qa, List<InstantiationData> candidates, List<QAGroup> groups) {
        for (InstantiationData d : candidates) {
            ImmutableMap.Builder<String, String> ids = ImmutableMap.builder();
            Map<String, Map<String, String>> patched = new LinkedHashMap<>();
            for (Map.Entry<String, String> choice : qa.answerChoices().entrySet()) {
                ids.put(choice.getKey(), d.identifier());
                patched.put(choice.getKey(), withAnswer(d, choice.getValue()));
            }
            groups.add(new QAGroup("G" + nextId++, ids.build(), patched));
        }
    }

    /**
     * Each candidate in turn holds the correct answer; the related others are taken in
     * batches, one per wrong choice, and patched with that choice's term. A short last
     * batch is dropped.
     */
    private void relatedPostHoc(QAData qa, List<InstantiationData> candidates, List<QAGroup> groups) {
        random.shuffle(candidates);
        String correctLabel = qa.correctAnswerLabel();
        List<String> wrongLabels = new ArrayList<>(qa.answerChoices().keySet());
        wrongLabels.remove(correctLabel);
        final int batchSize = wrongLabels.size();
        if (batchSize == 0) return;
        for (InstantiationData correct : candidates) {
            List<InstantiationData> others = new ArrayList<>();
            for (InstantiationData other : candidates) {
                if (other != correct && related.test(correct, other)) others.add(other);
            }
            for (int start = 0; start + batchSize <= others.size(); start += batchSize) {
                ImmutableMap.Builder<String, String> ids = ImmutableMap.builder();
                Map<String, Map<String, String>> patched = new LinkedHashMap<>();
                ids.put(correctLabel, correct.identifier());
                for (int i = 0; i < batchSize; ++i) {
                    String label = wrongLabels.get(i);
                    InstantiationData other = others.get(start + i);
                    ids.put(label, other.identifier());
                    patched.put(label, withAnswer(other, qa.answerChoices().get(label)));
                }
                groups.add(new QAGroup("G" + nextId++, ids.build(), patched));
            }
        }
    }

    private Map<String, String> withAnswer(InstantiationData d, String term) {
        Map<String, String> m = new LinkedHashMap<>(d.mapping());
        m.put(d.answerId(), format(term));
        return m;
    }

    private String format(String term) {
        return formatter.format(term, language);
    }
}
