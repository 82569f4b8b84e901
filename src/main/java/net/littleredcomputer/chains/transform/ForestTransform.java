// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import net.littleredcomputer.chains.ProgressReporter;
import net.littleredcomputer.chains.base.InstantiationData;
import net.littleredcomputer.chains.base.InstantiationFamily;
import net.littleredcomputer.chains.base.InstantiationForest;
import net.littleredcomputer.chains.base.Pairing;
import net.littleredcomputer.chains.base.QAData;
import net.littleredcomputer.chains.base.RelationalTemplate;
import net.littleredcomputer.chains.base.RelationalTree;
import net.littleredcomputer.chains.base.Template;
import net.littleredcomputer.chains.reduce.AnswerId;
import net.littleredcomputer.chains.reduce.Reducer;
import net.littleredcomputer.chains.search.BeamSearch;
import net.littleredcomputer.chains.search.TermFormatter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Instantiates relational trees against one QA sample.
 * <p>
 * For each tree, every template whose relation type matches one of the sample's pairing
 * templates is paired with it; the tree variable on the bound side takes the sample's
 * term. Every variable reachable from there is a candidate answer, and every subset of
 * the remaining variables is tried as the anti-factual set. Each combination is handed
 * to the beam search, and each mapping it produces becomes one {@link InstantiationData}.
 * A tree gets a family in the forest only once it has at least one instantiation.
 */
public class ForestTransform {
    private static final Logger log = LogManager.getFormatterLogger(ForestTransform.class);

    @Nullable private final Reducer reducer;
    private final BeamSearch beamSearch;
    private final TermFormatter formatter;
    private final String language;
    private final GeneratorFilter pairingFilter;
    private final GeneratorFilter antiFactualFilter;
    private final ForestStatistics statistics = new ForestStatistics();
    private Duration logInterval = Duration.ofMillis(1000);
    private int nextId = 0;

    public ForestTransform(@Nullable Reducer reducer,
                           BeamSearch beamSearch,
                           TermFormatter formatter,
                           String language) {
        this(reducer, beamSearch, formatter, language, GeneratorFilter.passAll(), GeneratorFilter.passAll());
    }

    /**
     * @param reducer finds answer variables; if null, every other variable is an answer
     * @param pairingFilter thins out (pairing, answer) combinations
     * @param antiFactualFilter thins out anti-factual sets
     */
    public ForestTransform(@Nullable Reducer reducer,
                           BeamSearch beamSearch,
                           TermFormatter formatter,
                           String language,
                           GeneratorFilter pairingFilter,
                           GeneratorFilter antiFactualFilter) {
        this.reducer = reducer;
        this.beamSearch = beamSearch;
        this.formatter = formatter;
        this.language = language;
        this.pairingFilter = pairingFilter;
        this.antiFactualFilter = antiFactualFilter;
    }

    public ForestTransform setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    public ForestStatistics statistics() { return statistics; }

    public InstantiationForest apply(Iterable<RelationalTree> trees, QAData qa) {
        InstantiationForest forest = new InstantiationForest();
        ProgressReporter progress = new ProgressReporter("forest " + qa.identifier()).setLogInterval(logInterval);
        progress.start();
        for (RelationalTree tree : trees) {
            statistics.treeSeen();
            InstantiationFamily family = null;
            for (InstantiationData d : instantiate(tree, qa)) {
                if (family == null) {
                    family = forest.addFamily(tree);
                    statistics.familyCreated();
                }
                forest.addData(family, d);
            }
            progress.step(() -> forest.dataMap().size() + " instantiations");
        }
        progress.finish();
        statistics.log();
        return forest;
    }

    /**
     * The pairing records the QA term as formatted for the language, so it compares
     * directly with the terms in the mappings.
     *
     * @return every instantiation of the tree against the sample, freshly identified
     */
    List<InstantiationData> instantiate(RelationalTree tree, QAData qa) {
        List<InstantiationData> result = new ArrayList<>();
        for (Template qaTemplate : qa.pairingTemplates()) {
            String type = qaTemplate.relation().type();
            boolean sourceBound = qaTemplate.source().isBound();
            String qaTerm = (sourceBound ? qaTemplate.source() : qaTemplate.target()).term().get();
            for (RelationalTemplate t : tree.templates()) {
                if (!t.relationType().equals(type)) continue;
                String pairingId = sourceBound ? t.sourceId() : t.targetId();
                Pairing pairing = new Pairing(pairingId, formatter.format(qaTerm, language));
                for (AnswerId answer : answerIds(tree, t, pairingId)) {
                    if (!pairingFilter.passes()) continue;
                    statistics.pairingFound(answer.reasoningHops());
                    instantiatePairing(tree, t, qaTemplate, pairing, answer, qa, result);
                }
            }
        }
        return result;
    }

    private void instantiatePairing(RelationalTree tree,
                                    RelationalTemplate pairingTemplate,
                                    Template qaTemplate,
                                    Pairing pairing,
                                    AnswerId answer,
                                    QAData qa,
                                    List<InstantiationData> result) {
        Set<String> remaining = tree.variableIds().stream()
                .filter(id -> !id.equals(pairing.variableId()) && !id.equals(answer.variableId()))
                .collect(ImmutableSet.toImmutableSet());
        for (int k = 0; k <= remaining.size(); ++k) {
            for (Set<String> af : Sets.combinations(remaining, k)) {
                if (!antiFactualFilter.passes()) continue;
                List<String> antiFactualIds = ImmutableList.copyOf(af);
                ForestStatistics.Bin bin = new ForestStatistics.Bin(antiFactualIds.size(), answer.reasoningHops());
                statistics.searchAttempted(bin);
                for (Map<String, String> seed : seeds(pairing, answer, qa)) {
                    beamSearch.search(tree, antiFactualIds, seed).forEach(mapping -> {
                        InstantiationData d = InstantiationData.builder()
                                .identifier("I" + nextId++)
                                .pairingTemplate(pairingTemplate)
                                .pairing(pairing)
                                .qaTemplate(qaTemplate)
                                .answerId(answer.variableId())
                                .reasoningHops(answer.reasoningHops())
                                .antiFactualIds(antiFactualIds)
                                .mapping(mapping)
                                .build();
                        log.debug("instantiated %s", d);
                        statistics.instantiated(bin);
                        result.add(d);
                    });
                }
            }
        }
    }

    /**
     * The reducer may reach the same answer variable by the same number of hops along
     * different paths; such repeats are collapsed into one answer.
     */
    private List<AnswerId> answerIds(RelationalTree tree, RelationalTemplate pairingTemplate, String pairingId) {
        if (reducer != null) {
            return reducer.validAnswerIds(tree, pairingTemplate, pairingId)
                    .filter(a -> !a.variableId().equals(pairingId))
                    .distinct()
                    .collect(Collectors.toList());
        }
        return tree.variableIds().stream()
                .filter(id -> !id.equals(pairingId))
                .map(id -> new AnswerId(id, -1))
                .collect(Collectors.toList());
    }

    /**
     * In-line anti-factual search is seeded once per answer choice; post hoc search
     * only with the correct answer.
     */
    private List<Map<String, String>> seeds(Pairing pairing, AnswerId answer, QAData qa) {
        List<String> terms;
        switch (beamSearch.protocol()) {
            case AF_IN_LINE:
                terms = ImmutableList.copyOf(qa.answerChoices().values());
                break;
            case AF_POST_HOC:
                terms = ImmutableList.of(qa.correctAnswer());
                break;
            default:
                throw new IllegalArgumentException("unsupported beam search protocol: " + beamSearch.protocol());
        }
        List<Map<String, String>> seeds = new ArrayList<>();
        for (String term : terms) {
            String answerTerm = formatter.format(term, language);
            if (answerTerm.equals(pairing.term())) {
                log.debug("answer %s coincides with pairing term", answerTerm);
                continue;
            }
            seeds.add(ImmutableMap.of(pairing.variableId(), pairing.term(), answer.variableId(), answerTerm));
        }
        return seeds;
    }
}
