package net.littleredcomputer.chains.transform;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.chains.SGBRandom;
import net.littleredcomputer.chains.base.Case;
import net.littleredcomputer.chains.base.CaseLink;
import net.littleredcomputer.chains.base.InstantiationData;
import net.littleredcomputer.chains.base.InstantiationFamily;
import net.littleredcomputer.chains.base.InstantiationForest;
import net.littleredcomputer.chains.base.QAData;
import net.littleredcomputer.chains.base.Relation;
import net.littleredcomputer.chains.base.RelationalTemplate;
import net.littleredcomputer.chains.base.RelationalTree;
import net.littleredcomputer.chains.base.Template;
import net.littleredcomputer.chains.base.Variable;
import net.littleredcomputer.chains.reduce.Reducer;
import net.littleredcomputer.chains.reduce.Reduction;
import net.littleredcomputer.chains.reduce.ReductionOrder;
import net.littleredcomputer.chains.search.BeamSearch;
import net.littleredcomputer.chains.search.BeamSearchProtocol;
import net.littleredcomputer.chains.search.Instantiator;
import net.littleredcomputer.chains.search.Query;
import net.littleredcomputer.chains.search.RandomUnSorter;
import net.littleredcomputer.chains.search.TermFormatter;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertThat;

public class ForestTransformTest {
    private static final RelationalTemplate ab = new RelationalTemplate("A", "r1", "B");
    private static final RelationalTemplate bc = new RelationalTemplate("B", "r2", "C");
    private static final RelationalTree chain = new RelationalTree(ImmutableList.of(ab, bc));
    private static final RelationalTree unrelated = new RelationalTree(ImmutableList.of(
            new RelationalTemplate("A", "r2", "B"), new RelationalTemplate("B", "r2", "C")));
    private static final Relation r1 = new Relation("r1", "", "");
    private static final TermFormatter lowerCase = (term, language) -> term.toLowerCase();

    // cat -r1-> feline -r2-> mammal
    private static final Instantiator factual = (Query q) -> {
        String type = q.template().relationType(), term = q.partnerTerm();
        if (q.queriesSource()) {
            if (type.equals("r1") && term.equals("feline")) return ImmutableSet.of("cat");
            if (type.equals("r2") && term.equals("mammal")) return ImmutableSet.of("feline");
        } else {
            if (type.equals("r1") && term.equals("cat")) return ImmutableSet.of("feline");
            if (type.equals("r2") && term.equals("feline")) return ImmutableSet.of("mammal");
        }
        return ImmutableSet.<String>of();
    };
    private static final Instantiator nothing = q -> ImmutableSet.of();

    private static final QAData qa = new QAData("q1", "What is a cat?", "a",
            ImmutableMap.of("a", "Mammal", "b", "Rock"),
            ImmutableList.of(new Template(new Variable("x", "Cat"), r1, new Variable("y"))));

    private static Reducer reducer() {
        Reducer r = new Reducer();
        r.register(new CaseLink("r1", "r2", Case.ONE), new Reduction("R3", ReductionOrder.MAINTAIN), true);
        return r;
    }

    private static ForestTransform transform(BeamSearchProtocol protocol) {
        BeamSearch search = new BeamSearch(factual, nothing, protocol, new RandomUnSorter(new SGBRandom(1)), 0);
        return new ForestTransform(reducer(), search, lowerCase, "en");
    }

    @Test
    public void postHoc() {
        ForestTransform t = transform(BeamSearchProtocol.AF_POST_HOC);
        InstantiationForest forest = t.apply(ImmutableList.of(unrelated, chain), qa);
        assertThat(forest.families(), hasSize(1));
        InstantiationFamily family = forest.families().get(0);
        assertThat(family.tree(), is(chain));
        assertThat(family.dataIds(), contains("I0"));
        InstantiationData d = forest.familyData(family).get("I0");
        assertThat(d.pairingTemplate(), is(ab));
        assertThat(d.pairing().variableId(), is("A"));
        assertThat(d.pairing().term(), is("cat"));
        assertThat(d.answerId(), is("C"));
        assertThat(d.reasoningHops(), is(1));
        assertThat(d.antiFactualIds(), is(empty()));
        assertThat(d.mapping(), is(ImmutableMap.of("A", "cat", "B", "feline", "C", "mammal")));
        assertThat(t.statistics().trees(), is(2));
        assertThat(t.statistics().families(), is(1));
        assertThat(t.statistics().pairingsByHops().count(0), is(1));
        assertThat(t.statistics().pairingsByHops().count(1), is(1));
        assertThat(t.statistics().instantiations().size(), is(1));
    }

    @Test
    public void inLine() {
        InstantiationForest forest = transform(BeamSearchProtocol.AF_IN_LINE).apply(ImmutableList.of(chain), qa);
        assertThat(forest.dataMap().keySet(), contains("I0"));
    }

    @Test
    public void idsKeepCounting() {
        ForestTransform t = transform(BeamSearchProtocol.AF_POST_HOC);
        t.apply(ImmutableList.of(chain), qa);
        assertThat(t.apply(ImmutableList.of(chain), qa).dataMap().keySet(), contains("I1"));
    }

    @Test
    public void withoutReducer() {
        BeamSearch search = new BeamSearch(factual, nothing, BeamSearchProtocol.AF_POST_HOC, new RandomUnSorter(new SGBRandom(1)), 0);
        ForestTransform t = new ForestTransform(null, search, lowerCase, "en");
        InstantiationForest forest = t.apply(ImmutableList.of(chain), qa);
        assertThat(forest.dataMap().size(), is(1));
        assertThat(forest.dataMap().get("I0").reasoningHops(), is(-1));
        assertThat(t.statistics().pairingsByHops().count(-1), is(2));
    }

    @Test
    public void droppedAntiFactualSets() {
        BeamSearch search = new BeamSearch(factual, nothing, BeamSearchProtocol.AF_POST_HOC, new RandomUnSorter(new SGBRandom(1)), 0);
        ForestTransform t = new ForestTransform(reducer(), search, lowerCase, "en",
                GeneratorFilter.passAll(), new GeneratorFilter(1.0, new SGBRandom(1)));
        assertThat(t.apply(ImmutableList.of(chain), qa).isEmpty(), is(true));
        assertThat(t.statistics().attempts().size(), is(0));
    }

    @Test
    public void everyAntiFactualSubset() {
        RelationalTree path = new RelationalTree(ImmutableList.of(ab, bc, new RelationalTemplate("C", "r2", "D")));
        BeamSearch search = new BeamSearch(nothing, nothing, BeamSearchProtocol.AF_POST_HOC, new RandomUnSorter(new SGBRandom(1)), 0);
        ForestTransform t = new ForestTransform(null, search, lowerCase, "en");
        assertThat(t.apply(ImmutableList.of(path), qa).isEmpty(), is(true));
        // Three answers, each leaving two variables to choose anti-factuals from.
        assertThat(t.statistics().attempts().count(new ForestStatistics.Bin(0, -1)), is(3));
        assertThat(t.statistics().attempts().count(new ForestStatistics.Bin(1, -1)), is(6));
        assertThat(t.statistics().attempts().count(new ForestStatistics.Bin(2, -1)), is(3));
    }

    @Test
    public void attemptsCountedPerAntiFactualSet() {
        QAData three = new QAData("q2", "What is a cat?", "a",
                ImmutableMap.of("a", "Mammal", "b", "Rock", "c", "Tree"), qa.pairingTemplates());
        ForestTransform t = transform(BeamSearchProtocol.AF_IN_LINE);
        t.apply(ImmutableList.of(chain), three);
        assertThat(t.statistics().attempts().size(), is(4));
        assertThat(t.statistics().attempts().count(new ForestStatistics.Bin(1, 0)), is(1));
        assertThat(t.statistics().attempts().count(new ForestStatistics.Bin(1, 1)), is(1));
    }
}
