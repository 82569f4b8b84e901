package net.littleredcomputer.chains.search;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.littleredcomputer.chains.SGBRandom;
import net.littleredcomputer.chains.base.RelationalTemplate;
import net.littleredcomputer.chains.base.RelationalTree;
import org.junit.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.Assert.assertThat;

public class BeamSearchTest {
    private static final RelationalTemplate ab = new RelationalTemplate("A", "r1", "B");
    private static final RelationalTemplate bc = new RelationalTemplate("B", "r2", "C");
    private static final RelationalTree chain = new RelationalTree(ImmutableList.of(ab, bc));
    private static final RelationalTree single = new RelationalTree(ImmutableList.of(ab));
    private static final Map<String, String> catMammal = ImmutableMap.of("A", "cat", "C", "mammal");

    private static BeamSearch search(Instantiator factual, Instantiator antiFactual, BeamSearchProtocol protocol, int topK) {
        return new BeamSearch(factual, antiFactual, protocol, new RandomUnSorter(new SGBRandom(314159)), topK);
    }

    private static List<Map<String, String>> run(BeamSearch s, RelationalTree tree, List<String> af, Map<String, String> seed) {
        return s.search(tree, af, seed).collect(Collectors.toList());
    }

    private static Map<String, String> mapping(String... kv) {
        ImmutableMap.Builder<String, String> b = ImmutableMap.builder();
        for (int i = 0; i < kv.length; i += 2) b.put(kv[i], kv[i + 1]);
        return b.build();
    }

    private static FactTable felines() {
        return new FactTable().add("cat", "r1", "feline").add("feline", "r2", "mammal");
    }

    @Test
    public void chain() {
        for (BeamSearchProtocol p : BeamSearchProtocol.values()) {
            List<Map<String, String>> ms = run(search(felines(), new FactTable(), p, 0), chain, ImmutableList.of(), catMammal);
            assertThat(ms, contains(mapping("A", "cat", "B", "feline", "C", "mammal")));
        }
    }

    @Test
    public void emptyQueryResultPrunes() {
        FactTable facts = new FactTable().add("feline", "r2", "mammal");
        for (BeamSearchProtocol p : BeamSearchProtocol.values()) {
            assertThat(run(search(facts, new FactTable(), p, 0), chain, ImmutableList.of(), catMammal), is(empty()));
        }
    }

    @Test
    public void termsAreDistinct() {
        FactTable facts = new FactTable().add("cat", "r1", "cat").add("cat", "r1", "dog");
        List<Map<String, String>> ms = run(search(facts, new FactTable(), BeamSearchProtocol.AF_IN_LINE, 0),
                single, ImmutableList.of(), ImmutableMap.of("A", "cat"));
        assertThat(ms, contains(mapping("A", "cat", "B", "dog")));
    }

    @Test
    public void protocolsAgreeWithoutAntiFactuals() {
        FactTable facts = felines().add("cat", "r1", "pet").add("pet", "r2", "mammal").add("cat", "r1", "hunter");
        Set<Map<String, String>> inLine = search(facts, new FactTable(), BeamSearchProtocol.AF_IN_LINE, 0)
                .search(chain, ImmutableList.of(), catMammal).collect(Collectors.toSet());
        Set<Map<String, String>> postHoc = search(facts, new FactTable(), BeamSearchProtocol.AF_POST_HOC, 0)
                .search(chain, ImmutableList.of(), catMammal).collect(Collectors.toSet());
        assertThat(inLine, hasSize(2));
        assertThat(inLine, is(postHoc));
    }

    @Test
    public void postHocReplacesAntiFactuals() {
        FactTable anti = new FactTable().add("cat", "r1", "canine").add("canine", "r2", "mammal").add("cat", "r1", "rock");
        List<Map<String, String>> ms = run(search(felines(), anti, BeamSearchProtocol.AF_POST_HOC, 0),
                chain, ImmutableList.of("B"), catMammal);
        assertThat(ms, contains(mapping("A", "cat", "B", "canine", "C", "mammal")));
    }

    @Test
    public void postHocAntiFactualTermsAreDistinct() {
        FactTable anti = new FactTable()
                .add("cat", "r1", "canine").add("canine", "r2", "mammal")
                .add("cat", "r1", "cat").add("cat", "r2", "mammal")
                .add("cat", "r1", "mammal").add("mammal", "r2", "mammal");
        List<Map<String, String>> ms = run(search(felines(), anti, BeamSearchProtocol.AF_POST_HOC, 0),
                chain, ImmutableList.of("B"), catMammal);
        assertThat(ms, contains(mapping("A", "cat", "B", "canine", "C", "mammal")));
    }

    @Test
    public void inLineAntiFactualMustNotHold() {
        FactTable anti = new FactTable().add("cat", "r1", "canine");
        Map<String, String> seed = ImmutableMap.of("A", "cat");
        assertThat(run(search(felines(), anti, BeamSearchProtocol.AF_IN_LINE, 0), single, ImmutableList.of("B"), seed),
                contains(mapping("A", "cat", "B", "canine")));
        FactTable factual = felines().add("cat", "r1", "canine");
        assertThat(run(search(factual, anti, BeamSearchProtocol.AF_IN_LINE, 0), single, ImmutableList.of("B"), seed),
                is(empty()));
    }

    @Test
    public void topK() {
        FactTable facts = new FactTable();
        for (String t : ImmutableList.of("b1", "b2", "b3", "b4", "b5")) facts.add("cat", "r1", t);
        Map<String, String> seed = ImmutableMap.of("A", "cat");
        assertThat(run(search(facts, new FactTable(), BeamSearchProtocol.AF_IN_LINE, 2), single, ImmutableList.of(), seed),
                hasSize(2));
        assertThat(run(search(facts, new FactTable(), BeamSearchProtocol.AF_IN_LINE, 0), single, ImmutableList.of(), seed),
                hasSize(5));
    }

    @Test
    public void disconnectedSeedIsIncomplete() {
        RelationalTree two = new RelationalTree(ImmutableList.of(ab, new RelationalTemplate("C", "r2", "D")));
        List<Map<String, String>> ms = run(search(felines(), new FactTable(), BeamSearchProtocol.AF_IN_LINE, 0),
                two, ImmutableList.of(), ImmutableMap.of("A", "cat"));
        assertThat(ms, is(empty()));
    }

    @Test(expected = IllegalStateException.class)
    public void frontierReachedTwiceFromOnePartner() {
        RelationalTree cycle = new RelationalTree(ImmutableList.of(ab, new RelationalTemplate("B", "r2", "A")));
        search(felines(), new FactTable(), BeamSearchProtocol.AF_IN_LINE, 0)
                .search(cycle, ImmutableList.of(), ImmutableMap.of("A", "cat"))
                .count();
    }

    @Test
    public void hasDistinctTerms() {
        assertThat(BeamSearch.hasDistinctTerms(ImmutableMap.of("A", "x", "B", "y")), is(true));
        assertThat(BeamSearch.hasDistinctTerms(ImmutableMap.of("A", "x", "B", "x")), is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void seedOutsideTree() {
        search(felines(), new FactTable(), BeamSearchProtocol.AF_IN_LINE, 0)
                .search(single, ImmutableSet.of(), ImmutableMap.of("Z", "cat"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeTopK() {
        search(felines(), new FactTable(), BeamSearchProtocol.AF_IN_LINE, -1);
    }
}
