package net.littleredcomputer.chains.base;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class QAGroupTest {
    private static final RelationalTemplate ab = new RelationalTemplate("A", "isa", "B");

    private static InstantiationForest forest() {
        InstantiationForest forest = new InstantiationForest();
        forest.addData(forest.addFamily(new RelationalTree(ImmutableList.of(ab))), InstantiationData.builder()
                .identifier("I0")
                .pairingTemplate(ab)
                .pairing(new Pairing("A", "cat"))
                .qaTemplate(new Template(new Variable("x", "cat"), new Relation("isa", "", ""), new Variable("y")))
                .answerId("B")
                .mapping(ImmutableMap.of("A", "cat", "B", "mammal"))
                .build());
        return forest;
    }

    @Test
    public void patchedMappingWins() {
        QAGroup g = new QAGroup("G0", ImmutableMap.of("a", "I0", "b", "I0"),
                ImmutableMap.of("b", ImmutableMap.of("A", "cat", "B", "rock")));
        assertThat(g.mapping("a", forest()), is(ImmutableMap.of("A", "cat", "B", "mammal")));
        assertThat(g.mapping("b", forest()), is(ImmutableMap.of("A", "cat", "B", "rock")));
        assertThat(g.patchedMapping("a"), isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void patchForUnknownLabel() {
        new QAGroup("G0", ImmutableMap.of("a", "I0"), ImmutableMap.of("b", ImmutableMap.of("A", "cat")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownLabel() {
        new QAGroup("G0", ImmutableMap.of("a", "I0"), ImmutableMap.<String, ImmutableMap<String, String>>of())
                .mapping("z", forest());
    }
}
