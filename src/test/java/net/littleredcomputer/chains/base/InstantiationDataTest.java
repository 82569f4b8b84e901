package net.littleredcomputer.chains.base;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class InstantiationDataTest {
    private static final Relation isa = new Relation("isa", "is a kind of", "is a");
    private static final Relation isaVariant = new Relation("isa", "is a sort of", "is a sort of");
    private static final Relation has = new Relation("has", "has a part", "has");
    private static final Map<String, Relation> relations = Relations.byType(ImmutableList.of(isa, has));
    private static final RelationalTemplate ab = new RelationalTemplate("A", "isa", "B");
    private static final RelationalTemplate bc = new RelationalTemplate("B", "has", "C");
    private static final RelationalTree tree = new RelationalTree(ImmutableList.of(ab, bc));

    private static InstantiationData data() {
        return InstantiationData.builder()
                .identifier("I0")
                .pairingTemplate(ab)
                .pairing(new Pairing("A", "cat"))
                .qaTemplate(new Template(new Variable("x", "cat"), isaVariant, new Variable("y")))
                .answerId("B")
                .reasoningHops(0)
                .antiFactualIds(ImmutableList.of("C"))
                .mapping(ImmutableMap.of("A", "cat", "B", "mammal", "C", "fur"))
                .build();
    }

    @Test
    public void instantiateUsesQARelationForPairing() {
        Tree t = data().instantiate(tree, relations);
        assertThat(t.templates().size(), is(2));
        assertThat(t.pairingTemplate(),
                is(new Template(new Variable("A", "cat"), isaVariant, new Variable("B", "mammal"))));
        assertThat(t.templates().get(1),
                is(new Template(new Variable("B", "mammal"), has, new Variable("C", "fur"))));
    }

    @Test(expected = IllegalStateException.class)
    public void instantiateWithoutPairingTemplate() {
        data().instantiate(new RelationalTree(ImmutableList.of(bc)), relations);
    }

    @Test
    public void toBuilderOverrides() {
        InstantiationData d = data().toBuilder().identifier("I1").antiFactualIds(ImmutableList.of()).build();
        assertThat(d.identifier(), is("I1"));
        assertThat(d.antiFactualIds().isEmpty(), is(true));
        assertThat(d.mapping(), is(data().mapping()));
        assertThat(data().toBuilder().build(), is(data()));
    }

    @Test
    public void mappingDistance() {
        InstantiationData other = data().toBuilder()
                .mapping(ImmutableMap.of("A", "dog", "B", "animal", "C", "tail"))
                .build();
        assertThat(data().mappingDistance(other, true, true), is(3));
        assertThat(data().mappingDistance(other, false, true), is(2));
        assertThat(data().mappingDistance(other, false, false), is(1));
        assertThat(data().mappingDistance(data(), true, true), is(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void answerCannotBeAntiFactual() {
        data().toBuilder().antiFactualIds(ImmutableList.of("B")).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void pairingCannotBeAntiFactual() {
        data().toBuilder().antiFactualIds(ImmutableList.of("A", "C")).build();
    }
}
