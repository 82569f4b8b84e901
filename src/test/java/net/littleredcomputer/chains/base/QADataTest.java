package net.littleredcomputer.chains.base;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class QADataTest {
    private static final Relation isa = new Relation("isa", "is a kind of", "is a");

    @Test
    public void correctAnswer() {
        QAData qa = new QAData("q1", "What is a cat?", "b",
                ImmutableMap.of("a", "rock", "b", "mammal"),
                ImmutableList.of(new Template(new Variable("x", "cat"), isa, new Variable("y"))));
        assertThat(qa.correctAnswer(), is("mammal"));
        assertThat(qa.answerChoices().keySet().asList(), is(ImmutableList.of("a", "b")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownCorrectLabel() {
        new QAData("q1", "?", "c", ImmutableMap.of("a", "rock"), ImmutableList.of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void pairingTemplateWithoutFreeVariable() {
        new QAData("q1", "?", "a", ImmutableMap.of("a", "rock"),
                ImmutableList.of(new Template(new Variable("x", "cat"), isa, new Variable("y", "dog"))));
    }

    @Test(expected = IllegalArgumentException.class)
    public void pairingTemplateWithoutBoundVariable() {
        new QAData("q1", "?", "a", ImmutableMap.of("a", "rock"),
                ImmutableList.of(new Template(new Variable("x"), isa, new Variable("y"))));
    }
}
