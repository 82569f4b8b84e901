package net.littleredcomputer.chains.transform;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.chains.base.RelationalTemplate;
import net.littleredcomputer.chains.base.RelationalTree;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class TreeIsomorphismTest {
    private static RelationalTree tree(String... triples) {
        ImmutableList.Builder<RelationalTemplate> b = ImmutableList.builder();
        for (int i = 0; i < triples.length; i += 3) b.add(new RelationalTemplate(triples[i], triples[i + 1], triples[i + 2]));
        return new RelationalTree(b.build());
    }

    @Test
    public void renamedChain() {
        assertThat(TreeIsomorphism.isomorphic(tree("A", "r1", "B", "B", "r2", "C"), tree("Y", "r2", "Z", "X", "r1", "Y")), is(true));
    }

    @Test
    public void relationOrderMatters() {
        assertThat(TreeIsomorphism.isomorphic(tree("A", "r1", "B", "B", "r2", "C"), tree("X", "r2", "Y", "Y", "r1", "Z")), is(false));
    }

    @Test
    public void directionMatters() {
        assertThat(TreeIsomorphism.isomorphic(tree("A", "r1", "B", "B", "r1", "C"), tree("A", "r1", "B", "C", "r1", "B")), is(false));
        assertThat(TreeIsomorphism.isomorphic(tree("A", "r1", "B", "C", "r1", "B"), tree("B", "r1", "A", "B", "r1", "C")), is(false));
    }

    @Test
    public void star() {
        assertThat(TreeIsomorphism.isomorphic(
                tree("H", "r1", "A", "H", "r2", "B", "H", "r1", "C"),
                tree("x", "r1", "y", "x", "r1", "z", "x", "r2", "w")), is(true));
        assertThat(TreeIsomorphism.isomorphic(
                tree("H", "r1", "A", "H", "r2", "B", "H", "r1", "C"),
                tree("x", "r1", "y", "x", "r2", "z", "x", "r2", "w")), is(false));
    }

    @Test
    public void differentSizes() {
        assertThat(TreeIsomorphism.isomorphic(tree("A", "r1", "B"), tree("A", "r1", "B", "B", "r1", "C")), is(false));
    }
}
