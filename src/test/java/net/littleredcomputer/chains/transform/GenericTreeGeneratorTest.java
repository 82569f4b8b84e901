package net.littleredcomputer.chains.transform;

import net.littleredcomputer.chains.SGBRandom;
import net.littleredcomputer.chains.base.GenericTree;
import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertThat;

public class GenericTreeGeneratorTest {

    @Test
    public void relationIds() {
        assertThat(GenericTreeGenerator.relationIds(3), contains("R0", "R1", "R2"));
    }

    @Test
    public void sizeTwo() {
        assertThat(new GenericTreeGenerator().generate(2).collect(Collectors.toList()), hasSize(4));
    }

    @Test
    public void sizeThree() {
        List<GenericTree> trees = new GenericTreeGenerator().generate(3).collect(Collectors.toList());
        assertThat(trees.size(), greaterThan(0));
        for (GenericTree t : trees) {
            long variables = t.templates().stream()
                    .flatMap(u -> Stream.of(u.sourceId(), u.targetId()))
                    .distinct()
                    .count();
            assertThat(variables, is(4L));
        }
    }

    @Test
    public void filtered() {
        long all = new GenericTreeGenerator().generate(3).count();
        long some = new GenericTreeGenerator(new GeneratorFilter(0.5, new SGBRandom(314159))).generate(3).count();
        assertThat(some, lessThanOrEqualTo(all));
        assertThat(new GenericTreeGenerator(new GeneratorFilter(1.0, new SGBRandom(1))).generate(3).count(), is(0L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooSmall() {
        new GenericTreeGenerator().generate(1);
    }
}
