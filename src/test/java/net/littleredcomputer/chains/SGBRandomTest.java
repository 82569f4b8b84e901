package net.littleredcomputer.chains;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.Assert.assertThat;

public class SGBRandomTest {

    @Test
    public void nextRand() {
        // DEK provides this test in gb_flip.w in the Stanford GraphBase
        SGBRandom R = new SGBRandom(-314159);
        assertThat(R.nextRand(), is(119318998));
        for (int j = 1; j <= 133; j++) R.nextRand();
        assertThat(R.unifRand(0x55555555), is(748103812));
    }

    @Test
    public void nextUnit() {
        SGBRandom R = new SGBRandom(314159);
        for (int i = 0; i < 1000; ++i) {
            double u = R.nextUnit();
            assertThat(u, greaterThanOrEqualTo(0.0));
            assertThat(u, lessThan(1.0));
        }
    }

    @Test
    public void shuffleIsReproducible() {
        List<Integer> a = IntStream.range(0, 20).boxed().collect(Collectors.toList());
        List<Integer> b = new ArrayList<>(a);
        new SGBRandom(42).shuffle(a);
        new SGBRandom(42).shuffle(b);
        assertThat(a, is(b));
        assertThat(a, containsInAnyOrder(IntStream.range(0, 20).boxed().toArray()));
    }
}
