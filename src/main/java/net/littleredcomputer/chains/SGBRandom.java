// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains;

import com.google.common.primitives.UnsignedInts;

import java.util.Collections;
import java.util.List;

/**
 * The random number generator from the Stanford GraphBase. Every probabilistic step
 * of the engine (sub-sampling filters, random ranking) draws from an instance passed in
 * explicitly, so a run is reproducible from its seed.
 */
public class SGBRandom {
    private static final int two_to_the_31 = 0x80000000;
    private final int[] A = new int[56];
    private int fptr = 0;

    /* difference mod 2^31 */
    private static int modDiff(int x, int y) { return (x - y) & 0x7fffffff; }

    /**
     * @param seed used to initialize the RNG; bit-compatible with gb_init_rand
     */
    public SGBRandom(int seed) {
        A[0] = -1;
        int prev = modDiff(seed, 0), next = 1;
        seed = prev;
        A[55] = prev;
        for (int i = 21; i != 0; i = (i + 21) % 55) {
            A[i] = next;
            next = modDiff(prev, next);
            seed = (seed & 1) != 0 ? 0x40000000 + (seed >> 1) : seed >> 1;
            next = modDiff(next, seed);
            prev = A[i];
        }
        for (int i = 0; i < 5; ++i) flipCycle();
    }

    /**
     * @return the next value in [0, 2^31)
     */
    public int nextRand() {
        return A[fptr] >= 0 ? A[fptr--] : flipCycle();
    }

    /**
     * @return a uniformly distributed value in [0, m)
     */
    public int unifRand(int m) {
        int t = two_to_the_31 - UnsignedInts.remainder(two_to_the_31, m);
        int r;
        do r = nextRand(); while (UnsignedInts.compare(t, r) <= 0);
        return r % m;
    }

    /**
     * @return a value in [0, 1)
     */
    public double nextUnit() {
        return nextRand() / (double) (1L << 31);
    }

    /**
     * Fisher-Yates shuffle in place.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; --i) {
            Collections.swap(list, i, unifRand(i + 1));
        }
    }

    private int flipCycle() {
        int i, j;
        for (i = 1, j = 32; j <= 55; i++, j++) A[i] = modDiff(A[i], A[j]);
        for (j = 1; i <= 55; i++, j++) A[i] = modDiff(A[i], A[j]);
        fptr = 54;
        return A[55];
    }
}
