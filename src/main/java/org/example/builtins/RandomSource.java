package org.example.builtins;

import java.util.Random;

/**
 * Generators behind {@code rands()}. A seeded call reseeds the deterministic
 * generator and draws from it; an unseeded call draws from a generator that
 * is seeded once, from the clock and the process id, when this source is
 * created.
 */
public final class RandomSource {

    private final Random deterministic = new Random();
    private final Random nondeterministic;

    public RandomSource(){
        this(System.currentTimeMillis() + ProcessHandle.current().pid());
    }

    public RandomSource(long initialSeed){
        this.nondeterministic = new Random(initialSeed);
    }

    Random seeded(long seed){
        deterministic.setSeed(seed);
        return deterministic;
    }

    Random unseeded(){ return nondeterministic; }

    /** Uniform draw in {@code [min, max)}. */
    static double uniform(Random rng, double min, double max){
        return min + rng.nextDouble() * (max - min);
    }
}
