/* 
 * Copyright (C) 2022 SimPeaks developers
 *
 * This File is part of SimPeaks
 *
 * SimPeaks is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SimPeaks is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SimPeaks.  If not, see <http://www.gnu.org/licenses/>.
 */
package simpeaks.processing.noise;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Per-bin additive noise drawn from a single random stream.
 * Not thread-safe: a generator belongs to the thread producing frames
 */
public class NoiseGenerator {
    private final RandomGenerator random;

    /**
     * Generator seeded with the current time
     */
    public NoiseGenerator() {
        this(new Well19937c(System.currentTimeMillis()));
    }

    public NoiseGenerator(long seed) {
        this(new Well19937c(seed));
    }

    public NoiseGenerator(RandomGenerator random) {
        if (random==null) throw new IllegalArgumentException("Random generator cannot be null");
        this.random = random;
    }

    /**
     * @return the noise value to add to one bin, 0 if noise is disabled
     */
    public double next(NoiseSpec spec) {
        double n;
        switch (spec.getType()) {
            case NONE:
            default:
                return 0;
            case UNIFORM:
                n = 2 * random.nextDouble() - 1;
                break;
            case GAUSSIAN:
                n = random.nextGaussian();
                break;
        }
        n *= spec.getLevel();
        if (spec.isClamp()) n = Math.max(spec.getLower(), Math.min(spec.getUpper(), n));
        return n;
    }
}
