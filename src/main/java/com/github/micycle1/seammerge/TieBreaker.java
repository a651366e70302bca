package com.github.micycle1.seammerge;

import java.util.Random;

/**
 * Source of uniform draws in {@code [0, 1)} used to pick among equally cheap seams.
 *
 * @author Michael Carleton
 */
@FunctionalInterface
public interface TieBreaker {

	double nextDouble();

	/**
	 * @return a tie breaker backed by an unseeded {@link Random}
	 */
	static TieBreaker random() {
		return new Random()::nextDouble;
	}

	/**
	 * @return a reproducible tie breaker
	 */
	static TieBreaker seeded(long seed) {
		return new Random(seed)::nextDouble;
	}

	/**
	 * @param value constant draw in {@code [0, 1)}
	 * @throws IllegalArgumentException if {@code value} is outside {@code [0, 1)}
	 */
	static TieBreaker fixed(double value) {
		if (!(value >= 0 && value < 1)) {
			throw new IllegalArgumentException("Tie-break value must lie in [0, 1): " + value);
		}
		return () -> value;
	}
}
