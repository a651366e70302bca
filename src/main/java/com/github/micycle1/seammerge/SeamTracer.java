package com.github.micycle1.seammerge;

import java.util.Arrays;

import org.ejml.data.DMatrixRMaj;

/**
 * Backtracks a back-pointer map into a seam: one column index per row, adjacent
 * rows differing by at most one column.
 */
final class SeamTracer {

	private SeamTracer() {
	}

	/**
	 * Starts from the cheapest column of the last row of {@code pot} and walks the
	 * back-pointers up to row 0. When several last-row columns share the minimum,
	 * one is chosen with {@code tieBreaker}; otherwise the tie breaker is not
	 * consulted.
	 *
	 * @return seam column per row
	 */
	static int[] trace(DMatrixRMaj pot, PathMap pathMap, TieBreaker tieBreaker) {
		int h = pot.numRows, n = pot.numCols;
		int last = (h - 1) * n;

		double min = Double.POSITIVE_INFINITY;
		for (int j = 0; j < n; j++) {
			min = Math.min(min, pot.data[last + j]);
		}
		int[] candidates = new int[n];
		int count = 0;
		for (int j = 0; j < n; j++) {
			if (pot.data[last + j] == min) {
				candidates[count++] = j;
			}
		}
		if (count == 0) {
			throw new IllegalStateException("No finite seam cost in last row: " + Arrays.toString(Arrays.copyOfRange(pot.data, last, last + n)));
		}

		int[] seam = new int[h];
		if (count == 1) {
			seam[h - 1] = candidates[0];
		} else {
			int pick = (int) (tieBreaker.nextDouble() * count);
			seam[h - 1] = candidates[Math.min(count - 1, pick)];
		}
		for (int i = h - 2; i >= 0; i--) {
			seam[i] = seam[i + 1] + pathMap.get(i + 1, seam[i + 1]).offset();
		}
		return seam;
	}
}
