package com.github.micycle1.seammerge;

import org.ejml.data.DMatrixRMaj;

/**
 * Computes the directional structure cost fields from the current mean structure
 * map and the look-ahead factorized state.
 *
 * <p>
 * Merging a pixel with its right neighbour replaces the structure differences
 * they had to their neighbours with a single difference {@code d} measured from
 * the merged mean {@code v}. The squared error of that replacement, summed over
 * every original pixel folded into the merged one, is the quadratic form
 *
 * <pre>
 * a·d² + 2·b·d + c
 * </pre>
 *
 * where {@code a}, {@code b}, {@code c} are the look-ahead q11, p12 and p22 for
 * the direction at hand. The look-ahead mean {@code v} has one column fewer than
 * {@code simg}; column {@code j} of {@code v} stands for the pair
 * {@code (j, j+1)} of {@code simg}.
 */
final class EnergyModel {

	private EnergyModel() {
	}

	/**
	 * @param simg mean structure map, H×(n+1)
	 * @param v    look-ahead mean structure map, H×n
	 * @param up   look-ahead factorized state, H×n
	 */
	static EnergyFields compute(DMatrixRMaj simg, DMatrixRMaj v, LookAhead up) {
		int h = v.numRows, n = v.numCols;
		DMatrixRMaj a = up.q11;
		DMatrixRMaj bUp = up.p12.plane(MergeState.UP), cUp = up.p22.plane(MergeState.UP);
		DMatrixRMaj bDown = up.p12.plane(MergeState.DOWN), cDown = up.p22.plane(MergeState.DOWN);
		DMatrixRMaj bRight = up.p12.plane(MergeState.RIGHT), cRight = up.p22.plane(MergeState.RIGHT);
		DMatrixRMaj bLeft = up.p12.plane(MergeState.LEFT), cLeft = up.p22.plane(MergeState.LEFT);

		DMatrixRMaj cu = new DMatrixRMaj(h, n);
		DMatrixRMaj cl = new DMatrixRMaj(h, n);
		DMatrixRMaj cr = new DMatrixRMaj(h, n);
		DMatrixRMaj cw = new DMatrixRMaj(h, n);
		DMatrixRMaj ce = new DMatrixRMaj(h, n);

		for (int i = 0; i < h; i++) {
			for (int j = 0; j < n; j++) {
				double vij = v.unsafe_get(i, j);

				double dEast = j < n - 1 ? vij - simg.unsafe_get(i, j + 2) : 0;
				ce.unsafe_set(i, j, cost(dEast, a, bRight, cRight, i, j));
				double dWest = j > 0 ? vij - simg.unsafe_get(i, j - 1) : 0;
				cw.unsafe_set(i, j, cost(dWest, a, bLeft, cLeft, i, j));

				if (i == 0) {
					continue;
				}
				int p = i - 1;

				// south term of the row above, then north term of this row
				double south = cost(v.unsafe_get(p, j) - vij, a, bDown, cDown, p, j);
				double north = cost(vij - v.unsafe_get(p, j), a, bUp, cUp, i, j);
				cu.unsafe_set(i, j, south + north);

				if (j > 0) {
					south = cost(v.unsafe_get(p, j - 1) - simg.unsafe_get(i, j - 1), a, bDown, cDown, p, j - 1);
					north = cost(vij - simg.unsafe_get(p, j + 1), a, bUp, cUp, i, j);
					cl.unsafe_set(i, j, south + north);
				}
				if (j < n - 1) {
					south = cost(v.unsafe_get(p, j + 1) - simg.unsafe_get(i, j + 2), a, bDown, cDown, p, j + 1);
					north = cost(vij - simg.unsafe_get(p, j), a, bUp, cUp, i, j);
					cr.unsafe_set(i, j, south + north);
				}
			}
		}
		return new EnergyFields(cu, cl, cr, cw, ce);
	}

	/**
	 * Look-ahead mean structure value, {@code −upQ12/upQ11}.
	 */
	static DMatrixRMaj lookAheadMean(LookAhead up) {
		return Matrices.negatedRatio(up.q12, up.q11);
	}

	private static double cost(double d, DMatrixRMaj a, DMatrixRMaj b, DMatrixRMaj c, int i, int j) {
		return quadratic(d, a.unsafe_get(i, j), b.unsafe_get(i, j), c.unsafe_get(i, j));
	}

	static double quadratic(double d, double a, double b, double c) {
		return a * (d * d) + 2 * b * d + c;
	}
}
