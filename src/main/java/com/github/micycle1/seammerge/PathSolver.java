package com.github.micycle1.seammerge;

import org.ejml.data.DMatrixRMaj;

import com.github.micycle1.seammerge.PathMap.Direction;

/**
 * Row-sequential dynamic programming over a cost grid.
 *
 * <p>
 * On entry {@code pot} holds the per-pixel energy; on return each cell holds the
 * cheapest cumulative cost of a seam ending there:
 *
 * <pre>
 * pot[i,j] += min(pot[i-1,j-1] + cl[i,j], pot[i-1,j] + cu[i,j], pot[i-1,j+1] + cr[i,j])
 * </pre>
 *
 * Predecessors outside the grid are {@code +∞}. Row {@code i} reads only the
 * finished row {@code i-1}.
 */
final class PathSolver {

	private PathSolver() {
	}

	/**
	 * Cost-only pass.
	 */
	static DMatrixRMaj accumulate(DMatrixRMaj pot, DMatrixRMaj cu, DMatrixRMaj cl, DMatrixRMaj cr) {
		return accumulate(pot, cu, cl, cr, null);
	}

	/**
	 * Cost and back-pointer pass. Ties go to the first of left, up, right.
	 *
	 * @param pathMap receives the winning direction per cell; may be null for a
	 *                cost-only pass
	 * @return {@code pot}, updated in place
	 */
	static DMatrixRMaj accumulate(DMatrixRMaj pot, DMatrixRMaj cu, DMatrixRMaj cl, DMatrixRMaj cr, PathMap pathMap) {
		int h = pot.numRows, n = pot.numCols;
		for (int i = 1; i < h; i++) {
			int prev = (i - 1) * n;
			int row = i * n;
			for (int j = 0; j < n; j++) {
				double left = j == 0 ? Double.POSITIVE_INFINITY : pot.data[prev + j - 1] + cl.data[row + j];
				double up = pot.data[prev + j] + cu.data[row + j];
				double right = j == n - 1 ? Double.POSITIVE_INFINITY : pot.data[prev + j + 1] + cr.data[row + j];

				double best = left;
				Direction dir = Direction.LEFT;
				if (up < best) {
					best = up;
					dir = Direction.UP;
				}
				if (right < best) {
					best = right;
					dir = Direction.RIGHT;
				}
				pot.data[row + j] = pot.data[row + j] + best;
				if (pathMap != null) {
					pathMap.set(i, j, dir);
				}
			}
		}
		return pot;
	}

	/**
	 * Maximum-energy pass: like {@link #accumulate} without link costs, taking the
	 * largest predecessor instead of the smallest. Predecessors outside the grid
	 * count as 0.
	 *
	 * @return {@code pot}, updated in place
	 */
	static DMatrixRMaj accumulateMaximum(DMatrixRMaj pot) {
		int h = pot.numRows, n = pot.numCols;
		for (int i = 1; i < h; i++) {
			int prev = (i - 1) * n;
			int row = i * n;
			for (int j = 0; j < n; j++) {
				double left = j == 0 ? 0 : pot.data[prev + j - 1];
				double up = pot.data[prev + j];
				double right = j == n - 1 ? 0 : pot.data[prev + j + 1];
				pot.data[row + j] = pot.data[row + j] + Math.max(left, Math.max(up, right));
			}
		}
		return pot;
	}
}
