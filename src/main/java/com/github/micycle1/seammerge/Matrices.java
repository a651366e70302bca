package com.github.micycle1.seammerge;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;

/**
 * Column-oriented matrix primitives used by the merge loop.
 */
final class Matrices {

	private Matrices() {
	}

	/**
	 * Sums every column with its right neighbour: {@code out[i,j] = a[i,j] + a[i,j+1]}.
	 *
	 * @return a matrix one column narrower than {@code a}
	 */
	static DMatrixRMaj sumShifted(DMatrixRMaj a) {
		DMatrixRMaj out = new DMatrixRMaj(a.numRows, a.numCols - 1);
		for (int i = 0; i < a.numRows; i++) {
			sumShiftedRow(a, out, i);
		}
		return out;
	}

	static void sumShiftedRow(DMatrixRMaj a, DMatrixRMaj out, int row) {
		int src = row * a.numCols;
		int dst = row * out.numCols;
		for (int j = 0; j < out.numCols; j++) {
			out.data[dst + j] = a.data[src + j] + a.data[src + j + 1];
		}
	}

	/**
	 * Computes {@code -numerator / denominator} elementwise; the mean recovered from a
	 * factorized (q12, q11) pair.
	 */
	static DMatrixRMaj negatedRatio(DMatrixRMaj numerator, DMatrixRMaj denominator) {
		DMatrixRMaj out = new DMatrixRMaj(numerator.numRows, numerator.numCols);
		int n = out.getNumElements();
		for (int k = 0; k < n; k++) {
			out.data[k] = -numerator.data[k] / denominator.data[k];
		}
		return out;
	}

	/**
	 * Removes column {@code seam[i]} from each row {@code i}, then writes
	 * {@code lookAhead[i, seam[i]]} at the seam position of the narrower result.
	 */
	static DMatrixRMaj deleteAndReplace(DMatrixRMaj a, DMatrixRMaj lookAhead, int[] seam) {
		DMatrixRMaj out = delete(a, seam);
		for (int i = 0; i < out.numRows; i++) {
			out.unsafe_set(i, seam[i], lookAhead.unsafe_get(i, seam[i]));
		}
		return out;
	}

	/**
	 * Removes column {@code seam[i]} from each row {@code i} and stores the sum of the
	 * removed value and its right neighbour at the seam position.
	 */
	static DMatrixRMaj deleteAndMerge(DMatrixRMaj a, int[] seam) {
		DMatrixRMaj out = delete(a, seam);
		for (int i = 0; i < out.numRows; i++) {
			int s = seam[i];
			out.unsafe_set(i, s, a.unsafe_get(i, s) + a.unsafe_get(i, s + 1));
		}
		return out;
	}

	private static DMatrixRMaj delete(DMatrixRMaj a, int[] seam) {
		checkSeam(a, seam);
		int cols = a.numCols - 1;
		DMatrixRMaj out = new DMatrixRMaj(a.numRows, cols);
		for (int i = 0; i < a.numRows; i++) {
			int s = seam[i];
			int src = i * a.numCols;
			int dst = i * cols;
			System.arraycopy(a.data, src, out.data, dst, s);
			System.arraycopy(a.data, src + s + 1, out.data, dst + s, cols - s);
		}
		return out;
	}

	/**
	 * A seam names, for every row, a column that has a right neighbour.
	 */
	static void checkSeam(DMatrixRMaj a, int[] seam) {
		Objects.requireNonNull(seam);
		if (seam.length != a.numRows) {
			throw new IllegalArgumentException("Seam length " + seam.length + " does not match row count " + a.numRows);
		}
		for (int i = 0; i < seam.length; i++) {
			if (seam[i] < 0 || seam[i] > a.numCols - 2) {
				throw new IllegalArgumentException("Seam column " + seam[i] + " at row " + i + " outside [0, " + (a.numCols - 2) + "]");
			}
		}
	}
}
