package com.github.micycle1.seammerge;

import org.ejml.data.DMatrixRMaj;

/**
 * Merges a seam into its right neighbour across every tracked matrix.
 *
 * <p>
 * In each row the seam column is deleted and the value now at the seam position
 * (the former right neighbour) is overwritten with the merged value. For the
 * factorized members that value is the precomputed look-ahead; the accumulation
 * matrix has no look-ahead and is summed on the spot.
 */
final class SeamApplier {

	private SeamApplier() {
	}

	/**
	 * Replaces all six members of {@code state} with matrices one column narrower.
	 *
	 * @param state merge state, updated in place
	 * @param up    look-ahead of {@code state}
	 * @param v     look-ahead mean structure map
	 * @param seam  seam column per row, each in {@code [0, cols-2]}
	 * @throws IllegalArgumentException if the seam does not fit the state
	 */
	static void apply(MergeState state, LookAhead up, DMatrixRMaj v, int[] seam) {
		Matrices.checkSeam(state.q11, seam);

		DMatrixRMaj q11 = Matrices.deleteAndReplace(state.q11, up.q11, seam);
		DMatrixRMaj q12 = Matrices.deleteAndReplace(state.q12, up.q12, seam);
		MatrixStack p12 = state.p12.deleteAndReplace(up.p12, seam);
		MatrixStack p22 = state.p22.deleteAndReplace(up.p22, seam);
		DMatrixRMaj simg = Matrices.deleteAndReplace(state.simg, v, seam);
		MatrixStack z = state.z.deleteAndMerge(seam);

		state.q11 = q11;
		state.q12 = q12;
		state.p12 = p12;
		state.p22 = p22;
		state.simg = simg;
		state.z = z;
	}
}
