package com.github.micycle1.seammerge;

import org.ejml.data.DMatrixRMaj;

/**
 * Columnwise shifted-sum primitive: for each input, {@code up[:,j] = x[:,j] + x[:,j+1]}
 * for {@code 0 <= j < width-1}.
 *
 * <p>
 * Implementations must be bit-exact with a single pairwise addition per output
 * cell; summation order decides floating point ties in the path search.
 *
 * @author Michael Carleton
 */
@FunctionalInterface
public interface LookAheadSum {

	LookAhead sum(DMatrixRMaj q11, DMatrixRMaj q12, MatrixStack p12, MatrixStack p22);
}
