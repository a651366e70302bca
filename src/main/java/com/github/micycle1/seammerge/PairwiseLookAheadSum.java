package com.github.micycle1.seammerge;

import java.util.stream.IntStream;

import org.ejml.data.DMatrixRMaj;

/**
 * Naive {@link LookAheadSum}. In parallel mode rows are summed concurrently; each
 * output cell is still a single addition, so both modes give identical results.
 *
 * @author Michael Carleton
 */
public final class PairwiseLookAheadSum implements LookAheadSum {

	private final boolean parallel;

	public PairwiseLookAheadSum() {
		this(false);
	}

	public PairwiseLookAheadSum(boolean parallel) {
		this.parallel = parallel;
	}

	@Override
	public LookAhead sum(DMatrixRMaj q11, DMatrixRMaj q12, MatrixStack p12, MatrixStack p22) {
		if (!parallel) {
			return new LookAhead(Matrices.sumShifted(q11), Matrices.sumShifted(q12), p12.sumShifted(), p22.sumShifted());
		}
		DMatrixRMaj upQ11 = new DMatrixRMaj(q11.numRows, q11.numCols - 1);
		DMatrixRMaj upQ12 = new DMatrixRMaj(q12.numRows, q12.numCols - 1);
		MatrixStack upP12 = MatrixStack.zeros(p12.depth(), p12.rows(), p12.cols() - 1);
		MatrixStack upP22 = MatrixStack.zeros(p22.depth(), p22.rows(), p22.cols() - 1);
		IntStream.range(0, q11.numRows).parallel().forEach(i -> {
			Matrices.sumShiftedRow(q11, upQ11, i);
			Matrices.sumShiftedRow(q12, upQ12, i);
			for (int k = 0; k < p12.depth(); k++) {
				Matrices.sumShiftedRow(p12.plane(k), upP12.plane(k), i);
			}
			for (int k = 0; k < p22.depth(); k++) {
				Matrices.sumShiftedRow(p22.plane(k), upP22.plane(k), i);
			}
		});
		return new LookAhead(upQ11, upQ12, upP12, upP22);
	}

	public boolean isParallel() {
		return parallel;
	}
}
