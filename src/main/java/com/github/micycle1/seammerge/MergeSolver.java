package com.github.micycle1.seammerge;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.seammerge.ParameterNormalizer.Weights;

/**
 * Holds the mutable state of a single merge run and merges one seam per
 * {@link #step()}. Not reentrant; each run gets its own solver.
 */
final class MergeSolver {

	private static final Logger log = LoggerFactory.getLogger(MergeSolver.class);

	private final MergeState state;
	private final double alpha;
	private final double beta;
	private final double gamma;
	private final LookAheadSum lookAheadSum;
	private final TieBreaker tieBreaker;

	private Weights weights;

	MergeSolver(MergeState state, double alpha, double beta, LookAheadSum lookAheadSum, TieBreaker tieBreaker) {
		this.state = Objects.requireNonNull(state);
		this.alpha = alpha;
		this.beta = beta;
		this.gamma = 1 - alpha;
		this.lookAheadSum = Objects.requireNonNull(lookAheadSum);
		this.tieBreaker = Objects.requireNonNull(tieBreaker);
	}

	/**
	 * Finds the cheapest seam of the current state and merges it into its right
	 * neighbour. The first call also fixes the normalized weights.
	 *
	 * @return the merged seam, one column per row, in the coordinates of the state
	 *         before the merge
	 * @throws IllegalStateException            if the state is a single column wide
	 * @throws DegenerateNormalizationException on the first call, if the energy
	 *                                          terms cannot be normalized
	 */
	int[] step() {
		if (state.cols() < 2) {
			throw new IllegalStateException("No seam left to merge: state is " + state.cols() + " column wide.");
		}
		LookAhead up = lookAheadSum.sum(state.q11, state.q12, state.p12, state.p22);
		DMatrixRMaj v = EnergyModel.lookAheadMean(up);
		EnergyFields fields = EnergyModel.compute(state.simg, v, up);

		DMatrixRMaj imp = state.lookAheadImportance();
		DMatrixRMaj ite = state.lookAheadCount();
		if (weights == null) {
			weights = ParameterNormalizer.normalize(imp, fields, alpha, gamma, beta);
		}

		DMatrixRMaj pot = initialEnergy(fields, imp, ite, weights);
		fields.scaleLinks(weights.alpha);
		PathMap pathMap = new PathMap(pot.numRows, pot.numCols);
		PathSolver.accumulate(pot, fields.cu, fields.cl, fields.cr, pathMap);

		int[] seam = SeamTracer.trace(pot, pathMap, tieBreaker);
		if (log.isTraceEnabled()) {
			log.trace("Seam ending at column {} with cost {}", seam[seam.length - 1], pot.get(pot.numRows - 1, seam[seam.length - 1]));
		}
		SeamApplier.apply(state, up, v, seam);
		return seam;
	}

	/**
	 * Per-pixel energy {@code E(r) = (cw + ce)·α' + imp·γ' + ite·β'}.
	 */
	static DMatrixRMaj initialEnergy(EnergyFields fields, DMatrixRMaj imp, DMatrixRMaj ite, Weights w) {
		DMatrixRMaj pot = new DMatrixRMaj(imp.numRows, imp.numCols);
		int n = pot.getNumElements();
		for (int k = 0; k < n; k++) {
			pot.data[k] = (fields.cw.data[k] + fields.ce.data[k]) * w.alpha + imp.data[k] * w.gamma + w.beta * ite.data[k];
		}
		return pot;
	}

	MergeState state() {
		return state;
	}

	/**
	 * @return the normalized weights, or null before the first step
	 */
	Weights weights() {
		return weights;
	}
}
