package com.github.micycle1.seammerge;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Balances the three energy terms (structure, importance, iteration count) by
 * dividing each user weight by the largest seam energy its term can reach on the
 * first iteration.
 */
final class ParameterNormalizer {

	private static final Logger log = LoggerFactory.getLogger(ParameterNormalizer.class);

	private ParameterNormalizer() {
	}

	/**
	 * Normalized weights, fixed after the first iteration.
	 */
	static final class Weights {
		final double alpha;
		final double gamma;
		final double beta;

		Weights(double alpha, double gamma, double beta) {
			this.alpha = alpha;
			this.gamma = gamma;
			this.beta = beta;
		}

		@Override
		public String toString() {
			return "Weights[alpha=" + alpha + ", gamma=" + gamma + ", beta=" + beta + "]";
		}
	}

	/**
	 * @param importance look-ahead importance of the first iteration
	 * @param fields     unweighted structure fields of the first iteration
	 * @param alpha      structure weight
	 * @param gamma      importance weight
	 * @param beta       iteration count weight
	 * @throws DegenerateNormalizationException if the importance or structure
	 *                                          maximum is zero or not finite
	 */
	static Weights normalize(DMatrixRMaj importance, EnergyFields fields, double alpha, double gamma, double beta) {
		DMatrixRMaj impPot = PathSolver.accumulateMaximum(importance.copy());
		double impMax = lastRowMax(impPot);
		if (!(impMax != 0 && Double.isFinite(impMax))) {
			throw new DegenerateNormalizationException("Importance maximum is " + impMax + "; cannot normalize gamma.");
		}

		double alphaN;
		if (fields.isFlat()) {
			// every structure cost is zero, so the term contributes nothing at any scale
			log.warn("Structure map yields no structure energy; structure term disabled.");
			alphaN = 0;
		} else {
			DMatrixRMaj strPot = PathSolver.accumulate(fields.horizontal(), fields.cu, fields.cl, fields.cr);
			double strMax = lastRowMax(strPot);
			if (!(strMax != 0 && Double.isFinite(strMax))) {
				throw new DegenerateNormalizationException("Structure maximum is " + strMax + "; cannot normalize alpha.");
			}
			alphaN = alpha / strMax;
		}

		int iteMax = importance.numRows;
		Weights w = new Weights(alphaN, gamma / impMax, beta / iteMax);
		log.debug("Normalized {} (impMax={}, iteMax={})", w, impMax, iteMax);
		return w;
	}

	private static double lastRowMax(DMatrixRMaj pot) {
		DMatrixRMaj lastRow = CommonOps_DDRM.extractRow(pot, pot.numRows - 1, null);
		return CommonOps_DDRM.elementMax(lastRow);
	}
}
