package com.github.micycle1.seammerge;

import java.util.Objects;
import java.util.concurrent.CancellationException;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Content-aware image width reduction by seam merging.
 *
 * <p>
 * Each iteration finds a connected vertical seam (one pixel per row, adjacent
 * rows at most one column apart) that minimizes a weighted sum of three energies
 * and merges every seam pixel into its right neighbour:
 * <ul>
 * <li><b>structure</b>: how much merging distorts the structure map's
 * differences to neighbouring pixels;</li>
 * <li><b>importance</b>: how much importance the merged pixels carry;</li>
 * <li><b>iteration</b>: how many original pixels have already been folded into
 * the merged pixels.</li>
 * </ul>
 * The structure map is tracked in a factorized (numerator, weight) form with
 * precomputed look-ahead sums, so a merge is a constant-time update per row
 * instead of a recomputation from the original data. The output pixel value is
 * the average of every original pixel merged into it.
 *
 * <p>
 * Only columns are removed. To remove rows, transpose the image
 * ({@link MatrixStack#transpose()}), structure and importance maps, merge, and
 * transpose the result back.
 *
 * <p>
 * Instances are immutable configurations; inputs are copied at construction and
 * never written. {@link #generate()} may be called repeatedly, each call running
 * independently.
 *
 * @author Michael Carleton
 */
public final class SeamMerger {

	private static final Logger log = LoggerFactory.getLogger(SeamMerger.class);

	private final MatrixStack image;
	private final DMatrixRMaj structure;
	private final DMatrixRMaj importance;
	private final int deleteNumberW;
	private final int deleteNumberH;
	private final double alpha;
	private final double beta;
	private final double gamma;

	private final TieBreaker tieBreaker;
	private final ProgressListener progress;
	private final LookAheadSum lookAheadSum;

	/**
	 * Creates a merger with default {@link Params}.
	 *
	 * @see #SeamMerger(MatrixStack, DMatrixRMaj, DMatrixRMaj, int, int, double,
	 *      double, Params)
	 */
	public SeamMerger(MatrixStack image, DMatrixRMaj structure, DMatrixRMaj importance, int deleteNumberW, int deleteNumberH, double alpha,
			double beta) {
		this(image, structure, importance, deleteNumberW, deleteNumberH, alpha, beta, new Params());
	}

	/**
	 * Creates a merger.
	 *
	 * <p>
	 * {@code deleteNumberW} and {@code deleteNumberH} are summed into a single
	 * number of column seams.
	 *
	 * @param image         H×W×C image
	 * @param structure     H×W structure (cartoon) map of the image
	 * @param importance    H×W importance map; divided by its maximum
	 * @param deleteNumberW columns to remove
	 * @param deleteNumberH additional seams to remove (also columns)
	 * @param alpha         structure weight; the importance weight is
	 *                      {@code 1 - alpha}
	 * @param beta          iteration count weight
	 * @param params        collaborators
	 * @throws InvalidInputException          if shapes differ, counts are
	 *                                        negative or {@code max(importance)}
	 *                                        is not positive
	 * @throws SeamCountOutOfBoundsException  if
	 *                                        {@code deleteNumberW + deleteNumberH >= W}
	 * @throws NullPointerException           if any argument is null
	 */
	public SeamMerger(MatrixStack image, DMatrixRMaj structure, DMatrixRMaj importance, int deleteNumberW, int deleteNumberH, double alpha, double beta,
			Params params) {
		Objects.requireNonNull(image, "image must not be null");
		Objects.requireNonNull(structure, "structure must not be null");
		Objects.requireNonNull(importance, "importance must not be null");
		Objects.requireNonNull(params, "params must not be null");

		int h = image.rows(), w = image.cols();
		if (h == 0 || w == 0) {
			throw new InvalidInputException("Image is empty: " + h + "x" + w);
		}
		checkShape("structure", structure, h, w);
		checkShape("importance", importance, h, w);
		if (deleteNumberW < 0 || deleteNumberH < 0) {
			throw new InvalidInputException("Seam counts must be non-negative: " + deleteNumberW + ", " + deleteNumberH);
		}
		long seams = (long) deleteNumberW + deleteNumberH;
		if (seams >= w) {
			throw new SeamCountOutOfBoundsException((int) Math.min(Integer.MAX_VALUE, seams), w);
		}
		double maxImportance = CommonOps_DDRM.elementMax(importance);
		if (!(maxImportance > 0 && Double.isFinite(maxImportance))) {
			throw new InvalidInputException("Importance map maximum must be positive and finite, was " + maxImportance);
		}

		this.image = image.copy();
		this.structure = structure.copy();
		this.importance = new DMatrixRMaj(h, w);
		CommonOps_DDRM.divide(importance, maxImportance, this.importance);
		this.deleteNumberW = deleteNumberW;
		this.deleteNumberH = deleteNumberH;
		this.alpha = alpha;
		this.beta = beta;
		this.gamma = 1 - alpha;

		this.tieBreaker = Objects.requireNonNull(params.tieBreaker, "params.tieBreaker must not be null");
		this.progress = Objects.requireNonNull(params.progress, "params.progress must not be null");
		this.lookAheadSum = Objects.requireNonNull(params.lookAheadSum, "params.lookAheadSum must not be null");
	}

	private static void checkShape(String name, DMatrixRMaj m, int h, int w) {
		if (m.numRows != h || m.numCols != w) {
			throw new InvalidInputException(name + " is " + m.numRows + "x" + m.numCols + " but image is " + h + "x" + w);
		}
	}

	/**
	 * Runs all seam merges and reconstructs the reduced image.
	 *
	 * <p>
	 * The run is all-or-nothing: a failure leaves no partial result. The calling
	 * thread's interrupt flag is checked between seams.
	 *
	 * @return H×(W − deleteNumberW − deleteNumberH)×C image
	 * @throws DegenerateNormalizationException if the energy terms cannot be
	 *                                          normalized
	 * @throws CancellationException            if the calling thread is
	 *                                          interrupted
	 */
	public MatrixStack generate() {
		int numSeams = getSeamCount();
		log.info("Merging {} seams from {}x{}x{} image (alpha={}, beta={})", numSeams, image.rows(), image.cols(), image.depth(), alpha, beta);

		MergeSolver solver = newSolver();
		for (int i = 0; i < numSeams; i++) {
			if (Thread.currentThread().isInterrupted()) {
				throw new CancellationException("Seam merging interrupted after " + i + " of " + numSeams + " seams");
			}
			progress.progress(i, numSeams);
			solver.step();
		}
		progress.done();

		MatrixStack out = solver.state().reconstruct();
		log.info("Reduced image to {}x{}", out.rows(), out.cols());
		return out;
	}

	MergeSolver newSolver() {
		return new MergeSolver(MergeState.initialize(image, structure, importance), alpha, beta, lookAheadSum, tieBreaker);
	}

	public int getSeamCount() {
		return deleteNumberW + deleteNumberH;
	}

	public int getOutputWidth() {
		return image.cols() - getSeamCount();
	}

	public double getAlpha() {
		return alpha;
	}

	public double getBeta() {
		return beta;
	}

	public double getGamma() {
		return gamma;
	}

	/**
	 * Pluggable collaborators of a merge run.
	 */
	public static final class Params {
		/** Picks among equally cheap seams. */
		public TieBreaker tieBreaker = TieBreaker.random();
		/** Receives one call per seam and one on completion. */
		public ProgressListener progress = ProgressListener.NONE;
		/** Look-ahead shifted sum; must be bit-exact with pairwise addition. */
		public LookAheadSum lookAheadSum = new PairwiseLookAheadSum();
	}
}
