package com.github.micycle1.seammerge;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Long-lived factorized state of one merge run. Each merged seam replaces every
 * member with a matrix one column narrower.
 *
 * <p>
 * <ul>
 * <li>{@code q11}: accumulation weight per pixel, starts at 1</li>
 * <li>{@code q12}: accumulated negative structure value, starts at −S; the mean
 * structure value is {@code −q12/q11}</li>
 * <li>{@code p12}: negated structure differences to the four neighbours
 * ({@link #UP}, {@link #DOWN}, {@link #RIGHT}, {@link #LEFT})</li>
 * <li>{@code p22}: {@code p12²}</li>
 * <li>{@code simg}: current mean structure map</li>
 * <li>{@code z}: image channels, importance, and a count channel of ones</li>
 * </ul>
 */
final class MergeState {

	static final int UP = 0;
	static final int DOWN = 1;
	static final int RIGHT = 2;
	static final int LEFT = 3;

	final int imageChannels;

	DMatrixRMaj q11;
	DMatrixRMaj q12;
	MatrixStack p12;
	MatrixStack p22;
	DMatrixRMaj simg;
	MatrixStack z;

	private MergeState(int imageChannels, DMatrixRMaj q11, DMatrixRMaj q12, MatrixStack p12, MatrixStack p22, DMatrixRMaj simg, MatrixStack z) {
		this.imageChannels = imageChannels;
		this.q11 = q11;
		this.q12 = q12;
		this.p12 = p12;
		this.p22 = p22;
		this.simg = simg;
		this.z = z;
	}

	/**
	 * Builds the initial state. Inputs are read, never retained.
	 *
	 * @param image      H×W×C image
	 * @param structure  H×W structure (cartoon) map
	 * @param importance H×W importance map, already normalized to a maximum of 1
	 */
	static MergeState initialize(MatrixStack image, DMatrixRMaj structure, DMatrixRMaj importance) {
		int h = structure.numRows, w = structure.numCols;

		DMatrixRMaj q11 = new DMatrixRMaj(h, w);
		CommonOps_DDRM.fill(q11, 1);
		DMatrixRMaj q12 = new DMatrixRMaj(h, w);
		CommonOps_DDRM.changeSign(structure, q12);

		MatrixStack p12 = MatrixStack.zeros(4, h, w);
		DMatrixRMaj up = p12.plane(UP), down = p12.plane(DOWN), right = p12.plane(RIGHT), left = p12.plane(LEFT);
		for (int i = 0; i < h; i++) {
			for (int j = 0; j < w; j++) {
				double s = structure.unsafe_get(i, j);
				if (i > 0) {
					up.unsafe_set(i, j, s - structure.unsafe_get(i - 1, j));
				}
				if (i < h - 1) {
					down.unsafe_set(i, j, s - structure.unsafe_get(i + 1, j));
				}
				if (j < w - 1) {
					right.unsafe_set(i, j, s - structure.unsafe_get(i, j + 1));
				}
				if (j > 0) {
					left.unsafe_set(i, j, s - structure.unsafe_get(i, j - 1));
				}
			}
		}

		// negated for the quadratic cost form
		MatrixStack p22 = MatrixStack.zeros(4, h, w);
		for (int k = 0; k < 4; k++) {
			CommonOps_DDRM.changeSign(p12.plane(k));
			CommonOps_DDRM.elementMult(p12.plane(k), p12.plane(k), p22.plane(k));
		}

		int c = image.depth();
		DMatrixRMaj[] zPlanes = new DMatrixRMaj[c + 2];
		for (int k = 0; k < c; k++) {
			zPlanes[k] = image.plane(k).copy();
		}
		zPlanes[c] = importance.copy();
		zPlanes[c + 1] = new DMatrixRMaj(h, w);
		CommonOps_DDRM.fill(zPlanes[c + 1], 1);

		return new MergeState(c, q11, q12, p12, p22, structure.copy(), new MatrixStack(zPlanes));
	}

	int rows() {
		return q11.numRows;
	}

	int cols() {
		return q11.numCols;
	}

	DMatrixRMaj importance() {
		return z.plane(imageChannels);
	}

	DMatrixRMaj count() {
		return z.plane(imageChannels + 1);
	}

	/**
	 * @return the importance each pixel would carry after merging rightward
	 */
	DMatrixRMaj lookAheadImportance() {
		return Matrices.sumShifted(importance());
	}

	/**
	 * @return the pixel count each pixel would carry after merging rightward
	 */
	DMatrixRMaj lookAheadCount() {
		return Matrices.sumShifted(count());
	}

	/**
	 * Divides the accumulated image channels by the count channel, giving the
	 * average original colour of every surviving pixel.
	 */
	MatrixStack reconstruct() {
		DMatrixRMaj count = count();
		DMatrixRMaj[] out = new DMatrixRMaj[imageChannels];
		for (int k = 0; k < imageChannels; k++) {
			out[k] = new DMatrixRMaj(rows(), cols());
			CommonOps_DDRM.elementDiv(z.plane(k), count, out[k]);
		}
		return new MatrixStack(out);
	}
}
