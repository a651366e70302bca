package com.github.micycle1.seammerge;

import java.util.Arrays;
import java.util.Objects;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * An H×W×K grid stored as K equally shaped {@link DMatrixRMaj} planes.
 *
 * <p>
 * Used for multi-channel images (one plane per channel), the four directional
 * structure planes, and the accumulation matrix. Planes are held by reference;
 * use {@link #copy()} when an independent working copy is needed.
 *
 * <p>
 * {@link #equals(Object)} and {@link #hashCode()} compare plane contents. The
 * planes are mutable, so a stack's hash changes whenever a plane is written; do
 * not use stacks as map keys or set elements.
 *
 * @author Michael Carleton
 */
public final class MatrixStack {

	private final DMatrixRMaj[] planes;

	/**
	 * Creates a stack over the given planes (not copied).
	 *
	 * @param planes one or more matrices sharing the same shape
	 * @throws IllegalArgumentException if no plane is given or shapes differ
	 * @throws NullPointerException     if any plane is null
	 */
	public MatrixStack(DMatrixRMaj... planes) {
		Objects.requireNonNull(planes);
		if (planes.length == 0) {
			throw new IllegalArgumentException("A stack needs at least one plane.");
		}
		DMatrixRMaj first = Objects.requireNonNull(planes[0]);
		for (DMatrixRMaj p : planes) {
			Objects.requireNonNull(p, "planes must not contain null");
			if (p.numRows != first.numRows || p.numCols != first.numCols) {
				throw new IllegalArgumentException("All planes must share one shape: " + first.numRows + "x" + first.numCols + " vs " + p.numRows + "x" + p.numCols);
			}
		}
		this.planes = planes.clone();
	}

	/**
	 * Creates a zero-filled stack.
	 */
	public static MatrixStack zeros(int depth, int rows, int cols) {
		DMatrixRMaj[] planes = new DMatrixRMaj[depth];
		for (int k = 0; k < depth; k++) {
			planes[k] = new DMatrixRMaj(rows, cols);
		}
		return new MatrixStack(planes);
	}

	public int depth() {
		return planes.length;
	}

	public int rows() {
		return planes[0].numRows;
	}

	public int cols() {
		return planes[0].numCols;
	}

	public DMatrixRMaj plane(int k) {
		return planes[k];
	}

	public double get(int row, int col, int k) {
		return planes[k].get(row, col);
	}

	/**
	 * @return a deep copy, sharing no storage with this stack
	 */
	public MatrixStack copy() {
		DMatrixRMaj[] out = new DMatrixRMaj[planes.length];
		for (int k = 0; k < planes.length; k++) {
			out[k] = planes[k].copy();
		}
		return new MatrixStack(out);
	}

	/**
	 * Transposes every plane, giving a W×H×K stack.
	 *
	 * <p>
	 * Seam merging only removes columns. To remove rows, transpose the image,
	 * structure and importance maps, run the merger, and transpose the result
	 * back.
	 */
	public MatrixStack transpose() {
		DMatrixRMaj[] out = new DMatrixRMaj[planes.length];
		for (int k = 0; k < planes.length; k++) {
			out[k] = CommonOps_DDRM.transpose(planes[k], null);
		}
		return new MatrixStack(out);
	}

	/**
	 * Planewise {@link Matrices#sumShifted(DMatrixRMaj)}.
	 */
	MatrixStack sumShifted() {
		DMatrixRMaj[] out = new DMatrixRMaj[planes.length];
		for (int k = 0; k < planes.length; k++) {
			out[k] = Matrices.sumShifted(planes[k]);
		}
		return new MatrixStack(out);
	}

	/**
	 * Planewise {@link Matrices#deleteAndReplace(DMatrixRMaj, DMatrixRMaj, int[])}.
	 */
	MatrixStack deleteAndReplace(MatrixStack lookAhead, int[] seam) {
		DMatrixRMaj[] out = new DMatrixRMaj[planes.length];
		for (int k = 0; k < planes.length; k++) {
			out[k] = Matrices.deleteAndReplace(planes[k], lookAhead.planes[k], seam);
		}
		return new MatrixStack(out);
	}

	/**
	 * Planewise {@link Matrices#deleteAndMerge(DMatrixRMaj, int[])}.
	 */
	MatrixStack deleteAndMerge(int[] seam) {
		DMatrixRMaj[] out = new DMatrixRMaj[planes.length];
		for (int k = 0; k < planes.length; k++) {
			out[k] = Matrices.deleteAndMerge(planes[k], seam);
		}
		return new MatrixStack(out);
	}

	@Override
	public String toString() {
		return "MatrixStack[" + rows() + "x" + cols() + "x" + depth() + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof MatrixStack s)) {
			return false;
		}
		if (s.depth() != depth() || s.rows() != rows() || s.cols() != cols()) {
			return false;
		}
		for (int k = 0; k < planes.length; k++) {
			int n = planes[k].getNumElements();
			if (!Arrays.equals(planes[k].data, 0, n, s.planes[k].data, 0, n)) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		int h = Objects.hash(depth(), rows(), cols());
		for (DMatrixRMaj p : planes) {
			for (int i = 0; i < p.getNumElements(); i++) {
				h = 31 * h + Double.hashCode(p.data[i]);
			}
		}
		return h;
	}
}
