package com.github.micycle1.seammerge;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * Per-iteration structural cost fields, one value per look-ahead pixel.
 *
 * <p>
 * {@code cu}, {@code cl} and {@code cr} price connecting a seam pixel to the seam
 * pixel straight above, above-left and above-right. {@code cw} and {@code ce} price
 * the new west and east neighbour of the merged pixel.
 */
final class EnergyFields {

	final DMatrixRMaj cu;
	final DMatrixRMaj cl;
	final DMatrixRMaj cr;
	final DMatrixRMaj cw;
	final DMatrixRMaj ce;

	EnergyFields(DMatrixRMaj cu, DMatrixRMaj cl, DMatrixRMaj cr, DMatrixRMaj cw, DMatrixRMaj ce) {
		this.cu = cu;
		this.cl = cl;
		this.cr = cr;
		this.cw = cw;
		this.ce = ce;
	}

	/**
	 * @return {@code cw + ce}
	 */
	DMatrixRMaj horizontal() {
		return CommonOps_DDRM.add(cw, ce, null);
	}

	/**
	 * Scales the three link fields in place.
	 */
	void scaleLinks(double factor) {
		CommonOps_DDRM.scale(factor, cu);
		CommonOps_DDRM.scale(factor, cl);
		CommonOps_DDRM.scale(factor, cr);
	}

	/**
	 * @return true if every field is zero everywhere
	 */
	boolean isFlat() {
		return isZero(cu) && isZero(cl) && isZero(cr) && isZero(cw) && isZero(ce);
	}

	private static boolean isZero(DMatrixRMaj m) {
		return CommonOps_DDRM.elementMaxAbs(m) == 0;
	}
}
