package com.github.micycle1.seammerge;

import java.util.Objects;

import org.ejml.data.DMatrixRMaj;

/**
 * Look-ahead (shifted-sum) versions of the factorized structure state: what every
 * pixel's q11, q12, p12 and p22 would become if it were merged with its right
 * neighbour. All members are one column narrower than the state they came from.
 *
 * @author Michael Carleton
 */
public final class LookAhead {

	final DMatrixRMaj q11;
	final DMatrixRMaj q12;
	final MatrixStack p12;
	final MatrixStack p22;

	public LookAhead(DMatrixRMaj q11, DMatrixRMaj q12, MatrixStack p12, MatrixStack p22) {
		this.q11 = Objects.requireNonNull(q11);
		this.q12 = Objects.requireNonNull(q12);
		this.p12 = Objects.requireNonNull(p12);
		this.p22 = Objects.requireNonNull(p22);
	}

	public DMatrixRMaj q11() {
		return q11;
	}

	public DMatrixRMaj q12() {
		return q12;
	}

	public MatrixStack p12() {
		return p12;
	}

	public MatrixStack p22() {
		return p22;
	}
}
