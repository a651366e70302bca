package com.github.micycle1.seammerge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.Test;

class SeamApplierTest {

	private static MergeState state() {
		DMatrixRMaj x = new DMatrixRMaj(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } });
		DMatrixRMaj s = new DMatrixRMaj(new double[][] { { 0, 1, 2 }, { 3, 4, 5 } });
		return MergeState.initialize(new MatrixStack(x), s, Grids.constant(2, 3, 1));
	}

	private static void merge(MergeState state, int... seam) {
		LookAhead up = new PairwiseLookAheadSum().sum(state.q11, state.q12, state.p12, state.p22);
		SeamApplier.apply(state, up, EnergyModel.lookAheadMean(up), seam);
	}

	@Test
	void all_tracked_matrices_shrink_in_lockstep() {
		MergeState state = state();
		merge(state, 0, 1);

		for (DMatrixRMaj m : new DMatrixRMaj[] { state.q11, state.q12, state.simg, state.p12.plane(0), state.p22.plane(3), state.z.plane(2) }) {
			assertThat(m.numRows).isEqualTo(2);
			assertThat(m.numCols).isEqualTo(2);
		}
		assertThat(state.p12.depth()).isEqualTo(4);
		assertThat(state.z.depth()).isEqualTo(3);
	}

	@Test
	void seam_pixel_is_merged_into_right_neighbour() {
		MergeState state = state();
		merge(state, 0, 1);

		assertThat(state.q11.data).containsExactly(2, 1, 1, 2);
		assertThat(state.q12.data).containsExactly(-1, -2, -3, -9);
		assertThat(state.simg.data).containsExactly(0.5, 2, 3, 4.5);
		assertThat(state.z.plane(0).data).containsExactly(3, 3, 4, 11);
		assertThat(state.count().data).containsExactly(2, 1, 1, 2);
		assertThat(state.reconstruct().plane(0).data).containsExactly(1.5, 3, 4, 5.5);
	}

	@Test
	void count_channel_is_conserved() {
		MergeState state = state();
		merge(state, 1, 0);
		assertThat(CommonOps_DDRM.elementSum(state.count())).isEqualTo(6);
		merge(state, 0, 0);
		assertThat(CommonOps_DDRM.elementSum(state.count())).isEqualTo(6);
		assertThat(state.cols()).isEqualTo(1);
	}

	@Test
	void rejects_seam_without_right_neighbour() {
		MergeState state = state();
		assertThatThrownBy(() -> merge(state, 2, 0)).isInstanceOf(IllegalArgumentException.class);
		assertThat(state.cols()).isEqualTo(3);
	}
}
