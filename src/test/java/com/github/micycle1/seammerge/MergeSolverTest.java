package com.github.micycle1.seammerge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.junit.jupiter.api.Test;

class MergeSolverTest {

	private static MergeSolver solver(MatrixStack image, DMatrixRMaj structure, DMatrixRMaj importance, TieBreaker tieBreaker) {
		return new MergeSolver(MergeState.initialize(image, structure, importance), 0.5, 0.1, new PairwiseLookAheadSum(), tieBreaker);
	}

	@Test
	void seam_avoids_hard_edge() {
		int edge = 4;
		DMatrixRMaj structure = Grids.hardEdge(6, 8, edge, 100);
		for (double draw : new double[] { 0.0, 0.4, 0.99 }) {
			MergeSolver solver = solver(new MatrixStack(Grids.constant(6, 8, 1)), structure, Grids.constant(6, 8, 1), TieBreaker.fixed(draw));

			int[] seam = solver.step();

			// merging any of columns 2..5 with its right neighbour disturbs the edge
			assertThat(seam).doesNotContain(edge, edge - 1, edge - 2, edge + 1);
			assertThat(solver.weights().alpha).isPositive();
		}
	}

	@Test
	void every_step_keeps_state_consistent() {
		int h = 9, w = 12;
		MatrixStack image = Grids.randomImage(h, w, 3, 42);
		MergeSolver solver = solver(image, Grids.random(h, w, 7, 1), Grids.random(h, w, 8, 1), TieBreaker.seeded(3));
		MergeState state = solver.state();

		for (int k = 1; k <= 8; k++) {
			int[] seam = solver.step();

			assertThat(seam).hasSize(h);
			for (int i = 1; i < h; i++) {
				assertThat(Math.abs(seam[i] - seam[i - 1])).isLessThanOrEqualTo(1);
			}
			for (DMatrixRMaj m : new DMatrixRMaj[] { state.q11, state.q12, state.simg }) {
				assertThat(m.numRows).isEqualTo(h);
				assertThat(m.numCols).isEqualTo(w - k);
			}
			for (MatrixStack s : new MatrixStack[] { state.p12, state.p22, state.z }) {
				assertThat(s.rows()).isEqualTo(h);
				assertThat(s.cols()).isEqualTo(w - k);
			}
			assertThat(CommonOps_DDRM.elementSum(state.count())).isEqualTo(h * w);
			assertThat(CommonOps_DDRM.elementMin(state.q11)).isGreaterThanOrEqualTo(1);
		}
	}

	@Test
	void weights_are_fixed_on_first_step() {
		MergeSolver solver = solver(Grids.randomImage(5, 6, 1, 1), Grids.random(5, 6, 2, 1), Grids.random(5, 6, 3, 1), TieBreaker.seeded(0));
		assertThat(solver.weights()).isNull();

		solver.step();
		ParameterNormalizer.Weights first = solver.weights();
		solver.step();

		assertThat(solver.weights()).isSameAs(first);
	}

	@Test
	void refuses_to_merge_a_single_column() {
		MergeSolver solver = solver(new MatrixStack(Grids.constant(3, 2, 1)), Grids.random(3, 2, 1, 1), Grids.constant(3, 2, 1), TieBreaker.seeded(0));
		solver.step();

		assertThatThrownBy(solver::step).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void initial_energy_combines_terms_in_order() {
		EnergyFields f = new EnergyFields(null, null, null, Grids.constant(1, 2, 1), Grids.constant(1, 2, 3));
		DMatrixRMaj pot = MergeSolver.initialEnergy(f, Grids.constant(1, 2, 2), Grids.constant(1, 2, 4),
				new ParameterNormalizer.Weights(0.5, 0.25, 0.125));

		assertThat(pot.data).containsExactly(4 * 0.5 + 2 * 0.25 + 0.125 * 4, 2.5 + 0.5);
	}
}
