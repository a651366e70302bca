package com.github.micycle1.seammerge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

import com.github.micycle1.seammerge.ParameterNormalizer.Weights;

class ParameterNormalizerTest {

	private static EnergyFields fields(DMatrixRMaj cw) {
		int h = cw.numRows, n = cw.numCols;
		return new EnergyFields(new DMatrixRMaj(h, n), new DMatrixRMaj(h, n), new DMatrixRMaj(h, n), cw, new DMatrixRMaj(h, n));
	}

	@Test
	void divides_weights_by_maximum_seam_energies() {
		DMatrixRMaj imp = Grids.constant(2, 2, 2);
		EnergyFields f = fields(Grids.constant(2, 2, 1));

		Weights w = ParameterNormalizer.normalize(imp, f, 0.6, 0.4, 0.2);

		// strMax = 1 + 1, impMax = 2 + 2, iteMax = 2 rows
		assertThat(w.alpha).isCloseTo(0.3, within(1e-15));
		assertThat(w.gamma).isCloseTo(0.1, within(1e-15));
		assertThat(w.beta).isCloseTo(0.1, within(1e-15));
	}

	@Test
	void structure_maximum_is_largest_cheapest_seam() {
		DMatrixRMaj cw = new DMatrixRMaj(new double[][] { { 1, 4, 9 }, { 2, 2, 2 } });
		Weights w = ParameterNormalizer.normalize(Grids.constant(2, 3, 1), fields(cw), 1, 0, 0);

		// last row after min pass: [3, 3, 6] -> 6
		assertThat(w.alpha).isCloseTo(1.0 / 6, within(1e-15));
	}

	@Test
	void does_not_modify_its_inputs() {
		DMatrixRMaj imp = Grids.constant(3, 2, 2);
		EnergyFields f = fields(Grids.constant(3, 2, 1));
		ParameterNormalizer.normalize(imp, f, 0.5, 0.5, 0.5);

		assertThat(imp.data).containsOnly(2.0);
		assertThat(f.cw.data).containsOnly(1.0);
	}

	@Test
	void flat_structure_disables_structure_term() {
		DMatrixRMaj imp = Grids.constant(4, 3, 2);
		Weights w = ParameterNormalizer.normalize(imp, fields(new DMatrixRMaj(4, 3)), 0.5, 0.5, 0.3);

		assertThat(w.alpha).isEqualTo(0.0);
		assertThat(w.gamma).isCloseTo(0.5 / 8, within(1e-15));
		assertThat(w.beta).isCloseTo(0.3 / 4, within(1e-15));
	}

	@Test
	void zero_structure_maximum_fails() {
		// every end column has a zero-cost seam although the field is not flat
		DMatrixRMaj cw = new DMatrixRMaj(new double[][] { { 5, 0 }, { 0, 0 } });

		assertThatThrownBy(() -> ParameterNormalizer.normalize(Grids.constant(2, 2, 1), fields(cw), 0.5, 0.5, 0.5))
				.isInstanceOf(DegenerateNormalizationException.class).hasMessageContaining("Structure");
	}

	@Test
	void zero_importance_maximum_fails() {
		assertThatThrownBy(() -> ParameterNormalizer.normalize(new DMatrixRMaj(2, 2), fields(Grids.constant(2, 2, 1)), 0.5, 0.5, 0.5))
				.isInstanceOf(DegenerateNormalizationException.class).hasMessageContaining("Importance");
	}
}
