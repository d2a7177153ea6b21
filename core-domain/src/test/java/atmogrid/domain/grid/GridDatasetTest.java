package atmogrid.domain.grid;

import atmogrid.domain.atmosphere.AtmosphereProfile;
import atmogrid.domain.atmosphere.DepthVariable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridDatasetTest {

    private GridDataset grid;

    private static AtmosphereProfile model(double teff, double logg, double monh, int ndep, boolean withTau) {
        double[] rhox = new double[ndep];
        double[] tau = new double[ndep];
        double[] values = new double[ndep];
        for (int i = 0; i < ndep; i++) {
            rhox[i] = Math.pow(10.0, -3.0 + i);
            tau[i] = Math.pow(10.0, -5.0 + i);
            values[i] = 1000.0 * (i + 1);
        }
        return AtmosphereProfile.builder()
                .teff(teff).logg(logg).monh(monh)
                .rhox(rhox).tau(withTau ? tau : null)
                .temperature(values).electronDensity(values).atomicDensity(values).massDensity(values)
                .build();
    }

    @BeforeEach
    void setUp() {
        grid = GridDataset.builder()
                .models(List.of(
                        model(5000, 4.0, 0.0, 5, true),
                        model(5500, 4.0, 0.0, 5, true),
                        model(5000, 4.5, 0.0, 6, true),
                        model(6000, 4.5, 0.0, 6, true),
                        model(5000, 4.0, -1.0, 5, true),
                        model(5000, 4.0, -1.0, 5, false)))
                .version("test-1")
                .source("synthetic.json")
                .build();
    }

    @Test
    @DisplayName("Valores distintos ordenados en cada eje")
    void distinctValues_shouldBeSortedAndUnique() {
        assertThat(grid.distinctMetallicities()).containsExactly(-1.0, 0.0);
        assertThat(grid.distinctGravities(0.0)).containsExactly(4.0, 4.5);
        assertThat(grid.distinctGravities(-1.0)).containsExactly(4.0);
        assertThat(grid.distinctTemperatures(0.0, 4.5)).containsExactly(5000.0, 6000.0);
    }

    @Test
    @DisplayName("findModelIndices devuelve todas las coincidencias exactas")
    void findModelIndices_shouldReturnAllMatches() {
        assertThat(grid.findModelIndices(5500, 4.0, 0.0)).containsExactly(1);
        assertThat(grid.findModelIndices(5000, 4.0, -1.0)).containsExactly(4, 5);
        assertThat(grid.findModelIndices(7000, 4.0, 0.0)).isEmpty();
    }

    @Test
    @DisplayName("Una coordenada de profundidad existe sólo si está en todos los modelos")
    void hasDepthVariable_requiresAllModels() {
        assertThat(grid.hasDepthVariable(DepthVariable.RHOX)).isTrue();
        assertThat(grid.hasDepthVariable(DepthVariable.TAU)).isFalse();
    }

    @Test
    @DisplayName("maxdep se deriva del modelo más profundo si no se indica")
    void maxDepth_shouldDefaultToDeepestModel() {
        assertThat(grid.getMaxDepth()).isEqualTo(6);
        assertThat(grid.size()).isEqualTo(6);
    }

    @Test
    @DisplayName("maxdep menor que el modelo más profundo es incoherente")
    void constructor_maxDepthTooSmall_shouldThrow() {
        assertThatThrownBy(() -> GridDataset.builder()
                .models(List.of(model(5000, 4.0, 0.0, 6, true)))
                .maxDepth(5)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("La lista de modelos es inmutable y no puede estar vacía")
    void models_shouldBeImmutableAndNonEmpty() {
        assertThatThrownBy(() -> grid.getModels().add(model(5000, 4.0, 0.0, 5, true)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> GridDataset.builder().models(List.of()).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
