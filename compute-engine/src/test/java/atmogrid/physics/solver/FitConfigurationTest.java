package atmogrid.physics.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FitConfigurationTest {

    @Test
    @DisplayName("Configuración de producción: H y V libres, escala y reservado fijos, H penalizado")
    void horizontallyConstrained_shouldFreeTwoAndPenaliseHorizontal() {
        FitConfiguration config = FitConfiguration.horizontallyConstrained(0.12, 0.5);

        assertThat(config.freeComponentsInOrder())
                .containsExactly(ShiftComponent.HORIZONTAL, ShiftComponent.VERTICAL);
        assertThat(config.isFree(ShiftComponent.SCALE)).isFalse();
        assertThat(config.isFree(ShiftComponent.RESERVED)).isFalse();
        assertThat(config.getPenalties())
                .containsOnlyKeys(ShiftComponent.HORIZONTAL)
                .containsEntry(ShiftComponent.HORIZONTAL, new PenaltyTerm(0.12, 0.5));
    }

    @Test
    @DisplayName("No se puede penalizar un componente fijo")
    void constructor_penaltyOnFixedComponent_shouldThrow() {
        assertThatThrownBy(() -> new FitConfiguration(
                EnumSet.of(ShiftComponent.VERTICAL),
                Map.of(ShiftComponent.SCALE, PenaltyTerm.towardZero(1.0))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Al menos un componente libre y penalizaciones con incertidumbre positiva")
    void constructor_invalidArguments_shouldThrow() {
        assertThatThrownBy(() -> new FitConfiguration(EnumSet.noneOf(ShiftComponent.class), Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PenaltyTerm.towardZero(0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("ShiftParameters: escalado y acceso por componente")
    void shiftParameters_scaledAndComponents() {
        ShiftParameters p = new ShiftParameters(0.3, 0.1, 0.0, 0.0);

        assertThat(p.scaled(-0.5)).isEqualTo(new ShiftParameters(-0.15, -0.05, -0.0, -0.0));
        assertThat(p.get(ShiftComponent.VERTICAL)).isEqualTo(0.1);
        assertThat(ShiftParameters.of(p.toArray())).isEqualTo(p);
    }
}
