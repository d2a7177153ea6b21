package atmogrid.physics.solver;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Slf4j
class ShiftedInterpolatorTest {

    private static final double TOL = 1e-12;

    // Curva de referencia con espaciado irregular
    private static final double[] X2 = {0.0, 1.0, 2.0, 4.0};
    private static final double[] Y2 = {1.0, 3.0, 2.0, 6.0};

    @Test
    @DisplayName("Desplazamiento nulo: se reduce a interpolación lineal de (x2, y2)")
    void evaluate_zeroShift_shouldReduceToLinearInterpolation() {
        // ARRANGE
        double[] x1 = {0.0, 0.5, 1.5, 3.0, 4.0};

        // ACT
        double[] y = ShiftedInterpolator.evaluate(x1, ShiftParameters.ZERO, X2, Y2);

        // ASSERT
        log.info("Interpolación lineal: {} -> {}", Arrays.toString(x1), Arrays.toString(y));
        assertArrayEquals(new double[]{1.0, 2.0, 2.5, 4.0, 6.0}, y, TOL);
    }

    @Test
    @DisplayName("Extrapolación con el segmento extremo a ambos lados")
    void evaluate_outsideRange_shouldExtrapolateLinearly() {
        double[] y = ShiftedInterpolator.evaluate(new double[]{-1.0, 5.0}, ShiftParameters.ZERO, X2, Y2);

        // Pendiente inicial 2, pendiente final 2
        assertArrayEquals(new double[]{-1.0, 8.0}, y, TOL);
    }

    @Test
    @DisplayName("Desplazamientos horizontal y vertical: y(x) = y2(x - dx) + dy")
    void evaluate_withShift_shouldMoveCurve() {
        ShiftParameters shift = new ShiftParameters(1.0, 0.5, 0.0, 0.0);

        double[] y = ShiftedInterpolator.evaluate(new double[]{1.5, 3.0}, shift, X2, Y2);

        // y2(0.5) + 0.5 = 2.5 ; y2(2.0) + 0.5 = 2.5
        assertArrayEquals(new double[]{2.5, 2.5}, y, TOL);
    }

    @Test
    @DisplayName("Reescalado respecto al centro de la curva de salida")
    void evaluate_withScale_shouldStretchAboutMidpoint() {
        ShiftParameters shift = new ShiftParameters(0.0, 0.0, 1.0, 0.0);

        double[] y = ShiftedInterpolator.evaluate(X2, shift, X2, Y2);

        // Centro = (1 + 6) / 2 = 3.5 ; factor 2
        assertArrayEquals(new double[]{-1.5, 2.5, 0.5, 8.5}, y, TOL);
    }

    @Test
    @DisplayName("El componente reservado no afecta a la curva")
    void evaluate_reservedComponent_shouldBeIgnored() {
        double[] base = ShiftedInterpolator.evaluate(X2, ShiftParameters.ZERO, X2, Y2);
        double[] withReserved = ShiftedInterpolator.evaluate(X2, new ShiftParameters(0.0, 0.0, 0.0, 42.0), X2, Y2);

        assertArrayEquals(base, withReserved, 0.0);
    }

    @Test
    @DisplayName("Con referencia de acotado, la salida queda dentro de [min, max] de la referencia")
    void evaluate_withClipReference_shouldClampOutput() {
        double[] clip = {2.5, 1.5, 2.0};

        double[] clipped = ShiftedInterpolator.evaluate(new double[]{-1.0, 0.5, 1.5, 5.0}, ShiftParameters.ZERO, X2, Y2, clip);
        double[] unclipped = ShiftedInterpolator.evaluate(new double[]{-1.0, 0.5, 1.5, 5.0}, ShiftParameters.ZERO, X2, Y2);

        assertArrayEquals(new double[]{1.5, 2.0, 2.5, 2.5}, clipped, TOL);
        assertEquals(8.0, unclipped[3], TOL, "La versión de producción no se acota");
    }

    @Test
    @DisplayName("Una referencia de menos de 2 puntos se rechaza")
    void evaluate_degenerateReference_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> ShiftedInterpolator.evaluate(new double[]{0.0}, ShiftParameters.ZERO, new double[]{1.0}, new double[]{1.0}));
    }
}
