package atmogrid.physics.solver.impl;

import atmogrid.config.InterpolationConfig;
import atmogrid.domain.exception.FitDivergenceException;
import atmogrid.physics.solver.FitConfiguration;
import atmogrid.physics.solver.PenaltyTerm;
import atmogrid.physics.solver.ShiftComponent;
import atmogrid.physics.solver.ShiftFitProblem;
import atmogrid.physics.solver.ShiftFitResult;
import atmogrid.physics.solver.ShiftParameters;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class LevenbergMarquardtShiftFitterTest {

    // Escala de profundidad log(masa de columna) y log T de referencia
    private static final double[] X = {0.0, 1.0, 2.0, 3.0, 4.0};
    private static final double[] Y2 = {3.60, 3.62, 3.70, 3.85, 4.05};
    // Y2 desplazada +0.3 en profundidad y +0.1 en log T, muestreada en X
    private static final double[] Y1 = {3.694, 3.714, 3.776, 3.905, 4.090};

    private LevenbergMarquardtShiftFitter fitter;

    @BeforeEach
    void setUp() {
        fitter = new LevenbergMarquardtShiftFitter(InterpolationConfig.getDefaults());
    }

    private static ShiftFitProblem problem(double[] y2) {
        return ShiftFitProblem.withUniformUncertainty(X, Y1, 0.05, X, y2, null);
    }

    @Test
    @DisplayName("Escenario concreto: recupera el desplazamiento conocido (0.3, 0.1)")
    void fit_knownShift_shouldRecoverParameters() {
        log.info(">>> TEST: Recuperación de desplazamiento conocido");

        // ARRANGE
        FitConfiguration config = FitConfiguration.unconstrained(ShiftComponent.HORIZONTAL, ShiftComponent.VERTICAL);
        ShiftParameters guess = new ShiftParameters(0.25, 0.08, 0.0, 0.0);

        // ACT
        ShiftFitResult result = fitter.fit(problem(Y2), guess, config);

        // ASSERT
        log.info("Resultado: {} (rms={}, evaluaciones={})", result.parameters(), result.rms(), result.evaluations());
        assertEquals(0.3, result.parameters().horizontal(), 1e-3);
        assertEquals(0.1, result.parameters().vertical(), 1e-3);
        assertEquals(0.0, result.parameters().scale(), 0.0, "La escala es fija");
        assertTrue(result.rms() < 1e-4, "Ajuste exacto: rms=" + result.rms());
        assertArrayEquals(Y1, result.fittedCurve(), 1e-4);
        assertTrue(result.evaluations() > 0);
    }

    @Test
    @DisplayName("Los componentes fijos conservan exactamente su valor inicial")
    void fit_fixedComponents_shouldKeepInitialValue() {
        FitConfiguration config = FitConfiguration.unconstrained(ShiftComponent.VERTICAL);
        ShiftParameters guess = new ShiftParameters(0.3, 0.0, 0.0, 7.0);

        ShiftFitResult result = fitter.fit(problem(Y2), guess, config);

        assertEquals(0.3, result.parameters().horizontal(), 0.0);
        assertEquals(7.0, result.parameters().reserved(), 0.0);
        assertEquals(0.1, result.parameters().vertical(), 1e-6);
    }

    @Test
    @DisplayName("Penalización: mayor incertidumbre = restricción más débil")
    void fit_penalty_shouldPullTowardTarget() {
        // ARRANGE
        ShiftParameters guess = new ShiftParameters(0.0, 0.07, 0.0, 0.0);
        FitConfiguration weak = FitConfiguration.horizontallyConstrained(0.0, 0.5);
        FitConfiguration strong = new FitConfiguration(
                EnumSet.of(ShiftComponent.HORIZONTAL, ShiftComponent.VERTICAL),
                Map.of(ShiftComponent.HORIZONTAL, new PenaltyTerm(0.0, 0.01)));

        // ACT
        double hWeak = fitter.fit(problem(Y2), guess, weak).parameters().horizontal();
        double hStrong = fitter.fit(problem(Y2), guess, strong).parameters().horizontal();

        // ASSERT
        log.info("Desplazamiento horizontal: sin penalizar 0.3, débil {}, fuerte {}", hWeak, hStrong);
        assertTrue(hWeak < 0.3 && hWeak > 0.1, "La penalización débil sólo frena el desplazamiento: " + hWeak);
        assertTrue(Math.abs(hStrong) < 0.01, "La penalización fuerte lo anula: " + hStrong);
        assertTrue(hStrong < hWeak);
    }

    @Test
    @DisplayName("La penalización actúa hacia su objetivo, no hacia cero")
    void fit_penaltyTarget_shouldAnchorDeviation() {
        FitConfiguration anchored = FitConfiguration.horizontallyConstrained(0.3, 0.01);

        ShiftFitResult result = fitter.fit(problem(Y2), new ShiftParameters(0.3, 0.0, 0.0, 0.0), anchored);

        assertEquals(0.3, result.parameters().horizontal(), 1e-6);
        assertEquals(0.1, result.parameters().vertical(), 1e-6);
    }

    @Test
    @DisplayName("Curva plana sin penalización: jacobiano singular -> FitDivergenceException")
    void fit_flatReferenceWithoutPenalty_shouldDiverge() {
        double[] flat = {3.7, 3.7, 3.7, 3.7, 3.7};
        FitConfiguration config = FitConfiguration.unconstrained(ShiftComponent.HORIZONTAL, ShiftComponent.VERTICAL);

        FitDivergenceException ex = assertThrows(FitDivergenceException.class,
                () -> fitter.fit(problem(flat), ShiftParameters.ZERO, config));

        log.info("Divergencia detectada: {}", ex.getMessage());
    }

    @Test
    @DisplayName("Curva plana con penalización horizontal: el ajuste se estabiliza")
    void fit_flatReferenceWithPenalty_shouldStayAtTarget() {
        double[] flat = {3.7, 3.7, 3.7, 3.7, 3.7};

        ShiftFitResult result = fitter.fit(problem(flat), ShiftParameters.ZERO,
                FitConfiguration.horizontallyConstrained(0.0, 0.5));

        assertEquals(0.0, result.parameters().horizontal(), 1e-8);
        assertEquals(0.1358, result.parameters().vertical(), 1e-8);
    }

    @Test
    @DisplayName("Límite de evaluaciones agotado -> FitDivergenceException con la causa adjunta")
    void fit_evaluationBudgetExhausted_shouldWrapOptimizerFailure() {
        LevenbergMarquardtShiftFitter starved = new LevenbergMarquardtShiftFitter(
                InterpolationConfig.getDefaults().withMaxFitEvaluations(1));
        FitConfiguration config = FitConfiguration.unconstrained(ShiftComponent.HORIZONTAL, ShiftComponent.VERTICAL);

        FitDivergenceException ex = assertThrows(FitDivergenceException.class,
                () -> starved.fit(problem(Y2), new ShiftParameters(0.25, 0.08, 0.0, 0.0), config));

        assertTrue(ex.getCause() != null);
    }
}
