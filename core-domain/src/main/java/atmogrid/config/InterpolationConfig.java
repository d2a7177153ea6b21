package atmogrid.config;

import atmogrid.domain.atmosphere.DepthVariable;
import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con todos los parámetros numéricos de la interpolación de atmósferas.
 * <p>
 * Agrupa las constantes del recorte de capas superiores, del ajuste de desplazamientos,
 * de la corrección del extremo profundo y del cálculo de la geometría esférica.
 *
 * @param minRhoxStep                 Paso fraccional mínimo entre capas consecutivas en RHOX.
 * @param minTauStep                  Paso fraccional mínimo entre capas consecutivas en TAU.
 * @param fitUncertainty              Incertidumbre arbitraria asignada a cada punto del ajuste (dex).
 * @param horizontalShiftUncertainty  Incertidumbre de la penalización sobre el desplazamiento horizontal.
 *                                    Un valor mayor implica una restricción más débil.
 * @param cornerTopTrim               Capas superiores descartadas al interpolar las esquinas en [M/H].
 * @param endpointArtifactLogValue    Valor logarítmico asociado al artefacto conocido del extremo profundo.
 * @param endpointArtifactTolerance   Distancia máxima al valor anterior para activar la corrección.
 * @param solarRadiusCm               Radio solar (cm).
 * @param solarLogg                   log g solar (cgs).
 * @param minimumSphericalRadius      Radio mínimo (unidades de la rejilla) para considerar una esquina esférica.
 * @param maxFitEvaluations           Máximo de evaluaciones del modelo por ajuste.
 * @param maxFitIterations            Máximo de iteraciones de Levenberg-Marquardt por ajuste.
 * @param jacobianStep                Paso de diferencias finitas centradas para el jacobiano.
 * @param maxConditionNumber          Número de condición máximo del jacobiano ponderado en el óptimo.
 */
@Builder
@With
public record InterpolationConfig(
        // --- Recorte de capas superiores ---
        double minRhoxStep,
        double minTauStep,

        // --- Ajuste de desplazamientos ---
        double fitUncertainty,
        double horizontalShiftUncertainty,
        int cornerTopTrim,

        // --- Corrección del extremo profundo ---
        double endpointArtifactLogValue,
        double endpointArtifactTolerance,

        // --- Geometría esférica ---
        double solarRadiusCm,
        double solarLogg,
        double minimumSphericalRadius,

        // --- Optimizador ---
        int maxFitEvaluations,
        int maxFitIterations,
        double jacobianStep,
        double maxConditionNumber
) {

    public InterpolationConfig {
        if (minRhoxStep < 0 || minTauStep < 0) {
            throw new IllegalArgumentException("Los pasos fraccionales mínimos no pueden ser negativos.");
        }
        if (fitUncertainty <= 0 || horizontalShiftUncertainty <= 0) {
            throw new IllegalArgumentException("Las incertidumbres del ajuste deben ser positivas.");
        }
        if (cornerTopTrim < 0) {
            throw new IllegalArgumentException("El recorte superior no puede ser negativo.");
        }
        if (maxFitEvaluations <= 0 || maxFitIterations <= 0) {
            throw new IllegalArgumentException("Los límites del optimizador deben ser positivos.");
        }
        if (jacobianStep <= 0 || maxConditionNumber <= 1) {
            throw new IllegalArgumentException("Paso del jacobiano o límite de condición inválidos.");
        }
    }

    /**
     * Valores de producción.
     */
    public static InterpolationConfig getDefaults() {
        return InterpolationConfig.builder()
                .minRhoxStep(0.01)
                .minTauStep(0.01)
                .fitUncertainty(0.05)
                .horizontalShiftUncertainty(0.5)
                .cornerTopTrim(1)
                .endpointArtifactLogValue(4.2)
                .endpointArtifactTolerance(0.1)
                .solarRadiusCm(69.550e9)
                .solarLogg(4.44)
                .minimumSphericalRadius(1.0)
                .maxFitEvaluations(2000)
                .maxFitIterations(500)
                .jacobianStep(1e-6)
                .maxConditionNumber(1e10)
                .build();
    }

    /**
     * Paso fraccional mínimo de la coordenada de profundidad indicada.
     */
    public double minStepFor(DepthVariable variable) {
        return variable == DepthVariable.RHOX ? minRhoxStep : minTauStep;
    }
}
