package atmogrid.physics.solver;

/**
 * Resultado de un ajuste convergido.
 *
 * @param parameters  Parámetros óptimos (libres ajustados, fijos en su valor inicial).
 * @param fittedCurve Curva desplazada evaluada en los puntos objetivo (sin filas de penalización).
 * @param rms         RMS de los residuos ponderados de los puntos objetivo.
 * @param evaluations Evaluaciones del modelo consumidas por el optimizador.
 */
public record ShiftFitResult(ShiftParameters parameters, double[] fittedCurve, double rms, int evaluations) {

    public ShiftFitResult {
        fittedCurve = fittedCurve.clone();
    }

    @Override
    public double[] fittedCurve() {
        return fittedCurve.clone();
    }
}
