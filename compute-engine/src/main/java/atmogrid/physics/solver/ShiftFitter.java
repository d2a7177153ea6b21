package atmogrid.physics.solver;

/**
 * Ajuste no lineal con restricciones que alinea una curva tabulada sobre otra.
 */
public interface ShiftFitter {
    /**
     * Busca los parámetros que minimizan el residuo entre {@code y1} y la curva
     * {@code (x2, y2)} desplazada y evaluada en {@code x1}.
     *
     * @param problem       Curvas objetivo y de referencia.
     * @param initialGuess  Semilla. Los componentes fijos conservan este valor.
     * @param configuration Componentes libres y penalizaciones.
     * @return Parámetros óptimos y curva ajustada.
     * @throws atmogrid.domain.exception.FitDivergenceException si el ajuste no converge o está mal condicionado.
     */
    ShiftFitResult fit(ShiftFitProblem problem, ShiftParameters initialGuess, FitConfiguration configuration);
}
