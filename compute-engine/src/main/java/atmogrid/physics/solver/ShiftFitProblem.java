package atmogrid.physics.solver;

import java.util.Arrays;
import java.util.Objects;

/**
 * Datos de un ajuste: la curva objetivo {@code (x1, y1)} con sus incertidumbres y la curva
 * de referencia {@code (x2, y2)} que se desplaza sobre ella.
 *
 * @param x1             Abscisas donde se evalúa la curva desplazada.
 * @param y1             Valores objetivo (logarítmicos).
 * @param uncertainties  Incertidumbre de cada punto objetivo.
 * @param x2             Abscisas de la referencia, estrictamente crecientes.
 * @param y2             Valores de la referencia.
 * @param clipReference  Valores cuyo rango acota la curva evaluada durante el ajuste (opcional).
 */
public record ShiftFitProblem(double[] x1, double[] y1, double[] uncertainties,
                              double[] x2, double[] y2, double[] clipReference) {

    public ShiftFitProblem {
        Objects.requireNonNull(x1, "x1 no puede ser nulo");
        Objects.requireNonNull(y1, "y1 no puede ser nulo");
        Objects.requireNonNull(uncertainties, "Las incertidumbres no pueden ser nulas");
        Objects.requireNonNull(x2, "x2 no puede ser nulo");
        Objects.requireNonNull(y2, "y2 no puede ser nulo");
        if (x1.length == 0) {
            throw new IllegalArgumentException("El ajuste necesita al menos un punto objetivo.");
        }
        if (y1.length != x1.length || uncertainties.length != x1.length) {
            throw new IllegalArgumentException(String.format(
                    "Longitudes incoherentes: x1=%d, y1=%d, err=%d", x1.length, y1.length, uncertainties.length));
        }
        if (x2.length < 2 || y2.length != x2.length) {
            throw new IllegalArgumentException(String.format(
                    "La referencia necesita al menos 2 puntos alineados: x2=%d, y2=%d", x2.length, y2.length));
        }
        for (double sigma : uncertainties) {
            if (!(sigma > 0)) {
                throw new IllegalArgumentException("Las incertidumbres deben ser positivas: " + sigma);
            }
        }
        x1 = x1.clone();
        y1 = y1.clone();
        uncertainties = uncertainties.clone();
        x2 = x2.clone();
        y2 = y2.clone();
        clipReference = clipReference == null ? null : clipReference.clone();
    }

    /**
     * Misma incertidumbre para todos los puntos objetivo.
     */
    public static ShiftFitProblem withUniformUncertainty(double[] x1, double[] y1, double uncertainty,
                                                         double[] x2, double[] y2, double[] clipReference) {
        double[] sigma = new double[x1.length];
        Arrays.fill(sigma, uncertainty);
        return new ShiftFitProblem(x1, y1, sigma, x2, y2, clipReference);
    }

    public int size() {
        return x1.length;
    }

    @Override
    public String toString() {
        return String.format("ShiftFitProblem[n=%d, ref=%d, clip=%s]", x1.length, x2.length, clipReference != null);
    }
}
