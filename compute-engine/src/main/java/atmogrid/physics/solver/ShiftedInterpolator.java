package atmogrid.physics.solver;

import java.util.Objects;

/**
 * Biblioteca estática para remuestrear una curva de referencia desplazada.
 * <p>
 * Dados {@code x1}, los parámetros {@code (dx, dy, dscale)} y la curva {@code (x2, y2)}:
 * <ol>
 *   <li>desplaza {@code x2 -> x2 + dx} e {@code y2 -> y2 + dy},</li>
 *   <li>interpola linealmente en {@code x1}, extrapolando con el segmento extremo,</li>
 *   <li>reescala el resultado respecto a su centro: {@code y_c + (1 + dscale) * (y - y_c)}.</li>
 * </ol>
 * Opcionalmente acota la salida al rango de un conjunto de referencia. Sólo se usa durante
 * el ajuste; la curva de producción nunca se acota porque el recorte introduce discontinuidades.
 * <p>
 * Stateless y Thread-Safe.
 */
public final class ShiftedInterpolator {

    private ShiftedInterpolator() {}

    /**
     * Versión de producción, sin acotar.
     */
    public static double[] evaluate(double[] x1, ShiftParameters shift, double[] x2, double[] y2) {
        return evaluate(x1, shift, x2, y2, null);
    }

    /**
     * @param x1            Abscisas de salida.
     * @param shift         Parámetros de desplazamiento. El componente reservado se ignora.
     * @param x2            Abscisas de la referencia, estrictamente crecientes.
     * @param y2            Valores de la referencia.
     * @param clipReference (Opcional) Si no es nulo, la salida se acota a [min, max] de este vector.
     * @return Nuevo array con la curva evaluada en {@code x1}.
     */
    public static double[] evaluate(double[] x1, ShiftParameters shift, double[] x2, double[] y2, double[] clipReference) {
        Objects.requireNonNull(x1, "x1 no puede ser nulo");
        Objects.requireNonNull(shift, "Los parámetros no pueden ser nulos");
        if (x2.length < 2 || x2.length != y2.length) {
            throw new IllegalArgumentException(String.format(
                    "La referencia necesita al menos 2 puntos alineados: x2=%d, y2=%d", x2.length, y2.length));
        }

        final double dx = shift.horizontal();
        final double dy = shift.vertical();
        final double[] y = new double[x1.length];

        // 1. Interpolación lineal sobre la referencia desplazada
        for (int i = 0; i < x1.length; i++) {
            y[i] = interpolate(x1[i] - dx, x2, y2) + dy;
        }

        // 2. Reescalado respecto al centro de la propia curva de salida
        if (shift.scale() != 0.0 && y.length > 0) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : y) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            final double center = 0.5 * (min + max);
            final double factor = 1.0 + shift.scale();
            for (int i = 0; i < y.length; i++) {
                y[i] = center + factor * (y[i] - center);
            }
        }

        // 3. Acotado (sólo en ajustes)
        if (clipReference != null && clipReference.length > 0) {
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            for (double v : clipReference) {
                lo = Math.min(lo, v);
                hi = Math.max(hi, v);
            }
            for (int i = 0; i < y.length; i++) {
                y[i] = Math.max(lo, Math.min(hi, y[i]));
            }
        }
        return y;
    }

    /**
     * Interpolación lineal con extrapolación por el segmento extremo.
     * Evaluar {@code y2(x - dx)} equivale a evaluar en {@code x} la curva con abscisas {@code x2 + dx}.
     */
    static double interpolate(double x, double[] xs, double[] ys) {
        final int last = xs.length - 1;
        int j;
        if (x <= xs[0]) {
            j = 0;
        } else if (x >= xs[last]) {
            j = last - 1;
        } else {
            // Búsqueda binaria del segmento [xs[j], xs[j+1]) que contiene x
            int lo = 0;
            int hi = last;
            while (hi - lo > 1) {
                int mid = (lo + hi) >>> 1;
                if (xs[mid] <= x) {
                    lo = mid;
                } else {
                    hi = mid;
                }
            }
            j = lo;
        }
        final double x0 = xs[j];
        final double slope = (ys[j + 1] - ys[j]) / (xs[j + 1] - x0);
        return ys[j] + slope * (x - x0);
    }
}
