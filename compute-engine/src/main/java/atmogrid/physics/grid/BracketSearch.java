package atmogrid.physics.grid;

import atmogrid.domain.exception.GridRangeException;

import java.util.Arrays;

/**
 * Búsqueda de los dos nodos de la rejilla que acotan un valor objetivo en un eje.
 * <p>
 * Los ejes no son simétricos: en [M/H] y log g se extrapola por encima del máximo y se
 * rechaza por debajo del mínimo; en Teff ocurre lo contrario.
 */
public final class BracketSearch {

    /**
     * Dirección en la que se permite extrapolar.
     */
    public enum Policy {
        /** Extrapola por encima del máximo; por debajo del mínimo es un error. */
        EXTRAPOLATE_ABOVE,
        /** Extrapola por debajo del mínimo; por encima del máximo es un error. */
        EXTRAPOLATE_BELOW
    }

    /**
     * @param lower        Nodo inferior.
     * @param upper        Nodo superior.
     * @param extrapolated Si el objetivo queda fuera de [min, max] de la rejilla.
     */
    public record Bracket(double lower, double upper, boolean extrapolated) {

        /** Intervalo de longitud cero: el objetivo coincide con un nodo. */
        public boolean isDegenerate() {
            return lower == upper;
        }
    }

    private BracketSearch() {}

    /**
     * @param nodes  Valores distintos del eje en orden creciente (no vacío).
     * @param target Valor objetivo.
     * @param policy Dirección de extrapolación permitida.
     * @param axis   Nombre del eje para los mensajes.
     * @throws GridRangeException si el objetivo está fuera del rango en la dirección prohibida,
     *                            o si no hay un segundo nodo con el que extrapolar.
     */
    public static Bracket find(double[] nodes, double target, Policy policy, String axis) {
        if (nodes == null || nodes.length == 0) {
            throw new GridRangeException("La rejilla no tiene valores de " + axis);
        }
        if (!Double.isFinite(target)) {
            throw new IllegalArgumentException("Objetivo no finito para " + axis + ": " + target);
        }
        final double min = nodes[0];
        final double max = nodes[nodes.length - 1];

        if (policy == Policy.EXTRAPOLATE_ABOVE) {
            if (target < min) {
                throw new GridRangeException(String.format(
                        "%s solicitado (%.3f) menor que el mínimo de la rejilla (%.3f).", axis, target, min));
            }
            if (target <= max) {
                return new Bracket(largestAtMost(nodes, target), smallestAtLeast(nodes, target), false);
            }
            if (nodes.length < 2) {
                throw new GridRangeException(String.format(
                        "%s solicitado (%.3f) mayor que el único nodo (%.3f): no se puede extrapolar.", axis, target, max));
            }
            return new Bracket(nodes[nodes.length - 2], max, true);
        }

        if (target > max) {
            throw new GridRangeException(String.format(
                    "%s solicitado (%.3f) mayor que el máximo de la rejilla (%.3f).", axis, target, max));
        }
        if (target > min) {
            return new Bracket(largestAtMost(nodes, target), smallestAtLeast(nodes, target), false);
        }
        if (nodes.length < 2) {
            if (target == min) {
                return new Bracket(min, min, false);
            }
            throw new GridRangeException(String.format(
                    "%s solicitado (%.3f) menor que el único nodo (%.3f): no se puede extrapolar.", axis, target, min));
        }
        return new Bracket(min, nodes[1], target < min);
    }

    private static double largestAtMost(double[] sorted, double target) {
        int i = Arrays.binarySearch(sorted, target);
        return i >= 0 ? sorted[i] : sorted[-i - 2];
    }

    private static double smallestAtLeast(double[] sorted, double target) {
        int i = Arrays.binarySearch(sorted, target);
        return i >= 0 ? sorted[i] : sorted[-i - 1];
    }
}
