package atmogrid.physics.grid;

/**
 * Diagnóstico no bloqueante de una interpolación.
 */
public record InterpolationWarning(Type type, String message) {

    public enum Type {
        /** Objetivo fuera de la rejilla en un eje que admite extrapolación. */
        EXTRAPOLATION,
        /** Cero o varias entradas de la rejilla para la clave de una esquina. */
        AMBIGUOUS_CORNER,
        /** Intervalo de longitud cero en un eje. */
        DEGENERATE_BRACKET,
        /** La geometría declarada por el llamador sustituye a la calculada. */
        GEOMETRY_OVERRIDE
    }
}
