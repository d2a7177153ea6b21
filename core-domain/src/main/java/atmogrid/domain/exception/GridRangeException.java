package atmogrid.domain.exception;

/**
 * El parámetro objetivo cae fuera de la rejilla en un eje donde no se permite extrapolar
 * (por debajo del mínimo de [M/H] o log g, por encima del máximo de Teff).
 */
public class GridRangeException extends AtmosphereInterpolationException {

    public GridRangeException(String message) {
        super(message);
    }
}
