package atmogrid.domain.exception;

/**
 * La geometría declarada por el llamador es incompatible con la calculada a partir de la rejilla.
 */
public class GeometryConflictException extends AtmosphereInterpolationException {

    public GeometryConflictException(String message) {
        super(message);
    }
}
