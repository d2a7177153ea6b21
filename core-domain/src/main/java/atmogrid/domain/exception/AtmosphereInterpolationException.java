package atmogrid.domain.exception;

/**
 * Raíz de los errores fatales de la interpolación de atmósferas.
 * <p>
 * Cualquier excepción de esta jerarquía aborta la llamada completa: nunca se
 * devuelve una atmósfera parcial.
 */
public class AtmosphereInterpolationException extends RuntimeException {

    public AtmosphereInterpolationException(String message) {
        super(message);
    }

    public AtmosphereInterpolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
