package atmogrid.domain.exception;

/**
 * El ajuste de desplazamiento no converge, queda mal condicionado o deja
 * menos de 2 puntos utilizables.
 */
public class FitDivergenceException extends AtmosphereInterpolationException {

    public FitDivergenceException(String message) {
        super(message);
    }

    public FitDivergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
