package atmogrid.domain.exception;

/**
 * Falta una variable de profundidad o una magnitud obligatoria en alguno de los perfiles.
 * Se lanza antes de cualquier cálculo numérico.
 */
public class AtmosphereSchemaException extends AtmosphereInterpolationException {

    public AtmosphereSchemaException(String message) {
        super(message);
    }
}
