package atmogrid.domain.atmosphere;

import atmogrid.domain.exception.AtmosphereSchemaException;
import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Coordenadas de profundidad admitidas por los perfiles de atmósfera.
 */
public enum DepthVariable {

    /**
     * Densidad de columna de masa (g/cm²).
     */
    RHOX,

    /**
     * Profundidad óptica de referencia (a 5000 Å).
     */
    TAU;

    /**
     * La otra coordenada de profundidad.
     */
    public DepthVariable other() {
        return this == RHOX ? TAU : RHOX;
    }

    /**
     * Interpreta el nombre sin distinguir mayúsculas. Solo hay dos valores legales.
     *
     * @throws AtmosphereSchemaException si el nombre no es RHOX ni TAU.
     */
    @JsonCreator
    public static DepthVariable parse(String name) {
        if (name == null || name.isBlank()) {
            throw new AtmosphereSchemaException("La variable de profundidad no puede estar vacía.");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (DepthVariable variable : values()) {
            if (variable.name().equals(normalized)) {
                return variable;
            }
        }
        throw new AtmosphereSchemaException(
                String.format("La variable de profundidad debe ser 'TAU' o 'RHOX', no '%s'.", name));
    }
}
