package atmogrid.domain.atmosphere;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Locale;

/**
 * Geometría del modelo de atmósfera.
 */
@Getter
public enum AtmosphereGeometry {

    PLANE_PARALLEL("PP"),
    SPHERICAL("SPH");

    @JsonValue
    private final String code;

    AtmosphereGeometry(String code) {
        this.code = code;
    }

    /**
     * Acepta tanto el código corto ("PP", "SPH") como el nombre del enum.
     */
    @JsonCreator
    public static AtmosphereGeometry fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("La geometría no puede ser nula.");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (AtmosphereGeometry geometry : values()) {
            if (geometry.code.equals(normalized) || geometry.name().equals(normalized)) {
                return geometry;
            }
        }
        throw new IllegalArgumentException("Geometría desconocida: " + value);
    }
}
