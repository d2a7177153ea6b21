package atmogrid.physics.grid;

import atmogrid.domain.atmosphere.AtmosphereGeometry;
import atmogrid.domain.atmosphere.DepthVariable;
import lombok.Builder;

/**
 * Petición de interpolación: parámetros estelares objetivo y preferencias opcionales del llamador.
 *
 * @param teff           Temperatura efectiva objetivo (K).
 * @param logg           log g objetivo (cgs).
 * @param monh           Metalicidad objetivo.
 * @param depthVariable  (Opcional) Variable de profundidad para el transporte radiativo.
 * @param interpVariable (Opcional) Variable de interpolación.
 * @param geometry       (Opcional) Geometría declarada por el llamador.
 */
@Builder
public record AtmosphereRequest(double teff,
                                double logg,
                                double monh,
                                DepthVariable depthVariable,
                                DepthVariable interpVariable,
                                AtmosphereGeometry geometry) {

    public static AtmosphereRequest of(double teff, double logg, double monh) {
        return new AtmosphereRequest(teff, logg, monh, null, null, null);
    }
}
