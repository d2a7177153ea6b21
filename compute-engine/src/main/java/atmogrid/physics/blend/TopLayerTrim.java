package atmogrid.physics.blend;

import atmogrid.domain.atmosphere.AtmosphereProfile;
import atmogrid.domain.atmosphere.DepthVariable;
import atmogrid.domain.exception.FitDivergenceException;

import java.util.Arrays;

/**
 * Recorte de las capas superiores de un perfil.
 * <p>
 * Se descartan {@code topTrim} capas fijas y, a continuación, las capas cuyo paso fraccional
 * respecto a la siguiente no supera el mínimo. Stateless y Thread-Safe.
 */
public final class TopLayerTrim {

    private TopLayerTrim() {
    }

    /**
     * Primer índice a partir del cual el paso fraccional entre capas consecutivas supera {@code minStep}.
     *
     * @throws FitDivergenceException si quedan menos de 2 capas.
     */
    public static int firstStableLayer(double[] scale, int topTrim, double minStep, String label) {
        final int n = scale.length;
        int itop = topTrim;
        while (itop + 1 < n && scale[itop + 1] / scale[itop] - 1.0 <= minStep) {
            itop++;
        }
        if (n - itop < 2) {
            throw new FitDivergenceException(String.format(
                    "Perfil %s: menos de 2 capas utilizables tras el recorte superior (itop=%d, ndep=%d).", label, itop, n));
        }
        return itop;
    }

    /**
     * Copia del perfil sin las capas superiores inestables de la escala {@code interp}.
     * Si no hay nada que recortar devuelve el mismo perfil.
     */
    public static AtmosphereProfile trim(AtmosphereProfile profile, DepthVariable interp, int topTrim, double minStep) {
        final int itop = firstStableLayer(profile.getDepth(interp), topTrim, minStep, profile.toString());
        if (itop == 0) {
            return profile;
        }
        return profile.toBuilder()
                .rhox(tail(profile.getRhox(), itop))
                .tau(tail(profile.getTau(), itop))
                .temperature(tail(profile.getTemperature(), itop))
                .electronDensity(tail(profile.getElectronDensity(), itop))
                .atomicDensity(tail(profile.getAtomicDensity(), itop))
                .massDensity(tail(profile.getMassDensity(), itop))
                .height(tail(profile.getHeight(), itop))
                .build();
    }

    private static double[] tail(double[] values, int from) {
        return values == null ? null : Arrays.copyOfRange(values, from, values.length);
    }
}
