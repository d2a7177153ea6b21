package atmogrid.physics.blend;

import atmogrid.config.InterpolationConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Corrección del extremo profundo de una magnitud mezclada.
 * <p>
 * Condición de disparo (todas a la vez):
 * <ul>
 *   <li>hay puntos de salida más profundos que el extremo de alguno de los dos perfiles desplazados,</li>
 *   <li>{@code |frac - 0.5| <= 0.5} y ambos perfiles tienen el mismo número de capas,</li>
 *   <li>la mediana de (extremo 1, extremo mezclado, extremo 2) no es el extremo mezclado,</li>
 *   <li>el extremo logarítmico de alguno de los perfiles está a menos de la tolerancia del valor del artefacto.</li>
 * </ul>
 * Si se dispara, los puntos profundos se toman de la curva desplazada del perfil que llega más hondo.
 * <p>
 * Parche para un artefacto conocido de una rejilla concreta (log ≈ 4.2).
 */
@Slf4j
public class DeepEndpointCorrection {

    private final double artifactLogValue;
    private final double tolerance;

    public DeepEndpointCorrection(InterpolationConfig config) {
        this.artifactLogValue = config.endpointArtifactLogValue();
        this.tolerance = config.endpointArtifactTolerance();
    }

    /**
     * @param depth        Rejilla de salida (log).
     * @param blended      Magnitud mezclada en la rejilla de salida (log).
     * @param shifted1     Curva del perfil 1 desplazada y remuestreada en la rejilla de salida.
     * @param shifted2     Curva del perfil 2 desplazada y remuestreada en la rejilla de salida.
     * @param deepest1     Profundidad máxima del perfil 1 tras su desplazamiento.
     * @param deepest2     Profundidad máxima del perfil 2 tras su desplazamiento.
     * @param end1         Último valor (log) del perfil 1 sin desplazar.
     * @param end2         Último valor (log) del perfil 2 sin desplazar.
     * @param frac         Fracción de mezcla.
     * @param equalCounts  Si ambos perfiles tienen el mismo número de capas tras el recorte.
     * @return El mismo array si no hay corrección; una copia corregida en caso contrario.
     */
    public double[] apply(double[] depth, double[] blended,
                          double[] shifted1, double[] shifted2,
                          double deepest1, double deepest2,
                          double end1, double end2,
                          double frac, boolean equalCounts) {

        if (!equalCounts || Math.abs(frac - 0.5) > 0.5) {
            return blended;
        }

        int nup = 0;
        for (double x : depth) {
            if (x > deepest1 || x > deepest2) nup++;
        }
        if (nup == 0) {
            return blended;
        }

        final double blendedEnd = blended[blended.length - 1];
        if (median(end1, blendedEnd, end2) == blendedEnd) {
            return blended;
        }
        if (Math.abs(end1 - artifactLogValue) >= tolerance && Math.abs(end2 - artifactLogValue) >= tolerance) {
            return blended;
        }

        final double[] source = deepest1 < deepest2 ? shifted2 : shifted1;
        final double[] corrected = Arrays.copyOf(blended, blended.length);
        for (int i = 0; i < depth.length; i++) {
            if (depth[i] > deepest1 || depth[i] > deepest2) {
                corrected[i] = source[i];
            }
        }
        log.debug("Corrección del extremo profundo aplicada a {} puntos (perfil {}).", nup, deepest1 < deepest2 ? 2 : 1);
        return corrected;
    }

    static double median(double a, double b, double c) {
        return Math.max(Math.min(a, b), Math.min(Math.max(a, b), c));
    }
}
