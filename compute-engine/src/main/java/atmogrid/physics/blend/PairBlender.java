package atmogrid.physics.blend;

import atmogrid.config.InterpolationConfig;
import atmogrid.domain.atmosphere.AtmosphereProfile;
import atmogrid.domain.atmosphere.AtmosphereQuantity;
import atmogrid.domain.atmosphere.DepthVariable;
import atmogrid.domain.exception.AtmosphereSchemaException;
import atmogrid.domain.exception.FitDivergenceException;
import atmogrid.physics.solver.FitConfiguration;
import atmogrid.physics.solver.ShiftFitProblem;
import atmogrid.physics.solver.ShiftFitResult;
import atmogrid.physics.solver.ShiftFitter;
import atmogrid.physics.solver.ShiftParameters;
import atmogrid.physics.solver.ShiftedInterpolator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Mezcla dos perfiles de atmósfera corrigiendo la diferencia de muestreo de sus escalas de profundidad.
 * <p>
 * Algoritmo:
 * <ol>
 *   <li>Elige la variable de interpolación (la pedida; si no, TAU si ambos la tienen; si no, RHOX).</li>
 *   <li>Descarta en cada perfil las capas superiores cuyo paso fraccional no supera el mínimo.</li>
 *   <li>Ajusta, magnitud a magnitud y en logaritmo, el perfil 2 sobre el perfil 1. TEMP va primero,
 *       con semilla que alinea los puntos medios; su desplazamiento horizontal restringe los puntos
 *       válidos y sirve de semilla para las demás.</li>
 *   <li>Construye la rejilla de salida a partir del desplazamiento horizontal medio.</li>
 *   <li>Remuestrea cada perfil desplazado por su fracción y mezcla {@code (1-frac)*v1 + frac*v2}.</li>
 * </ol>
 * Stateless: cada llamada construye un perfil nuevo.
 */
@Slf4j
public class PairBlender {

    private final ShiftFitter fitter;
    private final InterpolationConfig config;
    private final DeepEndpointCorrection endpointCorrection;

    public PairBlender(ShiftFitter fitter, InterpolationConfig config) {
        this.fitter = Objects.requireNonNull(fitter, "El ajustador no puede ser nulo");
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula");
        this.endpointCorrection = new DeepEndpointCorrection(config);
    }

    /**
     * Versión "Convenience": variable de interpolación automática y sin recorte superior.
     */
    public AtmosphereProfile blend(AtmosphereProfile p1, AtmosphereProfile p2, double frac) {
        return blend(p1, p2, frac, null, 0);
    }

    /**
     * @param p1             Primer perfil (frac = 0).
     * @param p2             Segundo perfil (frac = 1).
     * @param frac           Fracción de mezcla. Fuera de [0, 1] extrapola.
     * @param interpVariable (Opcional) Variable de interpolación. Si es nula se elige automáticamente.
     * @param topTrim        Capas superiores descartadas antes del recorte por paso mínimo.
     * @return Nuevo perfil mezclado.
     * @throws AtmosphereSchemaException si falta la variable de interpolación en alguno de los perfiles.
     * @throws FitDivergenceException    si quedan menos de 2 capas útiles o algún ajuste diverge.
     */
    public AtmosphereProfile blend(AtmosphereProfile p1, AtmosphereProfile p2, double frac,
                                   DepthVariable interpVariable, int topTrim) {
        Objects.requireNonNull(p1, "El perfil 1 no puede ser nulo");
        Objects.requireNonNull(p2, "El perfil 2 no puede ser nulo");
        if (!Double.isFinite(frac)) {
            throw new IllegalArgumentException("La fracción de mezcla debe ser finita: " + frac);
        }
        if (topTrim < 0) {
            throw new IllegalArgumentException("El recorte superior no puede ser negativo: " + topTrim);
        }

        // --- 1. Variable de interpolación ---
        final DepthVariable interp = selectInterpolationVariable(p1, p2, interpVariable);
        final double minStep = config.minStepFor(interp);

        // --- 2. Escalas de profundidad recortadas (log10) ---
        final int itop1 = TopLayerTrim.firstStableLayer(p1.getDepth(interp), topTrim, minStep, "1");
        final int itop2 = TopLayerTrim.firstStableLayer(p2.getDepth(interp), topTrim, minStep, "2");
        final double[] depth1 = log10Tail(p1.getDepth(interp), itop1);
        final double[] depth2 = log10Tail(p2.getDepth(interp), itop2);
        final int ndep1 = depth1.length;
        final int ndep2 = depth2.length;

        // --- 3. Magnitudes a procesar (TEMP siempre la primera) ---
        final List<AtmosphereQuantity> quantities = new ArrayList<>(List.of(
                AtmosphereQuantity.TEMP, AtmosphereQuantity.XNE, AtmosphereQuantity.XNA,
                AtmosphereQuantity.RHO, AtmosphereQuantity.of(interp)));
        if (p1.has(interp.other()) && p2.has(interp.other())) {
            quantities.add(AtmosphereQuantity.of(interp.other()));
        }

        final Map<AtmosphereQuantity, double[]> logs1 = new EnumMap<>(AtmosphereQuantity.class);
        final Map<AtmosphereQuantity, double[]> logs2 = new EnumMap<>(AtmosphereQuantity.class);
        for (AtmosphereQuantity q : quantities) {
            logs1.put(q, log10Tail(q.extractFrom(p1), itop1));
            logs2.put(q, log10Tail(q.extractFrom(p2), itop2));
        }

        // --- 4. Ajustes por magnitud ---
        final Map<AtmosphereQuantity, ShiftParameters> shifts = fitShifts(quantities, depth1, depth2, logs1, logs2);

        // --- 5. Rejilla de salida ---
        double meanShift = 0.0;
        for (ShiftParameters p : shifts.values()) {
            meanShift += p.horizontal();
        }
        meanShift /= shifts.size();
        final double[] depth = outputDepthGrid(depth1, depth2, meanShift, frac);
        final int ndep = depth.length;

        // --- 6. Remuestreo y mezcla ---
        final Map<AtmosphereQuantity, double[]> blended = new EnumMap<>(AtmosphereQuantity.class);
        for (AtmosphereQuantity q : quantities) {
            final ShiftParameters par = shifts.get(q);
            final double[] vect1 = logs1.get(q);
            final double[] vect2 = logs2.get(q);

            double[] v1f = ShiftedInterpolator.evaluate(depth, par.scaled(-frac), depth1, vect1);
            double[] v2f = ShiftedInterpolator.evaluate(depth, par.scaled(1.0 - frac), depth2, vect2);
            double[] vect = new double[ndep];
            for (int i = 0; i < ndep; i++) {
                vect[i] = (1.0 - frac) * v1f[i] + frac * v2f[i];
            }

            vect = endpointCorrection.apply(depth, vect, v1f, v2f,
                    depth1[ndep1 - 1] - par.horizontal() * frac,
                    depth2[ndep2 - 1] + par.horizontal() * (1.0 - frac),
                    vect1[ndep1 - 1], vect2[ndep2 - 1],
                    frac, ndep1 == ndep2);

            blended.put(q, pow10(vect));
        }

        // --- 7. Perfil de salida ---
        AtmosphereProfile.AtmosphereProfileBuilder builder = p1.toBuilder()
                .teff(lerp(p1.getTeff(), p2.getTeff(), frac))
                .logg(lerp(p1.getLogg(), p2.getLogg(), frac))
                .monh(lerp(p1.getMonh(), p2.getMonh(), frac))
                .vturb(lerp(p1.getVturb(), p2.getVturb(), frac))
                .lonh(lerp(p1.getLonh(), p2.getLonh(), frac))
                .temperature(blended.get(AtmosphereQuantity.TEMP))
                .electronDensity(blended.get(AtmosphereQuantity.XNE))
                .atomicDensity(blended.get(AtmosphereQuantity.XNA))
                .massDensity(blended.get(AtmosphereQuantity.RHO))
                .rhox(blended.get(AtmosphereQuantity.RHOX))
                .tau(blended.get(AtmosphereQuantity.TAU))
                .height(p1.hasHeight() ? Arrays.copyOfRange(p1.getHeight(), itop1, itop1 + ndep) : null);

        if (p1.hasAbundances() && p2.hasAbundances()) {
            double[] a1 = p1.getAbundances();
            double[] a2 = p2.getAbundances();
            if (a1.length == a2.length) {
                double[] abund = new double[a1.length];
                for (int i = 0; i < a1.length; i++) {
                    abund[i] = lerp(a1[i], a2[i], frac);
                }
                builder.abundances(abund);
            } else {
                log.warn("Abundancias de longitud distinta ({} vs {}); se conservan las del perfil 1.", a1.length, a2.length);
            }
        }

        AtmosphereProfile result = builder.build();
        log.debug("Mezcla {} + {} (frac={}, {}) -> ndep={} (capas {}/{}, desplazamiento medio {})",
                p1, p2, frac, interp, ndep, ndep1, ndep2, meanShift);
        return result;
    }

    // --- ETAPAS ---

    private DepthVariable selectInterpolationVariable(AtmosphereProfile p1, AtmosphereProfile p2, DepthVariable requested) {
        final boolean okTau = p1.hasTau() && p2.hasTau();
        final boolean okRhox = p1.hasRhox() && p2.hasRhox();
        if (!okTau && !okRhox) {
            throw new AtmosphereSchemaException("Ambos perfiles deben contener RHOX o TAU.");
        }
        DepthVariable interp = requested != null ? requested : (okTau ? DepthVariable.TAU : DepthVariable.RHOX);
        if (!p1.has(interp)) {
            throw new AtmosphereSchemaException("El perfil 1 no contiene " + interp);
        }
        if (!p2.has(interp)) {
            throw new AtmosphereSchemaException("El perfil 2 no contiene " + interp);
        }
        return interp;
    }

    private Map<AtmosphereQuantity, ShiftParameters> fitShifts(List<AtmosphereQuantity> quantities,
                                                              double[] depth1, double[] depth2,
                                                              Map<AtmosphereQuantity, double[]> logs1,
                                                              Map<AtmosphereQuantity, double[]> logs2) {
        final Map<AtmosphereQuantity, ShiftParameters> shifts = new EnumMap<>(AtmosphereQuantity.class);
        final double sigma = config.fitUncertainty();
        final double penalty = config.horizontalShiftUncertainty();

        // Primera pasada (TEMP): todos los puntos, semilla por alineación de puntos medios
        final double[] temp1 = logs1.get(AtmosphereQuantity.TEMP);
        final double[] temp2 = logs2.get(AtmosphereQuantity.TEMP);
        final int mid1 = midpointIndex(temp1);
        final int mid2 = midpointIndex(temp2);
        final ShiftParameters tempGuess = new ShiftParameters(
                depth1[mid1] - depth2[mid2], temp1[mid1] - temp2[mid2], 0.0, 0.0);

        ShiftFitResult tempFit = fitter.fit(
                ShiftFitProblem.withUniformUncertainty(depth1, temp1, sigma, depth2, temp2, temp1),
                tempGuess,
                FitConfiguration.horizontallyConstrained(tempGuess.horizontal(), penalty));
        final double h = tempFit.parameters().horizontal();
        shifts.put(AtmosphereQuantity.TEMP, tempFit.parameters());
        log.debug("TEMP: semilla {} -> {} (rms={})", tempGuess, tempFit.parameters(), tempFit.rms());

        // Puntos de la escala 1 cubiertos por la escala 2 desplazada
        final int[] valid = overlap(depth1, depth2[0] + h, depth2[depth2.length - 1] + h);
        if (valid.length < 2) {
            throw new FitDivergenceException(String.format(
                    "Desplazamiento inestable en temperatura (dx=%.4f): sólo %d puntos en el solape.", h, valid.length));
        }
        final double[] x1 = select(depth1, valid);

        // Resto de magnitudes: semilla (h, 0, 0, 0)
        final ShiftParameters guess = new ShiftParameters(h, 0.0, 0.0, 0.0);
        final FitConfiguration constrained = FitConfiguration.horizontallyConstrained(h, penalty);
        for (AtmosphereQuantity q : quantities) {
            if (q == AtmosphereQuantity.TEMP) continue;
            final double[] vect1 = logs1.get(q);
            ShiftFitResult fit = fitter.fit(
                    ShiftFitProblem.withUniformUncertainty(x1, select(vect1, valid), sigma, depth2, logs2.get(q), vect1),
                    guess,
                    constrained);
            shifts.put(q, fit.parameters());
            log.debug("{}: {} (rms={})", q, fit.parameters(), fit.rms());
        }
        return shifts;
    }

    /**
     * Escala del perfil con menos capas (nunca se sobremuestrea); si tienen las mismas, combinación por {@code frac}.
     */
    private static double[] outputDepthGrid(double[] depth1, double[] depth2, double meanShift, double frac) {
        final int ndep1 = depth1.length;
        final int ndep2 = depth2.length;
        if (ndep1 > ndep2) {
            double[] depth = new double[ndep2];
            for (int i = 0; i < ndep2; i++) depth[i] = depth2[i] + meanShift * (1.0 - frac);
            return depth;
        }
        if (ndep1 < ndep2) {
            double[] depth = new double[ndep1];
            for (int i = 0; i < ndep1; i++) depth[i] = depth1[i] - meanShift * frac;
            return depth;
        }
        double[] depth = new double[ndep1];
        for (int i = 0; i < ndep1; i++) {
            depth[i] = (depth1[i] - meanShift * frac) * (1.0 - frac) + (depth2[i] + meanShift * (1.0 - frac)) * frac;
        }
        return depth;
    }

    // --- UTILIDADES ---

    static int midpointIndex(double[] values) {
        final int n = values.length;
        final double target = 0.5 * (values[1] + values[n - 2]);
        int best = 0;
        for (int i = 1; i < n; i++) {
            if (Math.abs(values[i] - target) < Math.abs(values[best] - target)) {
                best = i;
            }
        }
        return best;
    }

    private static int[] overlap(double[] x, double lo, double hi) {
        return IntStream.range(0, x.length)
                .filter(i -> x[i] >= lo && x[i] <= hi)
                .toArray();
    }

    private static double[] select(double[] values, int[] indices) {
        double[] out = new double[indices.length];
        for (int i = 0; i < indices.length; i++) {
            out[i] = values[indices[i]];
        }
        return out;
    }

    private static double[] log10Tail(double[] values, int from) {
        double[] out = new double[values.length - from];
        for (int i = from; i < values.length; i++) {
            out[i - from] = Math.log10(values[i]);
        }
        return out;
    }

    private static double[] pow10(double[] logs) {
        double[] out = new double[logs.length];
        for (int i = 0; i < logs.length; i++) {
            out[i] = Math.pow(10.0, logs[i]);
        }
        return out;
    }

    private static double lerp(double a, double b, double frac) {
        return (1.0 - frac) * a + frac * b;
    }
}
