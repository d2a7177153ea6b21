package atmogrid.physics.grid;

import atmogrid.config.InterpolationConfig;
import atmogrid.domain.atmosphere.AtmosphereGeometry;
import atmogrid.domain.atmosphere.AtmosphereProfile;
import atmogrid.domain.atmosphere.DepthVariable;
import atmogrid.domain.exception.AtmosphereSchemaException;
import atmogrid.domain.exception.GeometryConflictException;
import atmogrid.domain.exception.GridRangeException;
import atmogrid.domain.grid.GridDataset;
import atmogrid.physics.blend.PairBlender;
import atmogrid.physics.blend.TopLayerTrim;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Interpolación en la rejilla 3D (Teff, log g, [M/H]) de atmósferas de referencia.
 * <p>
 * Busca los nodos que acotan el objetivo en [M/H], después en log g dentro de cada metalicidad
 * y por último en Teff dentro de cada pareja (metalicidad, gravedad). Las 8 esquinas resultantes
 * se mezclan por parejas: 4 veces en [M/H], 2 en log g y 1 en Teff. Cada fracción se calcula con
 * los valores reales de la pareja, no con un espaciado uniforme supuesto.
 * <p>
 * Función pura del objetivo y de la rejilla: no guarda estado entre llamadas.
 */
@Slf4j
public class GridInterpolator {

    private static final String AXIS_MONH = "[M/H]";
    private static final String AXIS_LOGG = "log g";
    private static final String AXIS_TEFF = "Teff";

    private final PairBlender blender;
    private final InterpolationConfig config;

    public GridInterpolator(PairBlender blender, InterpolationConfig config) {
        this.blender = Objects.requireNonNull(blender, "El mezclador no puede ser nulo");
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula");
    }

    public AtmosphereProfile interpolate(double teff, double logg, double monh, GridDataset grid) {
        return interpolate(AtmosphereRequest.of(teff, logg, monh), grid);
    }

    public AtmosphereProfile interpolate(AtmosphereRequest request, GridDataset grid) {
        return interpolateDetailed(request, grid).atmosphere();
    }

    /**
     * @return Atmósfera interpolada, índices de las esquinas y diagnósticos no bloqueantes.
     * @throws GridRangeException         si el objetivo sale de la rejilla en una dirección sin extrapolación.
     * @throws AtmosphereSchemaException  si la variable de profundidad o de interpolación no existe en la rejilla.
     * @throws GeometryConflictException  si el llamador declara SPH y el resultado es PP.
     */
    public InterpolationResult interpolateDetailed(AtmosphereRequest request, GridDataset grid) {
        Objects.requireNonNull(request, "La petición no puede ser nula");
        Objects.requireNonNull(grid, "La rejilla no puede ser nula");
        final List<InterpolationWarning> warnings = new ArrayList<>();

        // --- Variables de profundidad e interpolación (antes de cualquier cálculo) ---
        final DepthVariable depthVar = resolveVariable(
                request.depthVariable(), grid.getDefaultDepthVariable(), DepthVariable.RHOX, grid, "profundidad");
        final DepthVariable interpVar = resolveVariable(
                request.interpVariable(), grid.getDefaultInterpVariable(), DepthVariable.TAU, grid, "interpolación");

        // --- 1. [M/H] ---
        final BracketSearch.Bracket mb = bracket(grid.distinctMetallicities(), request.monh(),
                BracketSearch.Policy.EXTRAPOLATE_ABOVE, AXIS_MONH, warnings);
        final double[] mBounds = {mb.lower(), mb.upper()};

        // --- 2. log g en cada metalicidad ---
        final double[][] gBounds = new double[2][2];
        for (int iM = 0; iM < 2; iM++) {
            BracketSearch.Bracket gb = bracket(grid.distinctGravities(mBounds[iM]), request.logg(),
                    BracketSearch.Policy.EXTRAPOLATE_ABOVE, AXIS_LOGG, warnings);
            gBounds[iM][0] = gb.lower();
            gBounds[iM][1] = gb.upper();
        }

        // --- 3. Teff en cada (metalicidad, gravedad) ---
        final double[][][] tBounds = new double[2][2][2];
        for (int iG = 0; iG < 2; iG++) {
            for (int iM = 0; iM < 2; iM++) {
                BracketSearch.Bracket tb = bracket(grid.distinctTemperatures(mBounds[iM], gBounds[iM][iG]), request.teff(),
                        BracketSearch.Policy.EXTRAPOLATE_BELOW, AXIS_TEFF, warnings);
                tBounds[iM][iG][0] = tb.lower();
                tBounds[iM][iG][1] = tb.upper();
            }
        }

        // --- 4. Esquinas ---
        final int[] corners = new int[8];
        for (int iM = 0; iM < 2; iM++) {
            for (int iG = 0; iG < 2; iG++) {
                for (int iT = 0; iT < 2; iT++) {
                    double t = tBounds[iM][iG][iT];
                    double g = gBounds[iM][iG];
                    double m = mBounds[iM];
                    List<Integer> matches = grid.findModelIndices(t, g, m);
                    if (matches.isEmpty()) {
                        throw new GridRangeException(String.format(
                                "Ningún modelo en la rejilla con [M/H]=%.3f, log g=%.3f y Teff=%.1f.", m, g, t));
                    }
                    if (matches.size() > 1) {
                        warn(warnings, InterpolationWarning.Type.AMBIGUOUS_CORNER, String.format(
                                "%d modelos en la rejilla con [M/H]=%.3f, log g=%.3f y Teff=%.1f; se usa el índice %d.",
                                matches.size(), m, g, t, matches.get(0)));
                    }
                    corners[cornerIndex(iM, iG, iT)] = matches.get(0);
                }
            }
        }

        // --- 5. Mezcla en [M/H] (4 parejas) ---
        final int trim = config.cornerTopTrim();
        final AtmosphereProfile[][] byMonh = new AtmosphereProfile[2][2];
        for (int iG = 0; iG < 2; iG++) {
            for (int iT = 0; iT < 2; iT++) {
                AtmosphereProfile c0 = grid.get(corners[cornerIndex(0, iG, iT)]);
                AtmosphereProfile c1 = grid.get(corners[cornerIndex(1, iG, iT)]);
                byMonh[iG][iT] = blendAxis(c0, c1, c0.getMonh(), c1.getMonh(), request.monh(), interpVar, trim, AXIS_MONH);
            }
        }

        // --- 6. Mezcla en log g (2 parejas) ---
        final AtmosphereProfile[] byLogg = new AtmosphereProfile[2];
        for (int iT = 0; iT < 2; iT++) {
            AtmosphereProfile a0 = byMonh[0][iT];
            AtmosphereProfile a1 = byMonh[1][iT];
            byLogg[iT] = blendAxis(a0, a1, a0.getLogg(), a1.getLogg(), request.logg(), interpVar, 0, AXIS_LOGG);
        }

        // --- 7. Mezcla en Teff ---
        AtmosphereProfile atmosphere = blendAxis(byLogg[0], byLogg[1],
                byLogg[0].getTeff(), byLogg[1].getTeff(), request.teff(), interpVar, 0, AXIS_TEFF);

        // --- 8. Geometría ---
        AtmosphereGeometry geometry = AtmosphereGeometry.PLANE_PARALLEL;
        if (allCornersSpherical(grid, corners)) {
            double radius = sphericalRadius(grid, corners, request.logg());
            atmosphere = atmosphere.withRadius(radius);
            geometry = AtmosphereGeometry.SPHERICAL;
        }
        if (request.geometry() != null && request.geometry() != geometry) {
            if (request.geometry() == AtmosphereGeometry.SPHERICAL) {
                throw new GeometryConflictException(String.format(
                        "Geometría '%s' no válida para el modelo solicitado (la rejilla produce '%s').",
                        request.geometry().getCode(), geometry.getCode()));
            }
            warn(warnings, InterpolationWarning.Type.GEOMETRY_OVERRIDE, String.format(
                    "La geometría '%s' del llamador sustituye a '%s' de la rejilla.",
                    request.geometry().getCode(), geometry.getCode()));
            geometry = request.geometry();
        }

        atmosphere = atmosphere
                .withDepthVariable(depthVar)
                .withInterpVariable(interpVar)
                .withGeometry(geometry);

        log.info("Atmósfera interpolada: Teff={}, log g={}, [M/H]={} ({} capas, {}, interp={}, {} avisos)",
                request.teff(), request.logg(), request.monh(), atmosphere.getDepthPointCount(),
                geometry.getCode(), interpVar, warnings.size());
        return new InterpolationResult(atmosphere, corners, warnings);
    }

    // --- ETAPAS ---

    /**
     * Precedencia: valor del llamador, valor por defecto de la rejilla, {@code preferred} y la otra.
     * La elegida debe existir en todos los modelos de la rejilla.
     */
    private static DepthVariable resolveVariable(DepthVariable requested, DepthVariable gridDefault,
                                                 DepthVariable preferred, GridDataset grid, String role) {
        final DepthVariable chosen;
        if (requested != null) {
            chosen = requested;
        } else if (gridDefault != null) {
            chosen = gridDefault;
        } else if (grid.hasDepthVariable(preferred)) {
            chosen = preferred;
        } else if (grid.hasDepthVariable(preferred.other())) {
            chosen = preferred.other();
        } else {
            throw new AtmosphereSchemaException("No hay valor posible para la variable de " + role + ".");
        }
        if (!grid.hasDepthVariable(chosen)) {
            throw new AtmosphereSchemaException(String.format(
                    "Variable de %s '%s' solicitada, pero la rejilla no contiene %s en todos sus modelos.", role, chosen, chosen));
        }
        return chosen;
    }

    private BracketSearch.Bracket bracket(double[] nodes, double target, BracketSearch.Policy policy,
                                          String axis, List<InterpolationWarning> warnings) {
        BracketSearch.Bracket b = BracketSearch.find(nodes, target, policy, axis);
        if (b.extrapolated()) {
            warn(warnings, InterpolationWarning.Type.EXTRAPOLATION, String.format(
                    "%s solicitado (%.3f) fuera de la rejilla [%.3f, %.3f]. Extrapolando.",
                    axis, target, nodes[0], nodes[nodes.length - 1]));
        }
        if (b.isDegenerate()) {
            warn(warnings, InterpolationWarning.Type.DEGENERATE_BRACKET, String.format(
                    "Intervalo degenerado en %s: %.3f = %.3f.", axis, b.lower(), b.upper()));
        }
        log.debug("{}: {} <= {} <= {}", axis, b.lower(), target, b.upper());
        return b;
    }

    /**
     * Una pareja con el mismo valor en el eje no se mezcla: el primer perfil pasa sin ajuste,
     * pero con el mismo recorte superior que aplicaría la mezcla.
     */
    private AtmosphereProfile blendAxis(AtmosphereProfile p0, AtmosphereProfile p1, double v0, double v1,
                                        double target, DepthVariable interpVar, int topTrim, String axis) {
        if (v0 == v1) {
            log.debug("{}: pareja con el mismo valor ({}), fracción 0 sin ajuste.", axis, v0);
            return TopLayerTrim.trim(p0, interpVar, topTrim, config.minStepFor(interpVar));
        }
        double frac = (target - v0) / (v1 - v0);
        return blender.blend(p0, p1, frac, interpVar, topTrim);
    }

    private boolean allCornersSpherical(GridDataset grid, int[] corners) {
        for (int index : corners) {
            AtmosphereProfile corner = grid.get(index);
            if (!corner.hasHeight() || !corner.hasRadius()
                    || !(corner.getRadius().getAsDouble() > config.minimumSphericalRadius())) {
                return false;
            }
        }
        return true;
    }

    /**
     * log(M/Msol) = log g - log g_sol - 2 log(R_sol/R) en cada esquina; la masa media fija el radio:
     * 2 log(R/R_sol) = log g_sol - log g + log(M/Msol).
     */
    private double sphericalRadius(GridDataset grid, int[] corners, double logg) {
        final double solR = config.solarRadiusCm();
        final double solLogg = config.solarLogg();
        double sum = 0.0;
        for (int index : corners) {
            AtmosphereProfile corner = grid.get(index);
            sum += corner.getLogg() - solLogg - 2.0 * Math.log10(solR / corner.getRadius().getAsDouble());
        }
        double mass = Math.pow(10.0, sum / corners.length);
        return solR * Math.pow(10.0, (solLogg - logg + Math.log10(mass)) * 0.5);
    }

    private static int cornerIndex(int iM, int iG, int iT) {
        return iM * 4 + iG * 2 + iT;
    }

    private static void warn(List<InterpolationWarning> warnings, InterpolationWarning.Type type, String message) {
        log.warn(message);
        warnings.add(new InterpolationWarning(type, message));
    }
}
