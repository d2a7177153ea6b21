package atmogrid.physics.grid;

import atmogrid.domain.atmosphere.AtmosphereProfile;

import java.util.List;

/**
 * Atmósfera interpolada junto con los índices de las 8 esquinas usadas y los diagnósticos emitidos.
 * <p>
 * Las esquinas se ordenan como {@code iM*4 + iG*2 + iT}, con 0 el nodo inferior y 1 el superior de cada eje.
 */
public record InterpolationResult(AtmosphereProfile atmosphere, int[] cornerIndices, List<InterpolationWarning> warnings) {

    public InterpolationResult {
        cornerIndices = cornerIndices.clone();
        warnings = List.copyOf(warnings);
    }

    @Override
    public int[] cornerIndices() {
        return cornerIndices.clone();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<InterpolationWarning> warningsOfType(InterpolationWarning.Type type) {
        return warnings.stream().filter(w -> w.type() == type).toList();
    }
}
