package atmogrid.physics.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuración explícita de un ajuste de desplazamientos: qué componentes son libres
 * (el resto queda fijo en su valor inicial) y qué penalizaciones se aplican sobre ellos.
 */
public final class FitConfiguration {

    private final Set<ShiftComponent> freeComponents;
    private final Map<ShiftComponent, PenaltyTerm> penalties;

    public FitConfiguration(Set<ShiftComponent> freeComponents, Map<ShiftComponent, PenaltyTerm> penalties) {
        Objects.requireNonNull(freeComponents, "El conjunto de componentes libres no puede ser nulo.");
        Objects.requireNonNull(penalties, "El mapa de penalizaciones no puede ser nulo.");
        if (freeComponents.isEmpty()) {
            throw new IllegalArgumentException("Al menos un componente debe ser libre.");
        }
        for (ShiftComponent penalised : penalties.keySet()) {
            if (!freeComponents.contains(penalised)) {
                throw new IllegalArgumentException("No se puede penalizar el componente fijo " + penalised);
            }
        }
        this.freeComponents = Collections.unmodifiableSet(EnumSet.copyOf(freeComponents));
        this.penalties = penalties.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(penalties));
    }

    /**
     * Configuración de producción: desplazamientos horizontal y vertical libres, escala y hueco
     * reservado fijos, y el horizontal penalizado hacia {@code horizontalTarget}.
     */
    public static FitConfiguration horizontallyConstrained(double horizontalTarget, double uncertainty) {
        return new FitConfiguration(
                EnumSet.of(ShiftComponent.HORIZONTAL, ShiftComponent.VERTICAL),
                Map.of(ShiftComponent.HORIZONTAL, new PenaltyTerm(horizontalTarget, uncertainty)));
    }

    /**
     * Sin penalizaciones; sólo quedan libres los componentes indicados.
     */
    public static FitConfiguration unconstrained(ShiftComponent first, ShiftComponent... rest) {
        return new FitConfiguration(EnumSet.of(first, rest), Map.of());
    }

    public Set<ShiftComponent> getFreeComponents() {
        return freeComponents;
    }

    public Map<ShiftComponent, PenaltyTerm> getPenalties() {
        return penalties;
    }

    public boolean isFree(ShiftComponent component) {
        return freeComponents.contains(component);
    }

    /**
     * Componentes libres en orden de índice. Define el orden del vector que ve el optimizador.
     */
    public List<ShiftComponent> freeComponentsInOrder() {
        return new ArrayList<>(freeComponents);
    }

    @Override
    public String toString() {
        return "FitConfiguration[free=" + freeComponents + ", penalties=" + penalties + "]";
    }
}
