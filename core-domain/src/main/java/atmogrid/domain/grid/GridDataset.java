package atmogrid.domain.grid;

import atmogrid.domain.atmosphere.AtmosphereProfile;
import atmogrid.domain.atmosphere.DepthVariable;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Rejilla precalculada de atmósferas de referencia, irregular en (Teff, log g, [M/H]).
 * <p>
 * La clave (Teff, log g, [M/H]) de cada modelo está implícita en la secuencia ordenada.
 * Inmutable una vez cargada: la comparten en solo lectura todas las interpolaciones.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class GridDataset {

    @JsonProperty("models")
    private final List<AtmosphereProfile> models;
    @Getter
    @JsonProperty("maxdep")
    private final int maxDepth;
    @Getter
    @JsonProperty("version")
    private final String version;
    @Getter
    @JsonProperty("source")
    private final String source;
    @Getter
    @JsonProperty("depth")
    private final DepthVariable defaultDepthVariable;
    @Getter
    @JsonProperty("interp")
    private final DepthVariable defaultInterpVariable;

    /**
     * @param models                Modelos de referencia (al menos uno).
     * @param maxDepth              Máximo número de puntos de profundidad. Si es {@code <= 0} se deriva de los modelos.
     * @param version               Etiqueta de versión de la rejilla.
     * @param source                Identificador de origen (clave de la caché).
     * @param defaultDepthVariable  Variable de profundidad por defecto de la rejilla (opcional).
     * @param defaultInterpVariable Variable de interpolación por defecto de la rejilla (opcional).
     */
    @Builder
    @JsonCreator
    public GridDataset(@JsonProperty("models") List<AtmosphereProfile> models,
                       @JsonProperty("maxdep") int maxDepth,
                       @JsonProperty("version") String version,
                       @JsonProperty("source") String source,
                       @JsonProperty("depth") DepthVariable defaultDepthVariable,
                       @JsonProperty("interp") DepthVariable defaultInterpVariable) {
        Objects.requireNonNull(models, "La lista de modelos no puede ser nula.");
        if (models.isEmpty()) {
            throw new IllegalArgumentException("La rejilla debe contener al menos un modelo.");
        }
        int deepest = models.stream().mapToInt(AtmosphereProfile::getDepthPointCount).max().orElse(0);
        if (maxDepth > 0 && maxDepth < deepest) {
            throw new IllegalArgumentException(String.format(
                    "maxdep=%d es menor que el modelo más profundo de la rejilla (%d puntos).", maxDepth, deepest));
        }
        this.models = List.copyOf(models);
        this.maxDepth = maxDepth > 0 ? maxDepth : deepest;
        this.version = version;
        this.source = source;
        this.defaultDepthVariable = defaultDepthVariable;
        this.defaultInterpVariable = defaultInterpVariable;
    }

    public int size() {
        return models.size();
    }

    public AtmosphereProfile get(int index) {
        return models.get(index);
    }

    public List<AtmosphereProfile> getModels() {
        return models;
    }

    /**
     * Valores distintos de [M/H] presentes en la rejilla, en orden creciente.
     */
    public double[] distinctMetallicities() {
        return distinct(m -> true, AtmosphereProfile::getMonh);
    }

    /**
     * Valores distintos de log g entre los modelos con la metalicidad indicada.
     */
    public double[] distinctGravities(double monh) {
        return distinct(m -> m.getMonh() == monh, AtmosphereProfile::getLogg);
    }

    /**
     * Valores distintos de Teff entre los modelos con la metalicidad y gravedad indicadas.
     */
    public double[] distinctTemperatures(double monh, double logg) {
        return distinct(m -> m.getMonh() == monh && m.getLogg() == logg, AtmosphereProfile::getTeff);
    }

    /**
     * Índices de todos los modelos cuya clave coincide exactamente.
     */
    public List<Integer> findModelIndices(double teff, double logg, double monh) {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < models.size(); i++) {
            AtmosphereProfile m = models.get(i);
            if (m.getTeff() == teff && m.getLogg() == logg && m.getMonh() == monh) {
                indices.add(i);
            }
        }
        return indices;
    }

    /**
     * Una coordenada de profundidad existe en la rejilla si todos sus modelos la contienen.
     */
    public boolean hasDepthVariable(DepthVariable variable) {
        return models.stream().allMatch(m -> m.has(variable));
    }

    private double[] distinct(Predicate<AtmosphereProfile> filter, ToDoubleFunction<AtmosphereProfile> key) {
        return models.stream()
                .filter(filter)
                .mapToDouble(key)
                .distinct()
                .sorted()
                .toArray();
    }

    @Override
    public String toString() {
        return String.format("GridDataset[source=%s, version=%s, models=%d, maxdep=%d]",
                source, version, models.size(), maxDepth);
    }
}
