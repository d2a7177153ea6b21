package atmogrid.domain.atmosphere;

import atmogrid.domain.exception.AtmosphereSchemaException;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.With;

import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Representa un modelo de atmósfera estelar 1-D inmutable: magnitudes físicas en función de la profundidad.
 * <p>
 * Los perfiles de referencia se cargan una única vez desde la rejilla; los perfiles interpolados
 * se construyen de nuevo en cada llamada y pertenecen en exclusiva al llamador. Ninguno se modifica
 * tras su construcción: todos los vectores se clonan a la entrada y a la salida.
 * <p>
 * Esquema fijo: los campos opcionales (segunda coordenada de profundidad, radio, altura,
 * abundancias, longitud de onda de referencia) se modelan como {@code null} y se consultan
 * con los métodos {@code hasXxx()}.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class AtmosphereProfile {

    // --- Parámetros estelares ---
    @Getter
    @JsonProperty("teff")
    private final double teff;
    @Getter
    @JsonProperty("logg")
    private final double logg;
    @Getter
    @JsonProperty("monh")
    private final double monh;
    @Getter
    @JsonProperty("vturb")
    private final double vturb;
    @Getter
    @JsonProperty("lonh")
    private final double lonh;
    @JsonProperty("wlstd")
    private final Double wlstd;

    // --- Metadatos del modelo ---
    @Getter
    @With
    @JsonProperty("depth")
    private final DepthVariable depthVariable;
    @Getter
    @With
    @JsonProperty("interp")
    private final DepthVariable interpVariable;
    @Getter
    @With
    @JsonProperty("geom")
    private final AtmosphereGeometry geometry;
    @With
    @JsonProperty("radius")
    private final Double radius;

    // --- Vectores de profundidad (longitud ndep) ---
    @JsonProperty("rhox")
    private final double[] rhox;
    @JsonProperty("tau")
    private final double[] tau;
    @JsonProperty("temp")
    private final double[] temperature;
    @JsonProperty("xne")
    private final double[] electronDensity;
    @JsonProperty("xna")
    private final double[] atomicDensity;
    @JsonProperty("rho")
    private final double[] massDensity;
    @JsonProperty("height")
    private final double[] height;

    // Vector de abundancias, de longitud libre (no indexado por profundidad).
    @JsonProperty("abund")
    private final double[] abundances;

    /**
     * Constructor validador. Todo perfil que exista es coherente: vectores alineados índice a índice,
     * magnitudes estrictamente positivas (se interpolan en logaritmo) y coordenadas de profundidad
     * estrictamente crecientes.
     *
     * @param teff            Temperatura efectiva (K).
     * @param logg            Logaritmo de la gravedad superficial (cgs).
     * @param monh            Metalicidad [M/H].
     * @param vturb           Microturbulencia (km/s).
     * @param lonh            Parámetro de longitud de mezcla.
     * @param wlstd           Longitud de onda de la profundidad óptica de referencia (opcional).
     * @param depthVariable   Variable de profundidad para el transporte radiativo (opcional).
     * @param interpVariable  Variable de interpolación (opcional).
     * @param geometry        Geometría del modelo (opcional).
     * @param radius          Radio del modelo en cm (opcional).
     * @param rhox            Densidad de columna de masa (opcional si existe {@code tau}).
     * @param tau             Profundidad óptica de referencia (opcional si existe {@code rhox}).
     * @param temperature     Temperatura (K).
     * @param electronDensity Densidad numérica de electrones (1/cm³).
     * @param atomicDensity   Densidad numérica atómica (1/cm³).
     * @param massDensity     Densidad de masa (g/cm³).
     * @param height          Altura geométrica (opcional, modelos esféricos).
     * @param abundances      Abundancias relativas al total de núcleos atómicos (opcional).
     */
    @Builder(toBuilder = true)
    @JsonCreator
    public AtmosphereProfile(@JsonProperty("teff") double teff,
                             @JsonProperty("logg") double logg,
                             @JsonProperty("monh") double monh,
                             @JsonProperty("vturb") double vturb,
                             @JsonProperty("lonh") double lonh,
                             @JsonProperty("wlstd") Double wlstd,
                             @JsonProperty("depth") DepthVariable depthVariable,
                             @JsonProperty("interp") DepthVariable interpVariable,
                             @JsonProperty("geom") AtmosphereGeometry geometry,
                             @JsonProperty("radius") Double radius,
                             @JsonProperty("rhox") double[] rhox,
                             @JsonProperty("tau") double[] tau,
                             @JsonProperty("temp") double[] temperature,
                             @JsonProperty("xne") double[] electronDensity,
                             @JsonProperty("xna") double[] atomicDensity,
                             @JsonProperty("rho") double[] massDensity,
                             @JsonProperty("height") double[] height,
                             @JsonProperty("abund") double[] abundances) {

        // --- Validación del esquema ---
        if (rhox == null && tau == null) {
            throw new AtmosphereSchemaException("El perfil debe contener RHOX o TAU.");
        }
        requireQuantity(temperature, "TEMP");
        requireQuantity(electronDensity, "XNE");
        requireQuantity(atomicDensity, "XNA");
        requireQuantity(massDensity, "RHO");

        final int ndep = temperature.length;
        if (ndep < 2) {
            throw new IllegalArgumentException("Un perfil necesita al menos 2 puntos de profundidad.");
        }

        // Todos los vectores deben estar alineados índice a índice
        checkLength(rhox, ndep, "RHOX");
        checkLength(tau, ndep, "TAU");
        checkLength(electronDensity, ndep, "XNE");
        checkLength(atomicDensity, ndep, "XNA");
        checkLength(massDensity, ndep, "RHO");
        checkLength(height, ndep, "HEIGHT");

        checkPositive(temperature, "TEMP");
        checkPositive(electronDensity, "XNE");
        checkPositive(atomicDensity, "XNA");
        checkPositive(massDensity, "RHO");
        checkDepthScale(rhox, "RHOX");
        checkDepthScale(tau, "TAU");

        this.teff = teff;
        this.logg = logg;
        this.monh = monh;
        this.vturb = vturb;
        this.lonh = lonh;
        this.wlstd = wlstd;
        this.depthVariable = depthVariable;
        this.interpVariable = interpVariable;
        this.geometry = geometry;
        this.radius = radius;
        this.rhox = cloneOrNull(rhox);
        this.tau = cloneOrNull(tau);
        this.temperature = temperature.clone();
        this.electronDensity = electronDensity.clone();
        this.atomicDensity = atomicDensity.clone();
        this.massDensity = massDensity.clone();
        this.height = cloneOrNull(height);
        this.abundances = cloneOrNull(abundances);
    }

    // --- CONSULTAS ---

    /**
     * Número de puntos de profundidad (ndep).
     */
    public int getDepthPointCount() {
        return temperature.length;
    }

    public boolean hasRhox() {
        return rhox != null;
    }

    public boolean hasTau() {
        return tau != null;
    }

    public boolean has(DepthVariable variable) {
        return variable == DepthVariable.RHOX ? hasRhox() : hasTau();
    }

    public boolean hasHeight() {
        return height != null;
    }

    public boolean hasAbundances() {
        return abundances != null;
    }

    public boolean hasRadius() {
        return radius != null;
    }

    public OptionalDouble getRadius() {
        return radius == null ? OptionalDouble.empty() : OptionalDouble.of(radius);
    }

    public OptionalDouble getReferenceWavelength() {
        return wlstd == null ? OptionalDouble.empty() : OptionalDouble.of(wlstd);
    }

    /**
     * Vector de la coordenada de profundidad indicada, o {@code null} si no existe.
     */
    public double[] getDepth(DepthVariable variable) {
        return variable == DepthVariable.RHOX ? getRhox() : getTau();
    }

    // Los vectores se devuelven clonados para aislar el estado interno.

    public double[] getRhox() {
        return cloneOrNull(rhox);
    }

    public double[] getTau() {
        return cloneOrNull(tau);
    }

    public double[] getTemperature() {
        return temperature.clone();
    }

    public double[] getElectronDensity() {
        return electronDensity.clone();
    }

    public double[] getAtomicDensity() {
        return atomicDensity.clone();
    }

    public double[] getMassDensity() {
        return massDensity.clone();
    }

    public double[] getHeight() {
        return cloneOrNull(height);
    }

    public double[] getAbundances() {
        return cloneOrNull(abundances);
    }

    @Override
    public String toString() {
        return String.format("AtmosphereProfile[Teff=%.1f, logg=%.3f, [M/H]=%.3f, ndep=%d]",
                teff, logg, monh, getDepthPointCount());
    }

    // --- VALIDACIÓN ---

    private static void requireQuantity(double[] values, String name) {
        if (values == null) {
            throw new AtmosphereSchemaException("El perfil no contiene el vector obligatorio " + name + ".");
        }
    }

    private static void checkLength(double[] values, int ndep, String name) {
        if (values != null && values.length != ndep) {
            throw new IllegalArgumentException(String.format(
                    "El vector %s tiene %d puntos, pero el perfil tiene ndep=%d.", name, values.length, ndep));
        }
    }

    private static void checkPositive(double[] values, String name) {
        for (int i = 0; i < values.length; i++) {
            if (!(values[i] > 0) || Double.isInfinite(values[i])) {
                throw new IllegalArgumentException(String.format(
                        "El vector %s debe ser finito y estrictamente positivo (índice %d: %s).", name, i, values[i]));
            }
        }
    }

    private static void checkDepthScale(double[] values, String name) {
        if (values == null) {
            return;
        }
        checkPositive(values, name);
        for (int i = 0; i < values.length - 1; i++) {
            if (values[i + 1] <= values[i]) {
                throw new IllegalArgumentException(String.format(
                        "La escala de profundidad %s debe ser estrictamente creciente (índices %d y %d).", name, i, i + 1));
            }
        }
    }

    private static double[] cloneOrNull(double[] values) {
        return values == null ? null : values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AtmosphereProfile that)) return false;
        return Double.compare(teff, that.teff) == 0
                && Double.compare(logg, that.logg) == 0
                && Double.compare(monh, that.monh) == 0
                && Double.compare(vturb, that.vturb) == 0
                && Double.compare(lonh, that.lonh) == 0
                && Objects.equals(wlstd, that.wlstd)
                && depthVariable == that.depthVariable
                && interpVariable == that.interpVariable
                && geometry == that.geometry
                && Objects.equals(radius, that.radius)
                && Arrays.equals(rhox, that.rhox)
                && Arrays.equals(tau, that.tau)
                && Arrays.equals(temperature, that.temperature)
                && Arrays.equals(electronDensity, that.electronDensity)
                && Arrays.equals(atomicDensity, that.atomicDensity)
                && Arrays.equals(massDensity, that.massDensity)
                && Arrays.equals(height, that.height)
                && Arrays.equals(abundances, that.abundances);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(teff, logg, monh, vturb, lonh, wlstd, depthVariable, interpVariable, geometry, radius);
        result = 31 * result + Arrays.hashCode(rhox);
        result = 31 * result + Arrays.hashCode(tau);
        result = 31 * result + Arrays.hashCode(temperature);
        return result;
    }
}
