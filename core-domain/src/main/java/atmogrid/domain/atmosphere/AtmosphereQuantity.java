package atmogrid.domain.atmosphere;

import java.util.function.Function;

/**
 * Vectores físicos de un perfil que participan en la interpolación por desplazamiento.
 * <p>
 * Todos se interpolan en escala logarítmica, por lo que deben ser estrictamente positivos.
 */
public enum AtmosphereQuantity {

    TEMP(AtmosphereProfile::getTemperature),
    XNE(AtmosphereProfile::getElectronDensity),
    XNA(AtmosphereProfile::getAtomicDensity),
    RHO(AtmosphereProfile::getMassDensity),
    RHOX(AtmosphereProfile::getRhox),
    TAU(AtmosphereProfile::getTau);

    private final Function<AtmosphereProfile, double[]> accessor;

    AtmosphereQuantity(Function<AtmosphereProfile, double[]> accessor) {
        this.accessor = accessor;
    }

    /**
     * Copia del vector de esta magnitud, o {@code null} si el perfil no lo contiene.
     */
    public double[] extractFrom(AtmosphereProfile profile) {
        return accessor.apply(profile);
    }

    /**
     * Magnitud asociada a una coordenada de profundidad.
     */
    public static AtmosphereQuantity of(DepthVariable variable) {
        return variable == DepthVariable.RHOX ? RHOX : TAU;
    }
}
