package atmogrid.factory;

import atmogrid.domain.atmosphere.AtmosphereProfile;
import atmogrid.domain.grid.GridDataset;

import java.util.ArrayList;
import java.util.List;

/**
 * Fábrica de atmósferas sintéticas suaves para pruebas.
 * <p>
 * T(τ) de Eddington, {@code T⁴ = ¾ Teff⁴ (τ + ⅔)}, sobre log τ ∈ [-5, 1]; RHOX, XNE, XNA y RHO
 * son funciones no lineales suaves de log τ, log g y [M/H]. Ningún valor logarítmico del extremo
 * profundo queda cerca de 4.2.
 */
public final class SyntheticAtmosphereFactory {

    public static final int DEFAULT_DEPTH_POINTS = 40;
    public static final double SOLAR_RADIUS_CM = 69.550e9;

    private SyntheticAtmosphereFactory() {}

    public static AtmosphereProfile model(double teff, double logg, double monh) {
        return model(teff, logg, monh, DEFAULT_DEPTH_POINTS);
    }

    public static AtmosphereProfile model(double teff, double logg, double monh, int ndep) {
        double[] tau = new double[ndep];
        double[] rhox = new double[ndep];
        double[] temp = new double[ndep];
        double[] xne = new double[ndep];
        double[] xna = new double[ndep];
        double[] rho = new double[ndep];

        for (int i = 0; i < ndep; i++) {
            double lt = -5.0 + 6.0 * i / (ndep - 1);
            tau[i] = Math.pow(10.0, lt);
            temp[i] = teff * Math.pow(0.75 * (tau[i] + 2.0 / 3.0), 0.25);

            double lrhox = 0.9 * lt + 0.02 * lt * lt + 0.05 * (logg - 4.0) * lt + 0.5 * (logg - 4.0) - 0.1 * monh;
            double lT = Math.log10(temp[i] / 5000.0);
            rhox[i] = Math.pow(10.0, lrhox);
            rho[i] = Math.pow(10.0, lrhox - 8.5);
            xne[i] = Math.pow(10.0, 10.0 + 0.8 * lrhox + 3.0 * lT + 0.3 * monh);
            xna[i] = Math.pow(10.0, 14.0 + 0.9 * lrhox - 0.5 * lT);
        }

        return AtmosphereProfile.builder()
                .teff(teff).logg(logg).monh(monh)
                .vturb(1.0 + 0.5 * (teff - 5000.0) / 1000.0)
                .lonh(1.25)
                .wlstd(5000.0)
                .rhox(rhox).tau(tau)
                .temperature(temp).electronDensity(xne).atomicDensity(xna).massDensity(rho)
                .abundances(new double[]{0.92, 0.078, -10.94 + monh})
                .build();
    }

    /**
     * Modelo esférico: radio y altura geométrica (decreciente con la profundidad).
     */
    public static AtmosphereProfile sphericalModel(double teff, double logg, double monh, double radiusCm) {
        AtmosphereProfile base = model(teff, logg, monh);
        double[] height = new double[base.getDepthPointCount()];
        for (int i = 0; i < height.length; i++) {
            height[i] = 1.0e8 * (height.length - 1 - i);
        }
        return base.toBuilder().radius(radiusCm).height(height).build();
    }

    /**
     * Rejilla regular completa (producto cartesiano de los tres ejes).
     */
    public static GridDataset grid(double[] teffs, double[] loggs, double[] monhs) {
        List<AtmosphereProfile> models = new ArrayList<>();
        for (double m : monhs) {
            for (double g : loggs) {
                for (double t : teffs) {
                    models.add(model(t, g, m));
                }
            }
        }
        return GridDataset.builder().models(models).version("synthetic-1").source("synthetic").build();
    }

    /**
     * Teff {5000, 5500, 6000}, log g {4.0, 4.5}, [M/H] {-0.5, 0.0}.
     */
    public static GridDataset standardGrid() {
        return grid(new double[]{5000, 5500, 6000}, new double[]{4.0, 4.5}, new double[]{-0.5, 0.0});
    }

    public static GridDataset sphericalGrid() {
        List<AtmosphereProfile> models = new ArrayList<>();
        for (double m : new double[]{-0.5, 0.0}) {
            for (double g : new double[]{4.0, 4.5}) {
                for (double t : new double[]{5000, 5500, 6000}) {
                    models.add(sphericalModel(t, g, m, SOLAR_RADIUS_CM));
                }
            }
        }
        return GridDataset.builder().models(models).version("synthetic-sph").source("synthetic-sph").build();
    }

    /**
     * Copia del perfil con una capa superior casi duplicada (paso fraccional 0.005).
     */
    public static AtmosphereProfile withNearDuplicateTopLayer(AtmosphereProfile profile) {
        return profile.toBuilder()
                .tau(prependScaled(profile.getTau(), 0.995))
                .rhox(prependScaled(profile.getRhox(), 0.995))
                .temperature(prependScaled(profile.getTemperature(), 1.0))
                .electronDensity(prependScaled(profile.getElectronDensity(), 1.0))
                .atomicDensity(prependScaled(profile.getAtomicDensity(), 1.0))
                .massDensity(prependScaled(profile.getMassDensity(), 1.0))
                .height(profile.hasHeight() ? prependScaled(profile.getHeight(), 1.0) : null)
                .build();
    }

    private static double[] prependScaled(double[] values, double factor) {
        double[] out = new double[values.length + 1];
        out[0] = values[0] * factor;
        System.arraycopy(values, 0, out, 1, values.length);
        return out;
    }
}
