package atmogrid.physics.solver;

/**
 * Restricción suave sobre un parámetro: añade al ajuste el residuo {@code (p - target) / uncertainty}.
 * Una incertidumbre mayor implica una restricción más débil.
 */
public record PenaltyTerm(double target, double uncertainty) {

    public PenaltyTerm {
        if (!Double.isFinite(target)) {
            throw new IllegalArgumentException("El objetivo de la penalización debe ser finito.");
        }
        if (!(uncertainty > 0) || Double.isInfinite(uncertainty)) {
            throw new IllegalArgumentException("La incertidumbre de la penalización debe ser positiva y finita: " + uncertainty);
        }
    }

    public static PenaltyTerm towardZero(double uncertainty) {
        return new PenaltyTerm(0.0, uncertainty);
    }
}
