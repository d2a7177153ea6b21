package atmogrid.physics.solver;

import java.util.Objects;

/**
 * Transformación que alinea una curva tabulada sobre otra.
 * <p>
 * Se produce en el ajuste de cada magnitud y se consume inmediatamente en el remuestreo
 * dentro de la misma mezcla; nunca se persiste.
 *
 * @param horizontal Desplazamiento de la coordenada de profundidad.
 * @param vertical   Desplazamiento del valor.
 * @param scale      Ajuste de escala: {@code y_c + (1 + scale) * (y - y_c)}.
 * @param reserved   Sin uso en la curva.
 */
public record ShiftParameters(double horizontal, double vertical, double scale, double reserved) {

    public static final ShiftParameters ZERO = new ShiftParameters(0.0, 0.0, 0.0, 0.0);

    public static final int SIZE = ShiftComponent.values().length;

    public static ShiftParameters of(double[] values) {
        Objects.requireNonNull(values, "El vector de parámetros no puede ser nulo.");
        if (values.length != SIZE) {
            throw new IllegalArgumentException("Se esperaban " + SIZE + " parámetros, recibidos " + values.length);
        }
        return new ShiftParameters(values[0], values[1], values[2], values[3]);
    }

    public double[] toArray() {
        return new double[]{horizontal, vertical, scale, reserved};
    }

    public double get(ShiftComponent component) {
        return switch (component) {
            case HORIZONTAL -> horizontal;
            case VERTICAL -> vertical;
            case SCALE -> scale;
            case RESERVED -> reserved;
        };
    }

    /**
     * Multiplica los cuatro componentes por el mismo factor (p.ej. {@code -frac} o {@code 1 - frac}).
     */
    public ShiftParameters scaled(double factor) {
        return new ShiftParameters(horizontal * factor, vertical * factor, scale * factor, reserved * factor);
    }

    public boolean isFinite() {
        return Double.isFinite(horizontal) && Double.isFinite(vertical)
                && Double.isFinite(scale) && Double.isFinite(reserved);
    }
}
