package atmogrid.physics.solver;

/**
 * Componentes del vector de desplazamiento, en el orden en que se almacenan.
 */
public enum ShiftComponent {
    /** Desplazamiento de la escala de profundidad (dex). */
    HORIZONTAL(0),
    /** Desplazamiento del valor logarítmico de la magnitud (dex). */
    VERTICAL(1),
    /** Ajuste de escala vertical respecto al centro de la curva. */
    SCALE(2),
    /** Hueco reservado, sin efecto en la curva. */
    RESERVED(3);

    private final int index;

    ShiftComponent(int index) {
        this.index = index;
    }

    public int index() {
        return index;
    }
}
