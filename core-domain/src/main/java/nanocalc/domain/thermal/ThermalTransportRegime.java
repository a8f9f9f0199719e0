package nanocalc.domain.thermal;

/**
 * Régimen de transporte de calor según el número de Knudsen Kn = Λ/d.
 */
public enum ThermalTransportRegime {
    /** Kn &lt; 0.1: el camino libre medio es mucho menor que la partícula. */
    DIFFUSIVE,
    /** 0.1 ≤ Kn ≤ 10: la dispersión en la frontera compite con la intrínseca. */
    QUASI_BALLISTIC,
    /** Kn &gt; 10: domina la dispersión en la superficie de la partícula. */
    BALLISTIC;

    private static final double DIFFUSIVE_LIMIT = 0.1;
    private static final double BALLISTIC_LIMIT = 10.0;

    public static ThermalTransportRegime fromKnudsen(double knudsenNumber) {
        if (knudsenNumber < DIFFUSIVE_LIMIT) {
            return DIFFUSIVE;
        }
        return knudsenNumber <= BALLISTIC_LIMIT ? QUASI_BALLISTIC : BALLISTIC;
    }
}
