package nanocalc.domain.electronic;

/**
 * Régimen de confinamiento cuántico según la relación r/a_B entre el radio de la
 * partícula y el radio de Bohr del excitón.
 */
public enum ConfinementRegime {
    /** r &lt; a_B. */
    STRONG,
    /** a_B ≤ r ≤ 4·a_B. */
    INTERMEDIATE,
    /** r &gt; 4·a_B: el excitón apenas percibe la frontera. */
    WEAK;

    private static final double WEAK_LIMIT = 4.0;

    public static ConfinementRegime fromRatio(double radiusOverBohr) {
        if (radiusOverBohr < 1.0) {
            return STRONG;
        }
        return radiusOverBohr <= WEAK_LIMIT ? INTERMEDIATE : WEAK;
    }
}
