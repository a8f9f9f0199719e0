package nanocalc.physics.solver;

import nanocalc.domain.units.Complex;

/**
 * Límite de Rayleigh (x ≪ 1) de la teoría de Mie, en forma cerrada.
 * <p>
 * Q_sca = 8/3·x⁴·|α|² y Q_abs = 4x·Im(α), con α = (m² − 1)/(m² + 2).
 */
public final class RayleighApproximation {

    /**
     * Prohibido construir esta clase utilidad
     */
    private RayleighApproximation() {
    }

    /**
     * Factor de polarizabilidad de Clausius-Mossotti (m² − 1)/(m² + 2).
     */
    public static Complex polarizabilityFactor(Complex relativeIndex) {
        Complex m2 = relativeIndex.multiply(relativeIndex);
        return m2.subtract(1.0).divide(m2.add(2.0));
    }

    public static double scatteringEfficiency(double sizeParameter, Complex relativeIndex) {
        double x4 = Math.pow(sizeParameter, 4);
        return 8.0 / 3.0 * x4 * polarizabilityFactor(relativeIndex).absSquared();
    }

    public static double absorptionEfficiency(double sizeParameter, Complex relativeIndex) {
        return 4.0 * sizeParameter * polarizabilityFactor(relativeIndex).im();
    }

    /**
     * Serie equivalente de un único término, para tratarla igual que la de Mie.
     */
    public static MieSeries solve(double sizeParameter, Complex relativeIndex) {
        double qSca = scatteringEfficiency(sizeParameter, relativeIndex);
        double qAbs = absorptionEfficiency(sizeParameter, relativeIndex);
        return new MieSeries(qSca, qSca + qAbs, 1, 1, true);
    }
}
