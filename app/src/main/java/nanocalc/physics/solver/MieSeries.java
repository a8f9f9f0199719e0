package nanocalc.physics.solver;

/**
 * Resultado crudo de la suma de la serie de Mie, antes de convertirse en secciones eficaces.
 *
 * @param qSca       Eficiencia de scattering.
 * @param qExt       Eficiencia de extinción.
 * @param termsUsed  Términos sumados.
 * @param maxTerms   n_max del criterio de Wiscombe.
 * @param converged  {@code true} si la serie se cortó por el criterio de truncamiento.
 */
public record MieSeries(double qSca, double qExt, int termsUsed, int maxTerms, boolean converged) {

    /**
     * Q_abs = Q_ext − Q_sca.
     */
    public double qAbs() {
        return qExt - qSca;
    }
}
