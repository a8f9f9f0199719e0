package nanocalc.physics.solver;

import lombok.extern.slf4j.Slf4j;
import nanocalc.domain.units.Complex;
import nanocalc.exception.NumericalInstabilityException;

/**
 * Solución de Mie para una esfera homogénea.
 * <p>
 * Calcula los coeficientes a_n y b_n con el esquema estable habitual (Bohren &amp; Huffman):
 * <ul>
 * <li>Derivada logarítmica D_n(mx) por recurrencia <b>descendente</b> desde un orden
 * superior a n_max, que es la dirección estable.</li>
 * <li>Funciones de Riccati-Bessel ψ_n(x) y χ_n(x) por recurrencia <b>ascendente</b> desde n = 0.</li>
 * </ul>
 * Las eficiencias se acumulan término a término y la serie se trunca cuando la contribución
 * de un término cae por debajo de {@code tolerance} veces el mayor término visto.
 * <p>
 * Clase utilidad sin estado; thread-safe.
 */
@Slf4j
public final class MieScatteringSolver {

    // Margen sobre max(n_max, |mx|) para arrancar la recurrencia descendente.
    private static final int DOWNWARD_RECURRENCE_MARGIN = 16;

    /**
     * Prohibido construir esta clase utilidad
     */
    private MieScatteringSolver() {
    }

    /**
     * Orden de truncamiento de Wiscombe: n_max = ceil(x + 4·x^(1/3) + 2).
     */
    public static int wiscombeTermCount(double sizeParameter) {
        return (int) Math.ceil(sizeParameter + 4.0 * Math.cbrt(sizeParameter) + 2.0);
    }

    /**
     * Suma la serie de Mie.
     *
     * @param sizeParameter Parámetro de tamaño x (> 0).
     * @param relativeIndex Índice relativo complejo m = n_partícula / n_medio.
     * @param tolerance     Umbral relativo de truncamiento.
     * @return Eficiencias, términos usados y estado de convergencia.
     * @throws NumericalInstabilityException si aparece un valor intermedio no finito.
     */
    public static MieSeries solve(double sizeParameter, Complex relativeIndex, double tolerance)
            throws NumericalInstabilityException {
        if (!(sizeParameter > 0.0) || !Double.isFinite(sizeParameter)) {
            throw new IllegalArgumentException("El parámetro de tamaño debe ser positivo y finito: " + sizeParameter);
        }
        final double x = sizeParameter;
        final Complex m = relativeIndex;
        final Complex mx = m.multiply(x);
        final int nMax = wiscombeTermCount(x);

        Complex[] d = logarithmicDerivative(mx, Math.max(nMax, (int) Math.ceil(mx.abs())) + DOWNWARD_RECURRENCE_MARGIN);

        // ψ_{n-1}, ψ_n y χ_{n-1}, χ_n arrancan en n = 0
        double psiPrev = Math.cos(x);
        double psiCurr = Math.sin(x);
        double chiPrev = -Math.sin(x);
        double chiCurr = Math.cos(x);
        Complex xiCurr = new Complex(psiCurr, -chiCurr);

        double sumSca = 0.0;
        double sumExt = 0.0;
        double maxTerm = 0.0;
        int termsUsed = nMax;
        boolean converged = false;

        for (int n = 1; n <= nMax; n++) {
            double psi = (2.0 * n - 1.0) / x * psiCurr - psiPrev;
            double chi = (2.0 * n - 1.0) / x * chiCurr - chiPrev;
            Complex xi = new Complex(psi, -chi);
            double nOverX = n / x;

            // a_n = [(D_n/m + n/x)ψ_n − ψ_{n-1}] / [(D_n/m + n/x)ξ_n − ξ_{n-1}]
            Complex aFactor = d[n].divide(m).add(nOverX);
            Complex an = aFactor.multiply(psi).subtract(psiCurr)
                    .divide(aFactor.multiply(xi).subtract(xiCurr));

            // b_n = [(m·D_n + n/x)ψ_n − ψ_{n-1}] / [(m·D_n + n/x)ξ_n − ξ_{n-1}]
            Complex bFactor = m.multiply(d[n]).add(nOverX);
            Complex bn = bFactor.multiply(psi).subtract(psiCurr)
                    .divide(bFactor.multiply(xi).subtract(xiCurr));

            if (!an.isFinite() || !bn.isFinite()) {
                throw new NumericalInstabilityException(String.format(
                        "coeficiente de Mie no finito en n=%d (x=%.6g, m=%s): a_n=%s, b_n=%s", n, x, m, an, bn));
            }

            double weight = 2.0 * n + 1.0;
            double scaTerm = weight * (an.absSquared() + bn.absSquared());
            double extTerm = weight * (an.re() + bn.re());
            sumSca += scaTerm;
            sumExt += extTerm;

            double magnitude = Math.max(Math.abs(scaTerm), Math.abs(extTerm));
            maxTerm = Math.max(maxTerm, magnitude);

            psiPrev = psiCurr;
            psiCurr = psi;
            chiPrev = chiCurr;
            chiCurr = chi;
            xiCurr = xi;

            if (magnitude <= tolerance * maxTerm) {
                termsUsed = n;
                converged = true;
                break;
            }
        }

        double factor = 2.0 / (x * x);
        double qSca = factor * sumSca;
        double qExt = factor * sumExt;
        if (!Double.isFinite(qSca) || !Double.isFinite(qExt)) {
            throw new NumericalInstabilityException(String.format(
                    "eficiencias no finitas (x=%.6g, m=%s): Q_sca=%s, Q_ext=%s", x, m, qSca, qExt));
        }

        log.debug("Serie de Mie: x={}, términos={}/{}, convergida={}", x, termsUsed, nMax, converged);
        return new MieSeries(qSca, qExt, termsUsed, nMax, converged);
    }

    /**
     * D_n(z) = ψ_n'(z)/ψ_n(z) por recurrencia descendente D_{n-1} = n/z − 1/(D_n + n/z),
     * partiendo de D_start = 0.
     */
    private static Complex[] logarithmicDerivative(Complex z, int start) throws NumericalInstabilityException {
        Complex[] d = new Complex[start + 1];
        d[start] = Complex.ZERO;
        for (int n = start; n > 0; n--) {
            Complex nOverZ = Complex.ofReal(n).divide(z);
            d[n - 1] = nOverZ.subtract(d[n].add(nOverZ).reciprocal());
            if (!d[n - 1].isFinite()) {
                throw new NumericalInstabilityException(String.format(
                        "derivada logarítmica no finita en n=%d (mx=%s)", n - 1, z));
            }
        }
        return d;
    }
}
