package nanocalc.physics.solver;

import lombok.extern.slf4j.Slf4j;
import nanocalc.domain.units.Complex;
import nanocalc.exception.NumericalInstabilityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class MieScatteringSolverTest {

    private static final double TOL = 1e-8;

    @Test
    @DisplayName("El constructor es privado (clase utilidad)")
    void constructor_shouldBePrivate() throws NoSuchMethodException {
        Constructor<MieScatteringSolver> constructor = MieScatteringSolver.class.getDeclaredConstructor();
        assertTrue(Modifier.isPrivate(constructor.getModifiers()), "El constructor debe ser privado");

        constructor.setAccessible(true);
        try {
            constructor.newInstance();
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            fail("La instanciación por reflexión no debería fallar: " + e.getMessage());
        }
    }

    @Test
    @DisplayName("Orden de truncamiento de Wiscombe: n_max = ceil(x + 4x^(1/3) + 2)")
    void wiscombeTermCount_shouldFollowCriterion() {
        assertEquals(6, MieScatteringSolver.wiscombeTermCount(2 * Math.PI * 50 / 520));
        assertEquals(21, MieScatteringSolver.wiscombeTermCount(10.0));
        assertEquals(121, MieScatteringSolver.wiscombeTermCount(100.0));
        assertEquals(1042, MieScatteringSolver.wiscombeTermCount(1000.0));
    }

    // Valores de referencia contrastados con una implementación independiente de la misma
    // recursión (BHMIE de Bohren y Huffman, x = 0.6041, m = n_p / n_medio). El Qext ≈ 3.52 que
    // circula para este caso no corresponde a ninguna de las dos convenciones (agua ni vacío).
    @Test
    @DisplayName("Esfera de oro r=50 nm, λ=520 nm, n=0.47+2.40i en agua (n=1.33)")
    void solve_goldSphereInWater_shouldMatchReference() throws NumericalInstabilityException {
        double x = 2 * Math.PI * 50 / 520;
        Complex m = new Complex(0.47, 2.40).divide(1.33);

        MieSeries series = MieScatteringSolver.solve(x, m, TOL);

        log.info("Oro en agua: Qsca={}, Qabs={}, Qext={}, términos={}", series.qSca(), series.qAbs(), series.qExt(), series.termsUsed());
        assertEquals(2.442455, series.qSca(), 1e-5);
        assertEquals(6.215056, series.qExt(), 1e-5);
        assertEquals(3.772600, series.qAbs(), 1e-5);
        assertTrue(series.converged());
        assertEquals(5, series.termsUsed());
        assertEquals(6, series.maxTerms());
    }

    @Test
    @DisplayName("Misma esfera en vacío (n_medio=1)")
    void solve_goldSphereInVacuum_shouldMatchReference() throws NumericalInstabilityException {
        MieSeries series = MieScatteringSolver.solve(2 * Math.PI * 50 / 520, new Complex(0.47, 2.40), TOL);

        assertEquals(1.545232, series.qSca(), 1e-5);
        assertEquals(3.231006, series.qExt(), 1e-5);
    }

    @Test
    @DisplayName("Caso de Wiscombe: x=100, m=1.33+1e-5i")
    void solve_wiscombeLargeSphere_shouldMatchPublishedValues() throws NumericalInstabilityException {
        MieSeries series = MieScatteringSolver.solve(100.0, new Complex(1.33, 1e-5), TOL);

        assertEquals(2.101314, series.qExt(), 1e-4);
        assertEquals(2.096587, series.qSca(), 1e-4);
        assertTrue(series.converged());
        assertTrue(series.termsUsed() <= series.maxTerms());
    }

    @Test
    @DisplayName("Dieléctrico sin pérdidas: Q_abs ≈ 0 y Q_ext = Q_sca")
    void solve_losslessDielectric_shouldNotAbsorb() throws NumericalInstabilityException {
        MieSeries series = MieScatteringSolver.solve(10.0, Complex.ofReal(1.5), TOL);

        assertEquals(2.881999, series.qExt(), 1e-5);
        assertEquals(0.0, series.qAbs(), 1e-10);
    }

    @Test
    @DisplayName("Partícula indistinguible del medio (m=1): sin scattering, convergida en el primer término")
    void solve_indexMatched_shouldGiveZeroEfficiencies() throws NumericalInstabilityException {
        MieSeries series = MieScatteringSolver.solve(5.0, Complex.ONE, TOL);

        assertEquals(0.0, series.qSca(), 1e-12);
        assertEquals(0.0, series.qExt(), 1e-12);
        assertTrue(series.converged());
        assertEquals(1, series.termsUsed());
    }

    @Test
    @DisplayName("Límite de Rayleigh: para x≪1 Mie coincide con la aproximación dipolar (0.1%)")
    void solve_smallParticle_shouldMatchRayleighLimit() throws NumericalInstabilityException {
        double x = 2 * Math.PI * 1 / 500;
        Complex m = new Complex(1.5, 0.1);

        MieSeries mie = MieScatteringSolver.solve(x, m, TOL);
        MieSeries rayleigh = RayleighApproximation.solve(x, m);

        assertEquals(rayleigh.qExt(), mie.qExt(), 1e-3 * mie.qExt());
        assertEquals(rayleigh.qSca(), mie.qSca(), 1e-3 * mie.qSca());
        assertEquals(rayleigh.qAbs(), mie.qAbs(), 1e-3 * mie.qAbs());
    }

    @Test
    @DisplayName("Determinismo: entradas idénticas producen resultados idénticos bit a bit")
    void solve_shouldBeDeterministic() throws NumericalInstabilityException {
        Complex m = new Complex(0.25, 2.98);

        MieSeries first = MieScatteringSolver.solve(1.7, m, TOL);
        MieSeries second = MieScatteringSolver.solve(1.7, m, TOL);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("x=1000 absorbente: la serie agota n_max sin converger")
    void solve_veryLargeSphere_shouldReportNonConvergence() throws NumericalInstabilityException {
        MieSeries series = MieScatteringSolver.solve(1000.0, new Complex(1.5, 0.1), TOL);

        assertFalse(series.converged());
        assertEquals(1042, series.termsUsed());
        assertEquals(series.maxTerms(), series.termsUsed());
        assertTrue(Double.isFinite(series.qExt()));
    }

    @Test
    @DisplayName("Parámetro de tamaño no positivo: error de programación")
    void solve_nonPositiveSizeParameter_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> MieScatteringSolver.solve(0.0, Complex.ONE, TOL));
        assertThrows(IllegalArgumentException.class, () -> MieScatteringSolver.solve(Double.NaN, Complex.ONE, TOL));
    }
}
