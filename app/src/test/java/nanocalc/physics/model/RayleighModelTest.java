package nanocalc.physics.model;

import nanocalc.config.EngineConfig;
import nanocalc.domain.optical.CalculationRequest;
import nanocalc.domain.optical.OpticalResult;
import nanocalc.domain.units.RefractiveIndex;
import nanocalc.exception.CalculationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RayleighModelTest {

    private final EngineConfig config = EngineConfig.defaults();

    @Test
    @DisplayName("Partícula pequeña: coincide con Mie al 0.1%")
    void compute_smallParticle_shouldAgreeWithMie() throws CalculationException {
        CalculationRequest request = CalculationRequest.of(1, 500, RefractiveIndex.of(1.5, 0.1), 1.0);

        OpticalResult rayleigh = new RayleighModel(request, config).compute();
        OpticalResult mie = new MieModel(request, config).compute();

        assertEquals(mie.qExt(), rayleigh.qExt(), 1e-3 * mie.qExt());
        assertEquals(mie.cExt(), rayleigh.cExt(), 1e-3 * mie.cExt());
        assertTrue(rayleigh.metadata().warnings().contains("Aproximación de Rayleigh"));
    }

    @Test
    @DisplayName("x > 1: se avisa de que la aproximación deja de ser válida")
    void compute_largeParticle_shouldWarn() throws CalculationException {
        CalculationRequest request = CalculationRequest.of(100, 500, RefractiveIndex.of(1.5, 0.0), 1.0);
        RayleighModel model = new RayleighModel(request, config);

        OpticalResult result = model.compute();

        assertTrue(result.metadata().warnings().stream().anyMatch(w -> w.contains("use Mie")));
        assertEquals(1, model.warnings().size());
        assertEquals(0.0, result.qAbs(), 1e-15);
    }

    @Test
    @DisplayName("Barrido: la variable es la longitud de onda y el nombre identifica el modelo")
    void atSweepPoint_shouldReplaceWavelength() {
        CalculationRequest request = CalculationRequest.of(5, 500, RefractiveIndex.of(1.5, 0.1), 1.0);

        RayleighModel point = new RayleighModel(request, config).atSweepPoint(650);

        assertEquals(650.0, point.getRequest().wavelength().value());
        assertEquals(RayleighModel.NAME, point.getName());
    }
}
