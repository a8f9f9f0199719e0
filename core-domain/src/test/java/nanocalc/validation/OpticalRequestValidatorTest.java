package nanocalc.validation;

import nanocalc.config.EngineConfig;
import nanocalc.domain.optical.CalculationRequest;
import nanocalc.domain.units.Nanometers;
import nanocalc.domain.units.RefractiveIndex;
import nanocalc.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OpticalRequestValidatorTest {

    private final EngineConfig config = EngineConfig.defaults();
    private final CalculationRequest gold = CalculationRequest.of(50, 520, RefractiveIndex.of(0.47, 2.40), 1.33);

    @Test
    @DisplayName("Petición nominal: sin errores ni avisos")
    void validate_nominalRequest_shouldBeClean() throws ValidationException {
        ValidationReport report = OpticalRequestValidator.validate(gold, config);

        assertFalse(report.hasWarnings(), "No se esperaban avisos: " + report);
    }

    @Test
    @DisplayName("Frontera: radio 0 y longitud de onda 0 se rechazan como OUT_OF_RANGE")
    void validate_zeroRadiusOrWavelength_shouldFail() {
        ValidationException radius = assertThrows(ValidationException.class,
                () -> OpticalRequestValidator.validate(gold.withRadius(Nanometers.of(0)), config));
        ValidationException wavelength = assertThrows(ValidationException.class,
                () -> OpticalRequestValidator.validate(gold.withWavelengthNm(0), config));

        assertEquals("radius", radius.getParameter());
        assertEquals(ValidationException.Reason.OUT_OF_RANGE, radius.getReason());
        assertEquals("wavelength", wavelength.getParameter());
    }

    @Test
    @DisplayName("Índice del medio y parte real del índice de la partícula deben ser positivos")
    void validate_nonPositiveIndices_shouldFail() {
        assertThrows(ValidationException.class,
                () -> OpticalRequestValidator.validate(gold.withMediumIndex(0.0), config));
        assertThrows(ValidationException.class,
                () -> OpticalRequestValidator.validate(gold.withParticleIndex(RefractiveIndex.of(-0.5, 1.0)), config));
    }

    @Test
    @DisplayName("Coeficiente de extinción negativo: violación física")
    void validate_negativeExtinction_shouldBePhysicsViolation() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> OpticalRequestValidator.validate(gold.withParticleIndex(RefractiveIndex.of(1.5, -0.1)), config));

        assertEquals(ValidationException.Reason.PHYSICS_VIOLATION, ex.getReason());
        assertEquals(-0.1, ex.getValue());
    }

    @Test
    @DisplayName("Parámetro de tamaño fuera de régimen y absorción alta producen avisos, no errores")
    void validate_outsideRegime_shouldOnlyWarn() throws ValidationException {
        // x = 2π·0.5/500 ≈ 0.0063 < 0.01
        CalculationRequest tiny = gold.withRadius(Nanometers.of(0.5))
                .withParticleIndex(RefractiveIndex.of(1.0, 12.0));

        ValidationReport report = OpticalRequestValidator.validate(tiny, config);

        assertEquals(2, report.getWarnings().size());
        assertTrue(report.getWarnings().get(0).startsWith("sizeParameter"));
        assertTrue(report.getWarnings().get(1).startsWith("particleIndex.imaginary"));
    }
}
