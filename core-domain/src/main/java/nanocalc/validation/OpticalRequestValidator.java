package nanocalc.validation;

import nanocalc.config.EngineConfig;
import nanocalc.domain.optical.CalculationRequest;
import nanocalc.exception.ValidationException;

/**
 * Reglas de validación de una {@link CalculationRequest}.
 * <p>
 * Errores: radio, longitud de onda o índice del medio no positivos; parte real del índice
 * de la partícula no positiva; coeficiente de extinción negativo (convenio n + ik con k ≥ 0).
 * Avisos: parámetro de tamaño fuera del régimen bien caracterizado y absorción muy alta.
 */
public final class OpticalRequestValidator {

    /**
     * Prohibido construir esta clase utilidad
     */
    private OpticalRequestValidator() {
    }

    public static ValidationReport validate(CalculationRequest request, EngineConfig config) throws ValidationException {
        ParameterValidator validator = ParameterValidator.start()
                .requirePositive("radius", request.radius().value())
                .requirePositive("wavelength", request.wavelength().value())
                .requirePositive("mediumIndex", request.mediumIndex())
                .requirePositive("particleIndex.real", request.particleIndex().real());

        double k = request.particleIndex().imaginary();
        if (k < 0.0) {
            throw ValidationException.physicsViolation("particleIndex.imaginary", k,
                    "el coeficiente de extinción debe ser >= 0 en el convenio n + ik");
        }

        return validator
                .warnIfOutside("sizeParameter", request.sizeParameter(),
                        config.getMinSizeParameter(), config.getMaxSizeParameter())
                .warnIfAbove("particleIndex.imaginary", k, config.getHighAbsorptionThreshold(),
                        "absorción muy alta, precisión reducida")
                .report();
    }
}
