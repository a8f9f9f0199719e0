package nanocalc.physics.model;

import lombok.Getter;
import nanocalc.domain.thermal.ThermalMetadata;
import nanocalc.domain.thermal.ThermalRequest;
import nanocalc.domain.thermal.ThermalResult;
import nanocalc.domain.thermal.ThermalTransportRegime;
import nanocalc.domain.units.Kelvin;
import nanocalc.domain.units.Nanometers;
import nanocalc.exception.CalculationException;
import nanocalc.exception.NumericalInstabilityException;
import nanocalc.exception.ValidationException;
import nanocalc.physics.i.CacheKey;
import nanocalc.physics.i.ThermalModel;
import nanocalc.validation.ParameterValidator;
import nanocalc.validation.ValidationReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Conductividad térmica efectiva limitada por la dispersión en la frontera de la partícula.
 * <p>
 * Regla de Matthiessen con longitud de frontera igual al diámetro:
 * <pre>
 *   1/Λ_eff = 1/Λ + 1/d   ⇒   κ_eff = κ_bulk / (1 + Λ/d)
 * </pre>
 * κ_bulk y Λ se escalan como T_ref/T (régimen Umklapp, por encima de la temperatura de Debye).
 */
public class BoundaryScatteringThermalModel implements ThermalModel {

    public static final String NAME = "BoundaryScattering";

    // Por debajo de esta temperatura el escalado 1/T deja de ser razonable.
    private static final double UMKLAPP_MIN_TEMPERATURE = 50.0;
    private static final double CONTINUUM_MIN_DIAMETER = 1.0;

    @Getter
    private final ThermalRequest request;

    public BoundaryScatteringThermalModel(ThermalRequest request) {
        this.request = Objects.requireNonNull(request, "La petición no puede ser nula.");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Conductividad térmica efectiva por dispersión en frontera (regla de Matthiessen)";
    }

    @Override
    public ValidationReport validate() throws ValidationException {
        return ParameterValidator.start()
                .requirePositive("diameter", request.diameter().value())
                .requirePositive("temperature", request.temperature().value())
                .requirePositive("referenceTemperature", request.referenceTemperature().value())
                .requirePositive("bulkConductivity", request.bulkConductivity())
                .requireNonNegative("meanFreePath", request.meanFreePath().value())
                .warnIfBelow("temperature", request.temperature().value(), UMKLAPP_MIN_TEMPERATURE,
                        "temperatura baja, el escalado Umklapp 1/T es poco fiable")
                .warnIfBelow("diameter", request.diameter().value(), CONTINUUM_MIN_DIAMETER,
                        "partícula por debajo de 1 nm, fuera del modelo continuo")
                .report();
    }

    @Override
    public ThermalResult compute() throws CalculationException {
        ValidationReport report = validate();

        double scale = request.referenceTemperature().value() / request.temperature().value();
        double kappaBulk = request.bulkConductivity() * scale;
        double meanFreePath = request.meanFreePath().value() * scale;
        double knudsen = meanFreePath / request.diameter().value();
        double kappaEffective = kappaBulk / (1.0 + knudsen);

        if (!Double.isFinite(kappaEffective) || !Double.isFinite(knudsen)) {
            throw new NumericalInstabilityException(String.format(
                    "conductividad no finita (κ_bulk=%s, Kn=%s)", kappaBulk, knudsen));
        }

        ThermalTransportRegime regime = ThermalTransportRegime.fromKnudsen(knudsen);
        List<String> notes = new ArrayList<>(report.getWarnings());
        if (regime == ThermalTransportRegime.BALLISTIC) {
            notes.add("Régimen balístico: la regla de Matthiessen sobreestima κ_eff");
        }

        return ThermalResult.builder()
                .temperature(request.temperature())
                .kappaEffective(kappaEffective)
                .kappaBulk(kappaBulk)
                .reductionFactor(kappaEffective / kappaBulk)
                .meanFreePath(Nanometers.of(meanFreePath))
                .metadata(new ThermalMetadata(knudsen, regime, notes))
                .build();
    }

    @Override
    public BoundaryScatteringThermalModel atSweepPoint(double temperatureKelvin) {
        return new BoundaryScatteringThermalModel(request.withTemperature(Kelvin.of(temperatureKelvin)));
    }

    @Override
    public Optional<CacheKey> cacheKey() {
        return Optional.of(new CacheKey(NAME, request));
    }
}
