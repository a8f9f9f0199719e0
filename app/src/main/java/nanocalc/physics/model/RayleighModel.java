package nanocalc.physics.model;

import lombok.Getter;
import nanocalc.config.EngineConfig;
import nanocalc.domain.optical.CalculationRequest;
import nanocalc.domain.optical.OpticalResult;
import nanocalc.domain.optical.ParticleGeometry;
import nanocalc.domain.units.Complex;
import nanocalc.domain.units.Nanometers;
import nanocalc.exception.CalculationException;
import nanocalc.exception.NumericalInstabilityException;
import nanocalc.exception.ValidationException;
import nanocalc.physics.i.CacheKey;
import nanocalc.physics.i.OpticalModel;
import nanocalc.physics.solver.MieSeries;
import nanocalc.physics.solver.RayleighApproximation;
import nanocalc.validation.OpticalRequestValidator;
import nanocalc.validation.ValidationReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aproximación de Rayleigh (dipolo) para partículas mucho menores que la longitud de onda.
 * Fuera de x &lt; 1 el resultado se marca con un aviso.
 */
public class RayleighModel implements OpticalModel {

    public static final String NAME = "Rayleigh";

    private static final double VALIDITY_LIMIT = 1.0;

    @Getter
    private final CalculationRequest request;
    private final EngineConfig config;

    public RayleighModel(CalculationRequest request, EngineConfig config) {
        this.request = Objects.requireNonNull(request, "La petición no puede ser nula.");
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Scattering y absorción de esferas pequeñas (x < 1) en el límite dipolar";
    }

    @Override
    public ValidationReport validate() throws ValidationException {
        ValidationReport report = OpticalRequestValidator.validate(request, config);
        double x = request.sizeParameter();
        if (x > VALIDITY_LIMIT) {
            return report.withAdditional(List.of(String.format(
                    "Parámetro de tamaño x=%.2f > 1: la aproximación de Rayleigh puede ser inexacta, use Mie", x)));
        }
        return report;
    }

    @Override
    public OpticalResult compute() throws CalculationException {
        ValidationReport report = validate();
        double x = request.sizeParameter();
        Complex m = request.particleIndex().toComplex().divide(request.mediumIndex());
        MieSeries series = RayleighApproximation.solve(x, m);
        if (!Double.isFinite(series.qSca()) || !Double.isFinite(series.qExt())) {
            throw new NumericalInstabilityException("eficiencias de Rayleigh no finitas para m=" + m);
        }
        List<String> warnings = new ArrayList<>(report.getWarnings());
        warnings.add("Aproximación de Rayleigh");
        return MieModel.toResult(request.wavelength(), series, new ParticleGeometry(request.radius()), x, warnings);
    }

    @Override
    public RayleighModel atSweepPoint(double wavelengthNm) {
        return new RayleighModel(request.withWavelength(Nanometers.of(wavelengthNm)), config);
    }

    @Override
    public Optional<CacheKey> cacheKey() {
        return Optional.of(new CacheKey(NAME, request));
    }
}
