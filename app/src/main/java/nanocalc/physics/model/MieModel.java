package nanocalc.physics.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import nanocalc.config.EngineConfig;
import nanocalc.domain.material.MaterialRecord;
import nanocalc.domain.optical.CalculationRequest;
import nanocalc.domain.optical.OpticalMetadata;
import nanocalc.domain.optical.OpticalResult;
import nanocalc.domain.optical.ParticleGeometry;
import nanocalc.domain.units.Complex;
import nanocalc.domain.units.Nanometers;
import nanocalc.exception.CalculationException;
import nanocalc.exception.ConvergenceException;
import nanocalc.exception.ValidationException;
import nanocalc.physics.i.CacheKey;
import nanocalc.physics.i.OpticalModel;
import nanocalc.physics.solver.MieScatteringSolver;
import nanocalc.physics.solver.MieSeries;
import nanocalc.validation.OpticalRequestValidator;
import nanocalc.validation.ValidationReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Modelo óptico de Mie para una esfera homogénea en un medio no absorbente.
 * <p>
 * Si se construye con un {@link MaterialRecord}, cada punto de un barrido toma el índice de
 * la partícula de las constantes ópticas del material a esa longitud de onda; si no, el
 * índice de la petición se mantiene fijo en todo el barrido.
 */
@Slf4j
public class MieModel implements OpticalModel {

    public static final String NAME = "Mie";

    @Getter
    private final CalculationRequest request;
    private final EngineConfig config;
    private final MaterialRecord material;

    public MieModel(CalculationRequest request, EngineConfig config) {
        this(request, config, null);
    }

    /**
     * @param request  Petición a evaluar. Si hay material, su índice ya debe estar resuelto
     *                 para la longitud de onda de la petición.
     * @param config   Umbrales numéricos y política de convergencia.
     * @param material Material dispersivo opcional para los barridos.
     */
    public MieModel(CalculationRequest request, EngineConfig config, MaterialRecord material) {
        this.request = Objects.requireNonNull(request, "La petición no puede ser nula.");
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        this.material = material;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Scattering y absorción de una esfera homogénea por la serie exacta de Mie";
    }

    @Override
    public ValidationReport validate() throws ValidationException {
        return OpticalRequestValidator.validate(request, config);
    }

    @Override
    public OpticalResult compute() throws CalculationException {
        ValidationReport report = validate();

        double x = request.sizeParameter();
        Complex m = request.particleIndex().toComplex().divide(request.mediumIndex());
        MieSeries series = MieScatteringSolver.solve(x, m, config.getTruncationTolerance());

        List<String> warnings = new ArrayList<>(report.getWarnings());
        if (!series.converged()) {
            if (config.isFailOnNonConvergence()) {
                throw new ConvergenceException(series.termsUsed());
            }
            log.warn("Serie de Mie no convergida para {} ({} términos)", request, series.termsUsed());
            warnings.add(String.format(
                    "La serie agotó n_max = %d sin cumplir el criterio de truncamiento; resultado no fiable",
                    series.maxTerms()));
        }
        return toResult(request.wavelength(), series, new ParticleGeometry(request.radius()), x, warnings);
    }

    @Override
    public MieModel atSweepPoint(double wavelengthNm) {
        CalculationRequest point = request.withWavelength(Nanometers.of(wavelengthNm));
        if (material != null) {
            Nanometers wl = point.wavelength();
            point = material.refractiveIndexAt(wl)
                    .map(point::withParticleIndex)
                    .orElse(point);
        }
        return new MieModel(point, config, material);
    }

    @Override
    public Optional<CacheKey> cacheKey() {
        return Optional.of(new CacheKey(NAME, request));
    }

    /**
     * Convierte una serie en resultado: Q_abs = Q_ext − Q_sca y C = Q·π·r².
     */
    static OpticalResult toResult(Nanometers wavelength, MieSeries series, ParticleGeometry geometry,
                                  double sizeParameter, List<String> warnings) {
        double area = geometry.geometricCrossSection();
        double qSca = series.qSca();
        double qExt = series.qExt();
        double qAbs = series.qAbs();
        return OpticalResult.builder()
                .wavelength(wavelength)
                .qSca(qSca)
                .qAbs(qAbs)
                .qExt(qExt)
                .cSca(qSca * area)
                .cAbs(qAbs * area)
                .cExt(qExt * area)
                .metadata(new OpticalMetadata(sizeParameter, series.termsUsed(), series.converged(), warnings))
                .build();
    }

    @Override
    public String toString() {
        return "MieModel[" + request + (material != null ? ", material=" + material.getName() : "") + "]";
    }
}
