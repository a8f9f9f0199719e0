package nanocalc.compute;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import nanocalc.config.EngineConfig;
import nanocalc.config.PhysicalConstants;
import nanocalc.domain.electronic.ElectronicRequest;
import nanocalc.domain.electronic.ElectronicResult;
import nanocalc.domain.material.MaterialLookup;
import nanocalc.domain.material.MaterialRecord;
import nanocalc.domain.optical.CalculationRequest;
import nanocalc.domain.optical.OpticalResult;
import nanocalc.domain.optical.SpectrumRequest;
import nanocalc.domain.thermal.ThermalRequest;
import nanocalc.domain.thermal.ThermalResult;
import nanocalc.domain.units.Kelvin;
import nanocalc.domain.units.Nanometers;
import nanocalc.exception.CalculationException;
import nanocalc.exception.ValidationException;
import nanocalc.factory.ModelFactory;
import nanocalc.io.JsonMaterialCatalog;
import nanocalc.physics.i.OpticalModel;
import nanocalc.validation.ParameterValidator;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Punto de entrada público del núcleo de cálculo.
 * <p>
 * Recibe peticiones del dominio, construye el modelo adecuado con la {@link ModelFactory},
 * resuelve materiales por nombre con el {@link MaterialLookup} y delega la evaluación en el
 * {@link ComputeEngine}. No conoce a sus consumidores (interfaz gráfica, exportadores, etc.).
 * <p>
 * Es seguro entre hilos. Al cerrarlo se apagan el pool de trabajo y la caché.
 */
@Slf4j
public class NanoCalculator implements AutoCloseable {

    // Diámetro de la plantilla de barridos por tamaño; cada punto lo sustituye.
    private static final double TEMPLATE_DIAMETER_NM = 1.0;

    @Getter
    private final ComputeEngine engine;
    private final ModelFactory modelFactory;
    private final MaterialLookup materials;

    public NanoCalculator(EngineConfig config, MaterialLookup materials) {
        this(new ComputeEngine(config), new ModelFactory(config), materials);
    }

    NanoCalculator(ComputeEngine engine, ModelFactory modelFactory, MaterialLookup materials) {
        this.engine = Objects.requireNonNull(engine, "El motor no puede ser nulo.");
        this.modelFactory = Objects.requireNonNull(modelFactory, "La fábrica de modelos no puede ser nula.");
        this.materials = Objects.requireNonNull(materials, "El catálogo de materiales no puede ser nulo.");
    }

    /**
     * Configuración por defecto y catálogo de materiales incluido en el classpath.
     *
     * @throws IOException si el catálogo no se puede leer.
     */
    public static NanoCalculator withDefaults() throws IOException {
        return new NanoCalculator(EngineConfig.defaults(), JsonMaterialCatalog.fromClasspath());
    }

    // --- ÓPTICA ---

    /**
     * Eficiencias y secciones eficaces de Mie en un único punto.
     *
     * @throws CalculationException si la petición no es válida o el cálculo falla.
     */
    public OpticalResult calculate(CalculationRequest request) throws CalculationException {
        return logWarnings(engine.evaluate(modelFactory.createMieModel(request)));
    }

    /**
     * Espectro de Mie con índice de partícula fijo.
     *
     * @param template    Petición base; su longitud de onda se sustituye en cada punto.
     * @param wavelengths Longitudes de onda [nm], en el orden deseado.
     * @return Un resultado por longitud de onda, con el mismo índice.
     * @throws CalculationException el primer error por orden de índice aborta el espectro entero.
     */
    public List<OpticalResult> calculateSpectrum(CalculationRequest template, double[] wavelengths)
            throws CalculationException {
        return engine.evaluateSweep(modelFactory.createMieModel(template), wavelengths);
    }

    /**
     * Espectro descrito por un {@link SpectrumRequest}. Si nombra un material, el índice de la
     * partícula se toma de sus constantes ópticas en cada longitud de onda.
     */
    public List<OpticalResult> calculateSpectrum(SpectrumRequest request) throws CalculationException {
        OpticalModel template = request.material().isPresent()
                ? modelFactory.createMieModel(request.template(), resolve(request.material().get()))
                : modelFactory.createMieModel(request.template());
        return engine.evaluateSweep(template, request.wavelengths());
    }

    /**
     * Cálculo puntual con el índice de la partícula tomado del material.
     *
     * @param materialName Nombre o alias del material (p. ej. "Au").
     * @param template     Petición base; su índice de partícula se ignora.
     */
    public OpticalResult calculateForMaterial(String materialName, CalculationRequest template)
            throws CalculationException {
        return logWarnings(engine.evaluate(modelFactory.createMieModel(template, resolve(materialName))));
    }

    public OpticalResult calculateRayleigh(CalculationRequest request) throws CalculationException {
        return logWarnings(engine.evaluate(modelFactory.createRayleighModel(request)));
    }

    // --- TÉRMICA ---

    public ThermalResult calculateThermal(ThermalRequest request) throws CalculationException {
        return engine.evaluate(modelFactory.createThermalModel(request));
    }

    public ThermalResult calculateThermal(String materialName, double diameterNm, double temperatureK)
            throws CalculationException {
        ParameterValidator.start()
                .requireFinite("diameter", diameterNm)
                .requireFinite("temperature", temperatureK);
        return engine.evaluate(modelFactory.createThermalModel(
                resolve(materialName), Nanometers.of(diameterNm), Kelvin.of(temperatureK)));
    }

    /**
     * Conductividad efectiva de una partícula de diámetro fijo a lo largo de varias temperaturas.
     */
    public List<ThermalResult> temperatureSweep(String materialName, double diameterNm, double[] temperaturesK)
            throws CalculationException {
        Objects.requireNonNull(temperaturesK, "El array de temperaturas no puede ser nulo.");
        ParameterValidator.start().requireFinite("diameter", diameterNm);
        // La plantilla usa temperatura ambiente; cada punto la sustituye.
        return engine.evaluateSweep(modelFactory.createThermalModel(resolve(materialName), Nanometers.of(diameterNm),
                Kelvin.of(PhysicalConstants.ROOM_TEMPERATURE)), temperaturesK);
    }

    // --- ELECTRÓNICA ---

    public ElectronicResult calculateElectronic(ElectronicRequest request) throws CalculationException {
        return engine.evaluate(modelFactory.createElectronicModel(request));
    }

    public ElectronicResult calculateElectronic(String materialName, double diameterNm) throws CalculationException {
        ParameterValidator.start().requireFinite("diameter", diameterNm);
        return engine.evaluate(modelFactory.createElectronicModel(resolve(materialName), Nanometers.of(diameterNm)));
    }

    /**
     * Gap del punto cuántico para cada diámetro, en el mismo orden.
     */
    public List<ElectronicResult> sizeSweep(String materialName, double[] diametersNm) throws CalculationException {
        Objects.requireNonNull(diametersNm, "El array de diámetros no puede ser nulo.");
        return engine.evaluateSweep(modelFactory.createElectronicModel(
                resolve(materialName), Nanometers.of(TEMPLATE_DIAMETER_NM)), diametersNm);
    }

    // --- CACHÉ Y CICLO DE VIDA ---

    public int cacheSize() {
        return engine.cacheSize();
    }

    public void clearCache() {
        engine.clearCache();
    }

    private MaterialRecord resolve(String materialName) throws ValidationException {
        if (materialName == null || materialName.isBlank()) {
            throw ValidationException.invalidParameter("material", "nombre vacío");
        }
        return materials.lookupMaterial(materialName)
                .orElseThrow(() -> ValidationException.invalidParameter("material",
                        "material desconocido '" + materialName + "'"));
    }

    private static OpticalResult logWarnings(OpticalResult result) {
        List<String> warnings = result.metadata().warnings();
        if (!warnings.isEmpty()) {
            log.warn("Resultado a {} con avisos: {}", result.wavelength(), warnings);
        }
        return result;
    }

    @Override
    public void close() {
        engine.close();
    }
}
