package nanocalc.factory;

import lombok.RequiredArgsConstructor;
import nanocalc.config.EngineConfig;
import nanocalc.config.PhysicalConstants;
import nanocalc.domain.electronic.ElectronicRequest;
import nanocalc.domain.material.BandgapParameters;
import nanocalc.domain.material.MaterialRecord;
import nanocalc.domain.optical.CalculationRequest;
import nanocalc.domain.thermal.ThermalRequest;
import nanocalc.domain.units.Kelvin;
import nanocalc.domain.units.Nanometers;
import nanocalc.domain.units.RefractiveIndex;
import nanocalc.exception.ValidationException;
import nanocalc.physics.i.ElectronicModel;
import nanocalc.physics.i.OpticalModel;
import nanocalc.physics.i.ThermalModel;
import nanocalc.physics.model.BoundaryScatteringThermalModel;
import nanocalc.physics.model.BrusElectronicModel;
import nanocalc.physics.model.MieModel;
import nanocalc.physics.model.RayleighModel;

/**
 * Fábrica centralizada de modelos físicos.
 * <p>
 * Construye el modelo adecuado a partir de una petición explícita o de las propiedades
 * de referencia de un {@link MaterialRecord}. Si el material no tiene los datos que el
 * modelo necesita, la construcción falla con un error de validación.
 */
@RequiredArgsConstructor
public class ModelFactory {

    private final EngineConfig config;

    public OpticalModel createMieModel(CalculationRequest request) {
        return new MieModel(request, config);
    }

    public OpticalModel createRayleighModel(CalculationRequest request) {
        return new RayleighModel(request, config);
    }

    /**
     * Modelo de Mie cuyo índice de partícula sale de las constantes ópticas del material,
     * tanto en el punto de la plantilla como en cada punto de un barrido.
     *
     * @param template Petición base; su índice de partícula se ignora.
     * @param material Material con datos ópticos.
     * @throws ValidationException si el material no tiene constantes ópticas.
     */
    public OpticalModel createMieModel(CalculationRequest template, MaterialRecord material) throws ValidationException {
        RefractiveIndex index = material.refractiveIndexAt(template.wavelength())
                .orElseThrow(() -> ValidationException.invalidParameter("material",
                        "'" + material.getName() + "' no tiene constantes ópticas"));
        return new MieModel(template.withParticleIndex(index), config, material);
    }

    public ThermalModel createThermalModel(ThermalRequest request) {
        return new BoundaryScatteringThermalModel(request);
    }

    /**
     * @throws ValidationException si el material no tiene conductividad o camino libre medio.
     */
    public ThermalModel createThermalModel(MaterialRecord material, Nanometers diameter, Kelvin temperature)
            throws ValidationException {
        double kappa = material.getBulkThermalConductivity()
                .orElseThrow(() -> ValidationException.invalidParameter("material",
                        "'" + material.getName() + "' no tiene conductividad térmica masiva"));
        Nanometers meanFreePath = material.getMeanFreePath()
                .orElseThrow(() -> ValidationException.invalidParameter("material",
                        "'" + material.getName() + "' no tiene camino libre medio"));
        return new BoundaryScatteringThermalModel(ThermalRequest.builder()
                .diameter(diameter)
                .temperature(temperature)
                .bulkConductivity(kappa)
                .meanFreePath(meanFreePath)
                .referenceTemperature(Kelvin.of(PhysicalConstants.ROOM_TEMPERATURE))
                .build());
    }

    public ElectronicModel createElectronicModel(ElectronicRequest request) {
        return new BrusElectronicModel(request);
    }

    /**
     * @throws ValidationException si el material no es un semiconductor con parámetros de gap.
     */
    public ElectronicModel createElectronicModel(MaterialRecord material, Nanometers diameter) throws ValidationException {
        BandgapParameters parameters = material.getBandgap()
                .orElseThrow(() -> ValidationException.invalidParameter("material",
                        "'" + material.getName() + "' no tiene parámetros de gap"));
        return new BrusElectronicModel(new ElectronicRequest(diameter, parameters));
    }
}
