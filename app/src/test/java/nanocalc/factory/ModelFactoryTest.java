package nanocalc.factory;

import nanocalc.config.EngineConfig;
import nanocalc.domain.material.BandgapParameters;
import nanocalc.domain.material.MaterialRecord;
import nanocalc.domain.material.OpticalConstant;
import nanocalc.domain.optical.CalculationRequest;
import nanocalc.domain.units.Kelvin;
import nanocalc.domain.units.Nanometers;
import nanocalc.domain.units.RefractiveIndex;
import nanocalc.exception.ValidationException;
import nanocalc.physics.i.ElectronicModel;
import nanocalc.physics.i.OpticalModel;
import nanocalc.physics.i.ThermalModel;
import nanocalc.physics.model.BoundaryScatteringThermalModel;
import nanocalc.physics.model.MieModel;
import nanocalc.physics.model.RayleighModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelFactoryTest {

    private final ModelFactory factory = new ModelFactory(EngineConfig.defaults());
    private final CalculationRequest template = CalculationRequest.of(20, 550, RefractiveIndex.real(1.0), 1.0);

    private final MaterialRecord gold = new MaterialRecord("Gold", List.of("Au"),
            List.of(new OpticalConstant(500, 0.97, 1.87), new OpticalConstant(550, 0.43, 2.46)),
            318.0, 37.7, null);
    private final MaterialRecord cdse = new MaterialRecord("CdSe", null, null, 9.0, null,
            new BandgapParameters(1.74, 0.13, 0.45, 10.6));

    @Test
    @DisplayName("Modelos ópticos explícitos")
    void createOpticalModels_shouldWrapRequest() {
        OpticalModel mie = factory.createMieModel(template);
        OpticalModel rayleigh = factory.createRayleighModel(template);

        assertInstanceOf(MieModel.class, mie);
        assertInstanceOf(RayleighModel.class, rayleigh);
        assertEquals(template, ((MieModel) mie).getRequest());
    }

    @Test
    @DisplayName("Mie de material: el índice de la plantilla se sustituye por el del material")
    void createMieModel_forMaterial_shouldResolveIndex() throws ValidationException {
        MieModel model = (MieModel) factory.createMieModel(template, gold);

        assertEquals(RefractiveIndex.of(0.43, 2.46), model.getRequest().particleIndex());
        assertEquals(RefractiveIndex.of(0.97, 1.87), model.atSweepPoint(500).getRequest().particleIndex());
    }

    @Test
    @DisplayName("Datos ausentes en el material: INVALID_PARAMETER")
    void createFromMaterial_missingData_shouldFail() {
        ValidationException optical = assertThrows(ValidationException.class,
                () -> factory.createMieModel(template, cdse));
        ValidationException thermal = assertThrows(ValidationException.class,
                () -> factory.createThermalModel(cdse, Nanometers.of(10), Kelvin.of(300)));
        ValidationException electronic = assertThrows(ValidationException.class,
                () -> factory.createElectronicModel(gold, Nanometers.of(5)));

        assertEquals(ValidationException.Reason.INVALID_PARAMETER, optical.getReason());
        assertTrue(thermal.getMessage().contains("camino libre medio"));
        assertEquals(ValidationException.Reason.INVALID_PARAMETER, electronic.getReason());
    }

    @Test
    @DisplayName("Modelos térmico y electrónico desde el material")
    void createFromMaterial_shouldCopyProperties() throws ValidationException {
        ThermalModel thermal = factory.createThermalModel(gold, Nanometers.of(30), Kelvin.of(250));
        ElectronicModel electronic = factory.createElectronicModel(cdse, Nanometers.of(4));

        BoundaryScatteringThermalModel concrete = (BoundaryScatteringThermalModel) thermal;
        assertEquals(318.0, concrete.getRequest().bulkConductivity());
        assertEquals(37.7, concrete.getRequest().meanFreePath().value());
        assertEquals(300.0, concrete.getRequest().referenceTemperature().value());
        assertEquals("diameter", electronic.getSweepVariable());
    }
}
