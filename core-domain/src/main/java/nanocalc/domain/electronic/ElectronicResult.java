package nanocalc.domain.electronic;

import lombok.Builder;
import nanocalc.domain.units.ElectronVolts;
import nanocalc.domain.units.Nanometers;

/**
 * Resultado inmutable del cálculo de gap dependiente del tamaño.
 *
 * @param diameter           Diámetro evaluado [nm].
 * @param bandgap            Gap de la nanopartícula.
 * @param bulkBandgap        Gap del material masivo, para comparación.
 * @param confinementEnergy  Contribución de confinamiento (positiva).
 * @param coulombCorrection  Corrección coulombiana (negativa).
 * @param excitonBohrRadius  Radio de Bohr del excitón [nm].
 * @param regime             Régimen de confinamiento.
 * @param metadata           Masa reducida, dieléctrico, modelo y notas.
 */
@Builder
public record ElectronicResult(
        Nanometers diameter,
        ElectronVolts bandgap,
        ElectronVolts bulkBandgap,
        ElectronVolts confinementEnergy,
        ElectronVolts coulombCorrection,
        Nanometers excitonBohrRadius,
        ConfinementRegime regime,
        ElectronicMetadata metadata
) {
    /**
     * Desplazamiento del gap respecto al masivo (blue shift si es positivo).
     */
    public double blueShiftEv() {
        return bandgap.value() - bulkBandgap.value();
    }
}
