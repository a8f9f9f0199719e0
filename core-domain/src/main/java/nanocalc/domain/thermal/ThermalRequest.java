package nanocalc.domain.thermal;

import lombok.Builder;
import lombok.With;
import nanocalc.config.PhysicalConstants;
import nanocalc.domain.units.Kelvin;
import nanocalc.domain.units.Nanometers;

import java.util.Objects;

/**
 * Parámetros del cálculo de conductividad térmica efectiva de una nanopartícula.
 *
 * @param diameter                 Diámetro de la partícula [nm].
 * @param temperature              Temperatura de evaluación [K].
 * @param bulkConductivity         Conductividad del material masivo a la temperatura de referencia [W/(m·K)].
 * @param meanFreePath             Camino libre medio de los portadores a la temperatura de referencia [nm].
 * @param referenceTemperature     Temperatura a la que se tabularon los dos valores anteriores [K].
 */
@Builder
@With
public record ThermalRequest(
        Nanometers diameter,
        Kelvin temperature,
        double bulkConductivity,
        Nanometers meanFreePath,
        Kelvin referenceTemperature
) {
    public ThermalRequest {
        Objects.requireNonNull(diameter, "El diámetro no puede ser nulo.");
        Objects.requireNonNull(temperature, "La temperatura no puede ser nula.");
        Objects.requireNonNull(meanFreePath, "El camino libre medio no puede ser nulo.");
        if (referenceTemperature == null) {
            referenceTemperature = Kelvin.of(PhysicalConstants.ROOM_TEMPERATURE);
        }
    }

    public static ThermalRequest atRoomTemperature(double diameterNm, double bulkConductivity, double meanFreePathNm) {
        Kelvin room = Kelvin.of(PhysicalConstants.ROOM_TEMPERATURE);
        return new ThermalRequest(Nanometers.of(diameterNm), room, bulkConductivity, Nanometers.of(meanFreePathNm), room);
    }
}
