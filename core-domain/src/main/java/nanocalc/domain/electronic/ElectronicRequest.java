package nanocalc.domain.electronic;

import lombok.With;
import nanocalc.domain.material.BandgapParameters;
import nanocalc.domain.units.Nanometers;

import java.util.Objects;

/**
 * @param diameter   Diámetro de la partícula [nm].
 * @param parameters Parámetros del semiconductor masivo.
 */
@With
public record ElectronicRequest(Nanometers diameter, BandgapParameters parameters) {

    public ElectronicRequest {
        Objects.requireNonNull(diameter, "El diámetro no puede ser nulo.");
        Objects.requireNonNull(parameters, "Los parámetros del semiconductor no pueden ser nulos.");
    }

    public static ElectronicRequest of(double diameterNm, BandgapParameters parameters) {
        return new ElectronicRequest(Nanometers.of(diameterNm), parameters);
    }

    public Nanometers radius() {
        return diameter.times(0.5);
    }
}
