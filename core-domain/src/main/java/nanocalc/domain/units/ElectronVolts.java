package nanocalc.domain.units;

import nanocalc.config.PhysicalConstants.Conversions;

/**
 * Energía expresada en electronvoltios.
 *
 * @param value La energía [eV].
 */
public record ElectronVolts(double value) {

    public ElectronVolts {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("La energía debe ser un número finito: " + value);
        }
    }

    public static ElectronVolts of(double value) {
        return new ElectronVolts(value);
    }

    public static ElectronVolts fromJoules(double joules) {
        return new ElectronVolts(joules * Conversions.J_TO_EV);
    }

    /**
     * Energía del fotón asociado a una longitud de onda en el vacío, E = hc/λ.
     */
    public static ElectronVolts photonEnergy(Nanometers wavelength) {
        if (!wavelength.isPositive()) {
            throw new IllegalArgumentException("La longitud de onda debe ser positiva: " + wavelength);
        }
        return new ElectronVolts(Conversions.HC_EV_NM / wavelength.value());
    }

    public double toJoules() {
        return value * Conversions.EV_TO_J;
    }

    @Override
    public String toString() {
        return value + " eV";
    }
}
