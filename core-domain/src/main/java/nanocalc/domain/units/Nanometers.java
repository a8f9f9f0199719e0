package nanocalc.domain.units;

import nanocalc.config.PhysicalConstants.Conversions;

/**
 * Longitud expresada en nanómetros.
 * <p>
 * Tipo semántico propio para que radios y longitudes de onda no se mezclen con
 * magnitudes de otra naturaleza. Las conversiones son siempre explícitas.
 *
 * @param value La longitud [nm]. Debe ser un número finito.
 */
public record Nanometers(double value) implements Comparable<Nanometers> {

    public Nanometers {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("La longitud debe ser un número finito: " + value);
        }
    }

    public static Nanometers of(double value) {
        return new Nanometers(value);
    }

    public static Nanometers fromMeters(double meters) {
        return new Nanometers(meters * Conversions.M_TO_NM);
    }

    public double toMeters() {
        return value * Conversions.NM_TO_M;
    }

    public double toMicrometers() {
        return value * Conversions.NM_TO_UM;
    }

    public Nanometers times(double factor) {
        return new Nanometers(value * factor);
    }

    public boolean isPositive() {
        return value > 0.0;
    }

    @Override
    public int compareTo(Nanometers other) {
        return Double.compare(value, other.value);
    }

    @Override
    public String toString() {
        return value + " nm";
    }
}
