package nanocalc.domain.units;

/**
 * Temperatura absoluta en kelvin.
 *
 * @param value La temperatura [K]. Debe ser un número finito.
 */
public record Kelvin(double value) implements Comparable<Kelvin> {

    private static final double CELSIUS_OFFSET = 273.15;

    public Kelvin {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("La temperatura debe ser un número finito: " + value);
        }
    }

    public static Kelvin of(double value) {
        return new Kelvin(value);
    }

    public static Kelvin fromCelsius(double celsius) {
        return new Kelvin(celsius + CELSIUS_OFFSET);
    }

    public double toCelsius() {
        return value - CELSIUS_OFFSET;
    }

    @Override
    public int compareTo(Kelvin other) {
        return Double.compare(value, other.value);
    }

    @Override
    public String toString() {
        return value + " K";
    }
}
