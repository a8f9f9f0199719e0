package nanocalc.domain.optical;

import lombok.Builder;
import lombok.With;
import nanocalc.domain.units.Nanometers;
import nanocalc.domain.units.RefractiveIndex;

import java.util.Objects;

/**
 * Unidad atómica de trabajo del cálculo óptico.
 * <p>
 * Objeto de valor sin identidad más allá de sus campos: dos peticiones con los mismos
 * parámetros son iguales y se usan directamente como clave de la caché de resultados.
 * La validez física (radio y longitud de onda positivos, etc.) no se comprueba aquí,
 * sino en la capa de validación, para que esos casos lleguen como
 * {@link nanocalc.exception.ValidationException} y no como errores de programación.
 *
 * @param radius        Radio de la esfera [nm].
 * @param wavelength    Longitud de onda incidente en el vacío [nm].
 * @param particleIndex Índice de refracción complejo de la partícula.
 * @param mediumIndex   Índice de refracción (real) del medio circundante.
 */
@Builder
@With
public record CalculationRequest(
        Nanometers radius,
        Nanometers wavelength,
        RefractiveIndex particleIndex,
        double mediumIndex
) {
    public CalculationRequest {
        Objects.requireNonNull(radius, "El radio no puede ser nulo.");
        Objects.requireNonNull(wavelength, "La longitud de onda no puede ser nula.");
        Objects.requireNonNull(particleIndex, "El índice de la partícula no puede ser nulo.");
    }

    public static CalculationRequest of(double radiusNm, double wavelengthNm, RefractiveIndex particleIndex, double mediumIndex) {
        return new CalculationRequest(Nanometers.of(radiusNm), Nanometers.of(wavelengthNm), particleIndex, mediumIndex);
    }

    /**
     * Parámetro de tamaño x = 2π·r/λ, recalculado siempre a partir de los campos.
     */
    public double sizeParameter() {
        return 2.0 * Math.PI * radius.value() / wavelength.value();
    }

    public CalculationRequest withWavelengthNm(double wavelengthNm) {
        return withWavelength(Nanometers.of(wavelengthNm));
    }
}
