package nanocalc.domain.optical;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Petición de barrido espectral: una plantilla más una secuencia ordenada de
 * longitudes de onda. El resultado i-ésimo corresponde a {@code wavelengths[i]}.
 *
 * @param template     Petición base; su longitud de onda se sustituye en cada punto.
 * @param wavelengths  Longitudes de onda [nm], en el orden deseado de salida.
 * @param materialName Material opcional; si existe, el índice de la partícula se toma
 *                     de sus constantes ópticas en cada longitud de onda.
 */
public record SpectrumRequest(
        CalculationRequest template,
        double[] wavelengths,
        String materialName
) {
    public SpectrumRequest {
        Objects.requireNonNull(template, "La plantilla no puede ser nula.");
        Objects.requireNonNull(wavelengths, "El array de longitudes de onda no puede ser nulo.");
        wavelengths = wavelengths.clone();
    }

    public static SpectrumRequest of(CalculationRequest template, double[] wavelengths) {
        return new SpectrumRequest(template, wavelengths, null);
    }

    public static SpectrumRequest forMaterial(CalculationRequest template, double[] wavelengths, String materialName) {
        return new SpectrumRequest(template, wavelengths, Objects.requireNonNull(materialName));
    }

    /**
     * Rejilla uniforme [from, to] con el paso indicado, ambos extremos incluidos si caen en la rejilla.
     */
    public static double[] uniformGrid(double fromNm, double toNm, double stepNm) {
        if (stepNm <= 0 || toNm < fromNm) {
            throw new IllegalArgumentException("Rejilla inválida: [" + fromNm + ", " + toNm + "] paso " + stepNm);
        }
        int count = (int) Math.floor((toNm - fromNm) / stepNm + 1e-9) + 1;
        double[] grid = new double[count];
        for (int i = 0; i < count; i++) {
            grid[i] = fromNm + i * stepNm;
        }
        return grid;
    }

    @Override
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    public int size() {
        return wavelengths.length;
    }

    public Optional<String> material() {
        return Optional.ofNullable(materialName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpectrumRequest that = (SpectrumRequest) o;
        return template.equals(that.template)
                && Arrays.equals(wavelengths, that.wavelengths)
                && Objects.equals(materialName, that.materialName);
    }

    @Override
    public int hashCode() {
        int result = template.hashCode();
        result = 31 * result + Arrays.hashCode(wavelengths);
        result = 31 * result + Objects.hashCode(materialName);
        return result;
    }

    @Override
    public String toString() {
        return "SpectrumRequest[template=" + template + ", points=" + wavelengths.length
                + ", material=" + materialName + "]";
    }
}
