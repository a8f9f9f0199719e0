package nanocalc.domain.material;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import nanocalc.domain.units.RefractiveIndex;

/**
 * Entrada tabulada de constantes ópticas: n + ik a una longitud de onda.
 *
 * @param wavelength Longitud de onda [nm].
 * @param n          Parte real del índice.
 * @param k          Coeficiente de extinción.
 */
public record OpticalConstant(double wavelength, double n, double k) {

    @JsonCreator
    public OpticalConstant(@JsonProperty("wavelength") double wavelength,
                           @JsonProperty("n") double n,
                           @JsonProperty("k") double k) {
        this.wavelength = wavelength;
        this.n = n;
        this.k = k;
    }

    public RefractiveIndex toIndex() {
        return RefractiveIndex.of(n, k);
    }
}
