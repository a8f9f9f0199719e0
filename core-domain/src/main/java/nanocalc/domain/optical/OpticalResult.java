package nanocalc.domain.optical;

import lombok.Builder;
import nanocalc.domain.units.Nanometers;

import java.util.Objects;

/**
 * Resultado inmutable de un cálculo óptico a una única longitud de onda.
 * <p>
 * Las eficiencias son adimensionales; las secciones eficaces están en nm².
 * Se cumple {@code qExt == qSca + qAbs} (conservación de la energía).
 *
 * @param wavelength Longitud de onda a la que corresponde el resultado [nm].
 * @param qSca       Eficiencia de scattering.
 * @param qAbs       Eficiencia de absorción.
 * @param qExt       Eficiencia de extinción.
 * @param cSca       Sección eficaz de scattering [nm²].
 * @param cAbs       Sección eficaz de absorción [nm²].
 * @param cExt       Sección eficaz de extinción [nm²].
 * @param metadata   Parámetro de tamaño, términos usados, convergencia y avisos.
 */
@Builder
public record OpticalResult(
        Nanometers wavelength,
        double qSca,
        double qAbs,
        double qExt,
        double cSca,
        double cAbs,
        double cExt,
        OpticalMetadata metadata
) {
    public OpticalResult {
        Objects.requireNonNull(wavelength, "La longitud de onda no puede ser nula.");
        Objects.requireNonNull(metadata, "Los metadatos no pueden ser nulos.");
    }

    /**
     * Comprobación de conservación: |Q_ext − (Q_sca + Q_abs)|.
     */
    public double conservationError() {
        return Math.abs(qExt - (qSca + qAbs));
    }

    /**
     * Indica si el resultado puede usarse como valor numérico fiable.
     */
    public boolean isConverged() {
        return metadata.converged();
    }
}
