package nanocalc.domain.optical;

import java.util.List;

/**
 * Metadatos del cálculo óptico.
 *
 * @param sizeParameter Parámetro de tamaño x = 2π·r/λ usado en la serie.
 * @param termsUsed     Número de términos de la serie efectivamente sumados.
 * @param converged     {@code false} si se agotó n_max sin cumplir el criterio de truncamiento.
 *                      Un resultado no convergido no debe tratarse como fiable.
 * @param warnings      Avisos no fatales en orden de aparición.
 */
public record OpticalMetadata(
        double sizeParameter,
        int termsUsed,
        boolean converged,
        List<String> warnings
) {
    public OpticalMetadata {
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
    }
}
