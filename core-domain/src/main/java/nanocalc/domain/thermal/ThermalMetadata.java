package nanocalc.domain.thermal;

import java.util.List;

/**
 * @param knudsenNumber Relación Λ/d a la temperatura evaluada.
 * @param regime        Régimen de transporte dominante.
 * @param notes         Avisos y notas del modelo.
 */
public record ThermalMetadata(
        double knudsenNumber,
        ThermalTransportRegime regime,
        List<String> notes
) {
    public ThermalMetadata {
        notes = (notes == null) ? List.of() : List.copyOf(notes);
    }
}
