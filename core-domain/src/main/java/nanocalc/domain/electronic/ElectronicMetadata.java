package nanocalc.domain.electronic;

import java.util.List;

/**
 * @param reducedMass        Masa reducida del excitón (en unidades de m_e).
 * @param dielectricConstant Constante dieléctrica relativa usada.
 * @param modelType          Modelo aplicado (p. ej. "Brus").
 * @param notes              Avisos y notas del modelo.
 */
public record ElectronicMetadata(
        double reducedMass,
        double dielectricConstant,
        String modelType,
        List<String> notes
) {
    public ElectronicMetadata {
        notes = (notes == null) ? List.of() : List.copyOf(notes);
    }
}
