package nanocalc.domain.material;

import java.util.Optional;

/**
 * Capacidad externa de consulta de materiales.
 * <p>
 * El núcleo la consume para los modelos que necesitan propiedades de referencia del
 * material masivo en lugar de índices de refracción proporcionados directamente.
 */
@FunctionalInterface
public interface MaterialLookup {

    /**
     * @param name Nombre o alias del material (sin distinguir mayúsculas).
     * @return El registro, o vacío si el material no se conoce.
     */
    Optional<MaterialRecord> lookupMaterial(String name);
}
