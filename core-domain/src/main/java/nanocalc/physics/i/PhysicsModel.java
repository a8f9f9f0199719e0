package nanocalc.physics.i;

import nanocalc.exception.CalculationException;
import nanocalc.exception.ValidationException;
import nanocalc.validation.ValidationReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contrato común de cualquier modelo físico (óptico, térmico, electrónico).
 * <p>
 * El motor de cálculo trabaja exclusivamente contra esta interfaz, sin inspeccionar la
 * identidad concreta del modelo. Se añaden modelos nuevos implementándola; el código
 * existente no se modifica.
 * <p>
 * Las implementaciones son inmutables: {@link #atSweepPoint(double)} devuelve una copia,
 * por lo que pueden evaluarse en paralelo sin sincronización.
 *
 * @param <R> Forma del resultado del dominio.
 */
public interface PhysicsModel<R> {

    /**
     * Nombre corto del modelo (ej: "Mie", "Brus").
     */
    String getName();

    /**
     * Descripción de lo que calcula el modelo.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }

    /**
     * Comprueba los parámetros antes de calcular.
     *
     * @return Los avisos no fatales detectados.
     * @throws ValidationException si algún parámetro no es físico.
     */
    ValidationReport validate() throws ValidationException;

    /**
     * Indica si el modelo puede aplicarse con sus parámetros actuales.
     */
    default boolean isApplicable() {
        try {
            validate();
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * Avisos no fatales sobre los parámetros actuales.
     *
     * @throws ValidationException si los parámetros ni siquiera son válidos.
     */
    default List<String> warnings() throws ValidationException {
        return validate().getWarnings();
    }

    /**
     * Calcula el resultado en el punto actual. Valida los parámetros antes de empezar.
     */
    R compute() throws CalculationException;

    /**
     * Nombre de la variable que recorre un barrido (ej: "wavelength").
     */
    String getSweepVariable();

    /**
     * Copia del modelo con la variable de barrido sustituida por {@code value}.
     */
    PhysicsModel<R> atSweepPoint(double value);

    /**
     * Evalúa el modelo en cada punto del barrido, secuencialmente y en orden.
     * El motor de cálculo ofrece la versión paralela de esta misma operación.
     *
     * @param inputs Valores de la variable de barrido.
     * @return Un resultado por entrada, con el mismo índice.
     * @throws CalculationException el primer error encontrado aborta el barrido.
     */
    default List<R> computeSpectrum(double[] inputs) throws CalculationException {
        List<R> results = new ArrayList<>(inputs.length);
        for (double input : inputs) {
            results.add(atSweepPoint(input).compute());
        }
        return results;
    }

    /**
     * Clave canónica del cálculo (todos los parámetros que lo definen).
     * Vacía si el modelo no admite caché.
     */
    default Optional<CacheKey> cacheKey() {
        return Optional.empty();
    }
}
