package nanocalc.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resultado de una validación superada: no contiene errores (esos se lanzan como
 * {@link nanocalc.exception.ValidationException}), solo los avisos no fatales que
 * acompañarán al resultado en sus metadatos.
 */
public final class ValidationReport {

    private static final ValidationReport CLEAN = new ValidationReport(List.of());

    private final List<String> warnings;

    private ValidationReport(List<String> warnings) {
        this.warnings = warnings;
    }

    public static ValidationReport clean() {
        return CLEAN;
    }

    public static ValidationReport of(List<String> warnings) {
        return warnings.isEmpty() ? CLEAN : new ValidationReport(List.copyOf(warnings));
    }

    /**
     * Lista inmutable de avisos, en el orden en que se detectaron.
     */
    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Combina los avisos de este informe con otros adicionales, conservando el orden.
     */
    public ValidationReport withAdditional(List<String> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(extra);
        return new ValidationReport(Collections.unmodifiableList(merged));
    }

    @Override
    public String toString() {
        return "ValidationReport" + warnings;
    }
}
