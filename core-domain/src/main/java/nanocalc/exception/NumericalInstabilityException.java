package nanocalc.exception;

import lombok.Getter;

/**
 * Se produjo un valor intermedio no finito o inutilizable. El resultado se descarta
 * en lugar de devolverse contaminado.
 */
@Getter
public class NumericalInstabilityException extends CalculationException {

    private final String description;

    public NumericalInstabilityException(String description) {
        super("Inestabilidad numérica detectada: " + description);
        this.description = description;
    }
}
