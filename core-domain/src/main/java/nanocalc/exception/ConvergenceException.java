package nanocalc.exception;

import lombok.Getter;

/**
 * La serie no satisfizo el criterio de truncamiento antes de agotar el número
 * máximo de términos.
 */
@Getter
public class ConvergenceException extends CalculationException {

    private final int termsAttempted;

    public ConvergenceException(int termsAttempted) {
        super("La serie no convergió tras " + termsAttempted + " términos");
        this.termsAttempted = termsAttempted;
    }
}
