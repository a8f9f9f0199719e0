package nanocalc.exception;

/**
 * Raíz de la taxonomía de errores del núcleo de cálculo.
 * <p>
 * Es una excepción comprobada: cualquier operación que pueda fallar por parámetros
 * no físicos o por problemas numéricos lo declara en su firma, y el llamador decide
 * cómo presentarlo. El núcleo no formatea mensajes para el usuario final.
 */
public abstract class CalculationException extends Exception {

    protected CalculationException(String message) {
        super(message);
    }

    protected CalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
