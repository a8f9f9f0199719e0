package nanocalc.exception;

import lombok.Getter;

/**
 * Error fatal de validación: los parámetros de entrada no son físicos y el cálculo
 * no llega a empezar.
 */
@Getter
public class ValidationException extends CalculationException {

    /**
     * Naturaleza del fallo de validación.
     */
    public enum Reason {
        /** Un parámetro numérico cae fuera de [min, max]. */
        OUT_OF_RANGE,
        /** Un parámetro no tiene un valor utilizable (material desconocido, etc.). */
        INVALID_PARAMETER,
        /** La combinación de parámetros viola una restricción física. */
        PHYSICS_VIOLATION
    }

    private final Reason reason;
    private final String parameter;
    private final double value;
    private final double min;
    private final double max;

    private ValidationException(Reason reason, String parameter, double value, double min, double max, String message) {
        super(message);
        this.reason = reason;
        this.parameter = parameter;
        this.value = value;
        this.min = min;
        this.max = max;
    }

    public static ValidationException outOfRange(String parameter, double value, double min, double max) {
        return new ValidationException(Reason.OUT_OF_RANGE, parameter, value, min, max,
                String.format("El parámetro '%s' = %s está fuera del rango válido [%s, %s]", parameter, value, min, max));
    }

    public static ValidationException invalidParameter(String parameter, String detail) {
        return new ValidationException(Reason.INVALID_PARAMETER, parameter, Double.NaN, Double.NaN, Double.NaN,
                String.format("Parámetro inválido '%s': %s", parameter, detail));
    }

    public static ValidationException physicsViolation(String parameter, double value, String detail) {
        return new ValidationException(Reason.PHYSICS_VIOLATION, parameter, value, Double.NaN, Double.NaN,
                String.format("Restricción física violada por '%s' = %s: %s", parameter, value, detail));
    }
}
