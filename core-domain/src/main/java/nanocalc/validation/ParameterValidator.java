package nanocalc.validation;

import nanocalc.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Acumulador de comprobaciones de rango.
 * <p>
 * Separa los <b>errores</b> (entradas no físicas, se lanzan de inmediato) de los
 * <b>avisos</b> (entradas válidas fuera del régimen bien caracterizado, se acumulan
 * y nunca bloquean el cálculo). Una instancia por validación; no es thread-safe.
 */
public final class ParameterValidator {

    private final List<String> warnings = new ArrayList<>();

    public static ParameterValidator start() {
        return new ParameterValidator();
    }

    /**
     * Exige un número finito (ni NaN ni infinito). Se aplica a los valores en bruto antes
     * de envolverlos en un tipo con unidad.
     */
    public ParameterValidator requireFinite(String parameter, double value) throws ValidationException {
        if (!Double.isFinite(value)) {
            throw ValidationException.outOfRange(parameter, value, -Double.MAX_VALUE, Double.MAX_VALUE);
        }
        return this;
    }

    /**
     * Exige un valor estrictamente positivo.
     */
    public ParameterValidator requirePositive(String parameter, double value) throws ValidationException {
        if (!(value > 0.0) || !Double.isFinite(value)) {
            throw ValidationException.outOfRange(parameter, value, 0.0, Double.POSITIVE_INFINITY);
        }
        return this;
    }

    /**
     * Exige un valor no negativo.
     */
    public ParameterValidator requireNonNegative(String parameter, double value) throws ValidationException {
        if (!(value >= 0.0) || !Double.isFinite(value)) {
            throw ValidationException.outOfRange(parameter, value, 0.0, Double.POSITIVE_INFINITY);
        }
        return this;
    }

    /**
     * Exige un valor dentro del intervalo cerrado [min, max].
     */
    public ParameterValidator requireInRange(String parameter, double value, double min, double max) throws ValidationException {
        if (!(value >= min && value <= max)) {
            throw ValidationException.outOfRange(parameter, value, min, max);
        }
        return this;
    }

    /**
     * Añade un aviso si el valor queda fuera del intervalo abierto (min, max).
     */
    public ParameterValidator warnIfOutside(String parameter, double value, double min, double max) {
        if (!(value > min && value < max)) {
            warnings.add(String.format("%s = %.4g fuera del régimen bien caracterizado (%.4g, %.4g)",
                    parameter, value, min, max));
        }
        return this;
    }

    /**
     * Añade un aviso si el valor supera el umbral indicado.
     */
    public ParameterValidator warnIfAbove(String parameter, double value, double threshold, String detail) {
        if (value > threshold) {
            warnings.add(String.format("%s = %.4g supera %.4g: %s", parameter, value, threshold, detail));
        }
        return this;
    }

    /**
     * Añade un aviso si el valor queda por debajo del umbral indicado.
     */
    public ParameterValidator warnIfBelow(String parameter, double value, double threshold, String detail) {
        if (value < threshold) {
            warnings.add(String.format("%s = %.4g inferior a %.4g: %s", parameter, value, threshold, detail));
        }
        return this;
    }

    public ParameterValidator warn(String message) {
        warnings.add(message);
        return this;
    }

    public ValidationReport report() {
        return ValidationReport.of(warnings);
    }
}
