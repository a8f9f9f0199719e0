package nanocalc.domain.units;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Índice de refracción complejo n + ik.
 * <p>
 * Representa la respuesta óptica de la partícula o del medio a una longitud de onda.
 * Convenio de signos: la parte imaginaria (coeficiente de extinción k) es no negativa
 * para un material pasivo; la capa de validación rechaza valores negativos.
 *
 * @param real      Parte real n.
 * @param imaginary Coeficiente de extinción k.
 */
public record RefractiveIndex(double real, double imaginary) {

    @JsonCreator
    public RefractiveIndex(@JsonProperty("n") double real, @JsonProperty("k") double imaginary) {
        if (!Double.isFinite(real) || !Double.isFinite(imaginary)) {
            throw new IllegalArgumentException("El índice de refracción debe ser finito: " + real + " + " + imaginary + "i");
        }
        this.real = real;
        this.imaginary = imaginary;
    }

    public static RefractiveIndex of(double n, double k) {
        return new RefractiveIndex(n, k);
    }

    public static RefractiveIndex real(double n) {
        return new RefractiveIndex(n, 0.0);
    }

    public Complex toComplex() {
        return new Complex(real, imaginary);
    }

    /**
     * Permitividad relativa ε = (n + ik)².
     */
    public Complex toPermittivity() {
        Complex n = toComplex();
        return n.multiply(n);
    }

    /**
     * Interpolación lineal componente a componente entre dos índices.
     *
     * @param other    Índice en el extremo superior.
     * @param fraction Posición relativa en [0, 1].
     */
    public RefractiveIndex interpolate(RefractiveIndex other, double fraction) {
        return new RefractiveIndex(
                real + (other.real - real) * fraction,
                imaginary + (other.imaginary - imaginary) * fraction);
    }

    @Override
    public String toString() {
        return String.format("%.4f + %.4fi", real, imaginary);
    }
}
