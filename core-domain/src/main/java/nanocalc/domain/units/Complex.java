package nanocalc.domain.units;

/**
 * Número complejo inmutable para la aritmética de los coeficientes de Mie.
 * <p>
 * Todas las operaciones devuelven una instancia nueva; es seguro compartirlo entre hilos.
 *
 * @param re Parte real.
 * @param im Parte imaginaria.
 */
public record Complex(double re, double im) {

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);

    public static Complex ofReal(double re) {
        return new Complex(re, 0.0);
    }

    public Complex add(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex add(double value) {
        return new Complex(re + value, im);
    }

    public Complex subtract(Complex other) {
        return new Complex(re - other.re, im - other.im);
    }

    public Complex subtract(double value) {
        return new Complex(re - value, im);
    }

    public Complex multiply(Complex other) {
        return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
    }

    public Complex multiply(double factor) {
        return new Complex(re * factor, im * factor);
    }

    /**
     * División compleja usando el algoritmo de Smith para evitar desbordamientos
     * intermedios cuando uno de los componentes del divisor es muy grande.
     */
    public Complex divide(Complex other) {
        double c = other.re;
        double d = other.im;
        if (Math.abs(c) >= Math.abs(d)) {
            double ratio = d / c;
            double denominator = c + d * ratio;
            return new Complex((re + im * ratio) / denominator, (im - re * ratio) / denominator);
        }
        double ratio = c / d;
        double denominator = c * ratio + d;
        return new Complex((re * ratio + im) / denominator, (im * ratio - re) / denominator);
    }

    public Complex divide(double divisor) {
        return new Complex(re / divisor, im / divisor);
    }

    /**
     * Inverso multiplicativo 1/z.
     */
    public Complex reciprocal() {
        return ONE.divide(this);
    }

    public Complex conjugate() {
        return new Complex(re, -im);
    }

    public Complex negate() {
        return new Complex(-re, -im);
    }

    public double abs() {
        return Math.hypot(re, im);
    }

    /**
     * |z|², sin la raíz cuadrada.
     */
    public double absSquared() {
        return re * re + im * im;
    }

    public boolean isFinite() {
        return Double.isFinite(re) && Double.isFinite(im);
    }

    @Override
    public String toString() {
        return String.format("(%f %s %fi)", re, (im < 0 ? "-" : "+"), Math.abs(im));
    }
}
