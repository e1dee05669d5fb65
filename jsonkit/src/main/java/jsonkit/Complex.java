package jsonkit;

/**
 * Complex number, encoded as {@code {"real": <float>, "imag": <float>}}.
 *
 * @param real real part
 * @param imag imaginary part
 * @since 0.1.0
 */
public record Complex(double real, double imag) {

    public static Complex of(double real, double imag) {
        return new Complex(real, imag);
    }
}
