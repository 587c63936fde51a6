package differentiator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

final class ComplexAssertions {
    static final double EPS = 1e-9;

    private ComplexAssertions() {}

    static void assertClose(Complex actual, double real, double imag) {
        assertThat(actual.real).as("real part of %s", actual).isCloseTo(real, within(EPS));
        assertThat(actual.imag).as("imaginary part of %s", actual).isCloseTo(imag, within(EPS));
    }

    static void assertClose(Complex actual, Complex expected) {
        assertClose(actual, expected.real, expected.imag);
    }

    /** relative comparison for values of arbitrary magnitude */
    static void assertRelativelyClose(Complex actual, Complex expected, double tolerance) {
        double scale = Math.max(1.0, expected.abs());
        assertThat(actual.subtract(expected).abs() / scale)
            .as("%s vs %s", actual, expected)
            .isLessThan(tolerance);
    }
}
