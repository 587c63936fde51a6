package differentiator;

import java.util.Locale;

/**
 * Immutable complex number with the arithmetic and principal-branch elementary
 * functions needed to evaluate expression trees.
 * Undefined points (division by zero, log at zero, poles) yield IEEE infinities or NaN,
 * nothing here throws.
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0, 0);
    public static final Complex ONE = new Complex(1, 0);
    public static final Complex I = new Complex(0, 1);

    public final double real;
    public final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    public static Complex ofReal(double real) {
        return new Complex(real, 0);
    }

    public Complex add(Complex other) {
        return new Complex(this.real + other.real, this.imag + other.imag);
    }

    public Complex subtract(Complex other) {
        return new Complex(this.real - other.real, this.imag - other.imag);
    }

    public Complex multiply(Complex other) {
        double r = this.real * other.real - this.imag * other.imag;
        double i = this.real * other.imag + this.imag * other.real;
        return new Complex(r, i);
    }

    /**
     * Smith's division: scales by the larger part of the divisor, so quotients stay finite
     * wherever the result is representable
     */
    public Complex divide(Complex other) {
        double c = other.real, d = other.imag;
        if (c == 0 && d == 0) {
            double inf = Math.copySign(Double.POSITIVE_INFINITY, c);
            return new Complex(inf * real, inf * imag);
        }
        if (Math.abs(c) >= Math.abs(d)) {
            double ratio = d / c;
            double denom = c + d * ratio;
            return new Complex((real + imag * ratio) / denom, (imag - real * ratio) / denom);
        }
        double ratio = c / d;
        double denom = c * ratio + d;
        return new Complex((real * ratio + imag) / denom, (imag * ratio - real) / denom);
    }

    public Complex negate() {
        return new Complex(-this.real, -this.imag);
    }

    public double abs() {
        return Math.hypot(this.real, this.imag);
    }

    /** argument in (-pi, pi] */
    public double phase() {
        return Math.atan2(imag, real);
    }

    public boolean isZero() {
        return real == 0 && imag == 0;
    }

    public boolean isNaN() {
        return Double.isNaN(real) || Double.isNaN(imag);
    }

    public Complex exp() {
        double m = Math.exp(real);
        return new Complex(m * Math.cos(imag), m * Math.sin(imag));
    }

    /**
     * principal natural logarithm, imaginary part in (-pi, pi]
     */
    public Complex log() {
        return new Complex(Math.log(abs()), phase());
    }

    /**
     * principal power {@code exp(exponent * log(this))}; a zero base gives zero for exponents
     * with positive real part, infinity or NaN otherwise
     */
    public Complex pow(Complex exponent) {
        if (isZero() && exponent.real > 0) return ZERO;
        return exponent.multiply(log()).exp();
    }

    public Complex sin() {
        return new Complex(Math.sin(real) * Math.cosh(imag), Math.cos(real) * Math.sinh(imag));
    }

    public Complex cos() {
        return new Complex(Math.cos(real) * Math.cosh(imag), -Math.sin(real) * Math.sinh(imag));
    }

    public Complex tan() {
        double twoRe = 2 * real, twoIm = 2 * imag;
        double d = Math.cos(twoRe) + Math.cosh(twoIm);
        // far off the real axis tan tends to +-i
        if (Double.isInfinite(d)) return new Complex(0, Math.signum(imag));
        return new Complex(Math.sin(twoRe) / d, Math.sinh(twoIm) / d);
    }

    public Complex cot() {
        return ONE.divide(tan());
    }

    /**
     * {@code (re,im)} with six significant digits and no trailing zeros, e.g. {@code (-32,32)}
     */
    @Override
    public String toString() {
        return "(" + formatPart(real) + "," + formatPart(imag) + ")";
    }

    private static String formatPart(double v) {
        if (Double.isNaN(v)) return "nan";
        if (Double.isInfinite(v)) return v > 0 ? "inf" : "-inf";
        var s = String.format(Locale.ROOT, "%.6g", v);
        int e = s.indexOf('e');
        var mantissa = e < 0 ? s : s.substring(0, e);
        var exponent = e < 0 ? "" : s.substring(e);
        // %g pads with zeros
        if (mantissa.indexOf('.') >= 0) {
            mantissa = mantissa.replaceAll("0+$", "").replaceAll("\\.$", "");
        }
        return mantissa + exponent;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(real, other.real) == 0 && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imag);
    }
}
