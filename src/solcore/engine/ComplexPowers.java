package solcore.engine;

import org.apache.commons.math3.complex.Complex;

/**
 * Fractional powers evaluated on the principal complex branch.
 * Negative or near-zero bases give a finite real magnitude instead of NaN.
 */
public final class ComplexPowers {

    private ComplexPowers() {}

    /** |base^exponent| with base promoted to complex. */
    public static double absPow(double base, double exponent) {
        return pow(new Complex(base), exponent).abs();
    }

    /**
     * Empirical air mass |(cos z + a Z^b / (c - Z)^d)^-1| · scale, Z in degrees.
     */
    public static double airMass(double zenithRad, double a, double b, double c, double d, double scale) {
        Complex zDeg = new Complex(Math.toDegrees(zenithRad));
        Complex term = pow(zDeg, b)
                .multiply(a)
                .divide(pow(new Complex(c).subtract(zDeg), d));
        return term.add(Math.cos(zenithRad))
                .reciprocal()
                .multiply(scale)
                .abs();
    }

    /**
     * Principal value of base^x. Complex.pow goes through log(0) = -inf and returns NaN
     * for a zero base, so 0^x and x = 0 are resolved here.
     */
    static Complex pow(Complex base, double x) {
        if (x == 0.0) return Complex.ONE;
        if (base.getReal() == 0.0 && base.getImaginary() == 0.0) {
            return x > 0 ? Complex.ZERO : Complex.INF;
        }
        return base.pow(x);
    }
}
