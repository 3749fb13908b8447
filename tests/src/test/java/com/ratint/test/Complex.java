package com.ratint.test;

/**
 * Double-precision complex number for numeric cross-checks of exact results.
 */
public record Complex(double re, double im) {

    public static final Complex ZERO = new Complex(0, 0);
    public static final Complex ONE = new Complex(1, 0);
    public static final Complex I = new Complex(0, 1);

    public static Complex of(double re) {
        return new Complex(re, 0);
    }

    public Complex add(Complex o) {
        return new Complex(re + o.re, im + o.im);
    }

    public Complex subtract(Complex o) {
        return new Complex(re - o.re, im - o.im);
    }

    public Complex multiply(Complex o) {
        return new Complex(re * o.re - im * o.im, re * o.im + im * o.re);
    }

    public Complex divide(Complex o) {
        double d = o.re * o.re + o.im * o.im;
        return new Complex((re * o.re + im * o.im) / d, (im * o.re - re * o.im) / d);
    }

    public Complex negate() {
        return new Complex(-re, -im);
    }

    public double abs() {
        return Math.hypot(re, im);
    }

    public Complex log() {
        return new Complex(Math.log(abs()), Math.atan2(im, re));
    }

    public Complex exp() {
        double m = Math.exp(re);
        return new Complex(m * Math.cos(im), m * Math.sin(im));
    }

    public Complex pow(int n) {
        Complex base = n < 0 ? ONE.divide(this) : this;
        Complex result = ONE;
        for (int k = 0; k < Math.abs(n); k++) {
            result = result.multiply(base);
        }
        return result;
    }

    public Complex pow(Complex exponent) {
        if (re == 0 && im == 0) {
            return ZERO;
        }
        return exponent.multiply(log()).exp();
    }

    /** {@code atan(z) = (I/2) * (log(1 - I*z) - log(1 + I*z))}. */
    public Complex atan() {
        Complex iz = I.multiply(this);
        Complex diff = ONE.subtract(iz).log().subtract(ONE.add(iz).log());
        return new Complex(0, 0.5).multiply(diff);
    }

    public boolean isClose(Complex o, double tolerance) {
        double scale = Math.max(1.0, Math.max(abs(), o.abs()));
        return subtract(o).abs() <= tolerance * scale;
    }

    @Override
    public String toString() {
        return re + (im < 0 ? " - " : " + ") + Math.abs(im) + "i";
    }
}
