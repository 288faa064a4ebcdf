package solcore.config;

/**
 * Closed physical range [lower, upper] of a model input.
 */
public record Bounds(double lower, double upper) {

    public Bounds {
        if (upper < lower) throw new IllegalArgumentException("upper < lower: " + lower + ".." + upper);
    }

    /** Clips v into the range; NaN passes through unchanged. */
    public double clip(double v) {
        if (v < lower) return lower;
        if (v > upper) return upper;
        return v;
    }

    public double[] clipAll(double[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = clip(values[i]);
        }
        return out;
    }
}
