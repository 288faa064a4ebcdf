package solcore.engine.metrics;

/**
 * Error statistics of predicted against measured values.
 * Errors are predicted - measured; timesteps whose error is NaN are skipped.
 * With no valid timestep every statistic is NaN.
 */
public final class ErrorMetrics {

    private ErrorMetrics() {}

    public static double[] errors(double[] predicted, double[] measured) {
        if (predicted.length != measured.length) {
            throw new IllegalArgumentException(
                    "predicted/measured length mismatch: " + predicted.length + " != " + measured.length);
        }
        double[] e = new double[predicted.length];
        for (int i = 0; i < e.length; i++) {
            e[i] = predicted[i] - measured[i];
        }
        return e;
    }

    /** Mean error (bias). */
    public static double me(double[] predicted, double[] measured) {
        double[] e = errors(predicted, measured);
        double sum = 0.0;
        int count = 0;
        for (double v : e) {
            if (Double.isNaN(v)) continue;
            sum += v;
            count++;
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    public static double mae(double[] predicted, double[] measured) {
        double[] e = errors(predicted, measured);
        double sum = 0.0;
        int count = 0;
        for (double v : e) {
            if (Double.isNaN(v)) continue;
            sum += Math.abs(v);
            count++;
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    public static double rmse(double[] predicted, double[] measured) {
        double[] e = errors(predicted, measured);
        double sum = 0.0;
        int count = 0;
        for (double v : e) {
            if (Double.isNaN(v)) continue;
            sum += v * v;
            count++;
        }
        return count == 0 ? Double.NaN : Math.sqrt(sum / count);
    }
}
