package solcore.engine.calibration;

/**
 * Outcome of one {@link BfgsMinimizer} run. {@code point} is the best iterate seen,
 * which is also what is returned when the run did not converge.
 */
public final class OptimizationResult {

    private final double[] point;
    private final double value;
    private final int iterations;
    private final int evaluations;
    private final boolean converged;
    private final String message;

    public OptimizationResult(double[] point,
                              double value,
                              int iterations,
                              int evaluations,
                              boolean converged,
                              String message) {
        this.point = point.clone();
        this.value = value;
        this.iterations = iterations;
        this.evaluations = evaluations;
        this.converged = converged;
        this.message = message;
    }

    public double[] getPoint()   { return point.clone(); }
    public double getValue()     { return value; }
    public int getIterations()   { return iterations; }
    public int getEvaluations()  { return evaluations; }
    public boolean isConverged() { return converged; }
    public String getMessage()   { return message; }
}
