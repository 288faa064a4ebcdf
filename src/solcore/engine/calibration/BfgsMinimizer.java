package solcore.engine.calibration;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unconstrained quasi-Newton minimizer (BFGS, inverse-Hessian form) with a
 * forward-difference gradient and a weak-Wolfe bracketing line search.
 * <p>
 * Stops when the gradient sup-norm drops to {@code gradientTolerance}, after
 * {@code 200 * n} iterations, or when the line search cannot make progress.
 * The lowest objective value seen is always returned; a NaN or infinite
 * objective value is treated as "too far" by the line search.
 */
public final class BfgsMinimizer {

    private static final Logger log = LoggerFactory.getLogger(BfgsMinimizer.class);

    /** sqrt of double machine epsilon. */
    public static final double DEFAULT_GRADIENT_STEP = 1.4901161193847656e-8;
    public static final double DEFAULT_GRADIENT_TOLERANCE = 1e-5;
    public static final int ITERATIONS_PER_DIMENSION = 200;

    private static final double ARMIJO_C1 = 1e-4;
    private static final double CURVATURE_C2 = 0.9;
    private static final int MAX_LINE_SEARCH_STEPS = 60;
    private static final double MIN_STEP_NORM = 1e-14;

    private final double gradientStep;
    private final double gradientTolerance;

    public BfgsMinimizer() {
        this(DEFAULT_GRADIENT_STEP, DEFAULT_GRADIENT_TOLERANCE);
    }

    public BfgsMinimizer(double gradientStep, double gradientTolerance) {
        if (gradientStep <= 0) throw new IllegalArgumentException("gradientStep must be > 0");
        if (gradientTolerance < 0) throw new IllegalArgumentException("gradientTolerance must be >= 0");
        this.gradientStep = gradientStep;
        this.gradientTolerance = gradientTolerance;
    }

    public OptimizationResult minimize(MultivariateFunction objective, double[] start) {
        final int n = start.length;
        final int maxIterations = ITERATIONS_PER_DIMENSION * n;
        CountingFunction f = new CountingFunction(objective);

        RealVector x = new ArrayRealVector(start, true);
        double fx = evaluate(f, x);
        if (!Double.isFinite(fx)) {
            return new OptimizationResult(start, fx, 0, f.evaluations, false,
                    "objective is not finite at the starting point");
        }

        RealVector g = gradient(f, x, fx);
        RealMatrix h = MatrixUtils.createRealIdentityMatrix(n);
        boolean firstUpdate = true;

        RealVector best = x;
        double bestValue = fx;

        int iteration = 0;
        boolean converged = g.getLInfNorm() <= gradientTolerance;
        String message = converged ? "gradient below tolerance" : "maximum number of iterations reached";

        while (!converged && iteration < maxIterations) {
            RealVector p = h.operate(g).mapMultiply(-1.0);
            double slope = g.dotProduct(p);
            if (!(slope < 0)) {
                // not a descent direction: restart from steepest descent
                h = MatrixUtils.createRealIdentityMatrix(n);
                firstUpdate = true;
                p = g.mapMultiply(-1.0);
                slope = -g.dotProduct(g);
            }

            double initialStep = (iteration == 0) ? Math.min(1.0, 1.0 / g.getNorm()) : 1.0;
            LineSearchPoint step = lineSearch(f, x, fx, p, slope, initialStep);
            iteration++;

            if (step == null) {
                message = "line search failed to find an acceptable step";
                break;
            }

            RealVector s = step.x.subtract(x);
            RealVector y = step.gradient.subtract(g);

            x = step.x;
            fx = step.value;
            g = step.gradient;

            if (fx < bestValue) {
                best = x;
                bestValue = fx;
            }

            log.debug("BFGS iter {}: f={} |g|inf={}", iteration, fx, g.getLInfNorm());

            if (g.getLInfNorm() <= gradientTolerance) {
                converged = true;
                message = "gradient below tolerance";
                break;
            }
            if (s.getLInfNorm() < MIN_STEP_NORM) {
                message = "step size below machine precision";
                break;
            }

            double sy = s.dotProduct(y);
            if (sy > 0) {
                if (firstUpdate) {
                    h = h.scalarMultiply(sy / y.dotProduct(y));
                    firstUpdate = false;
                }
                h = inverseHessianUpdate(h, s, y, sy);
            }
        }

        return new OptimizationResult(best.toArray(), bestValue, iteration, f.evaluations, converged, message);
    }

    /** H+ = (I - rho s y^T) H (I - rho y s^T) + rho s s^T, rho = 1 / s^T y. */
    static RealMatrix inverseHessianUpdate(RealMatrix h, RealVector s, RealVector y, double sy) {
        int n = s.getDimension();
        double rho = 1.0 / sy;
        RealMatrix identity = MatrixUtils.createRealIdentityMatrix(n);
        RealMatrix left = identity.subtract(s.outerProduct(y).scalarMultiply(rho));
        RealMatrix right = identity.subtract(y.outerProduct(s).scalarMultiply(rho));
        return left.multiply(h).multiply(right).add(s.outerProduct(s).scalarMultiply(rho));
    }

    /**
     * Bracketing/bisection search for a step satisfying the weak Wolfe conditions.
     * Falls back to the last sufficient-decrease point when the bracket collapses.
     */
    private LineSearchPoint lineSearch(CountingFunction f,
                                       RealVector x,
                                       double fx,
                                       RealVector p,
                                       double slope,
                                       double initialStep) {
        double lo = 0.0;
        double hi = Double.POSITIVE_INFINITY;
        double t = initialStep;
        LineSearchPoint lastDecrease = null;

        for (int k = 0; k < MAX_LINE_SEARCH_STEPS; k++) {
            RealVector xt = x.add(p.mapMultiply(t));
            double ft = evaluate(f, xt);

            if (!Double.isFinite(ft) || ft > fx + ARMIJO_C1 * t * slope) {
                hi = t;
            } else {
                RealVector gt = gradient(f, xt, ft);
                LineSearchPoint candidate = new LineSearchPoint(xt, ft, gt);
                if (gt.dotProduct(p) < CURVATURE_C2 * slope) {
                    lo = t;
                    lastDecrease = candidate;
                } else {
                    return candidate;
                }
            }
            t = Double.isInfinite(hi) ? 2.0 * lo : 0.5 * (lo + hi);
        }
        return lastDecrease;
    }

    private RealVector gradient(CountingFunction f, RealVector x, double fx) {
        final int n = x.getDimension();
        double[] grad = new double[n];
        for (int i = 0; i < n; i++) {
            RealVector xh = x.copy();
            xh.addToEntry(i, gradientStep);
            grad[i] = (evaluate(f, xh) - fx) / gradientStep;
        }
        return new ArrayRealVector(grad, false);
    }

    private static double evaluate(CountingFunction f, RealVector x) {
        return f.value(x.toArray());
    }

    private static final class CountingFunction implements MultivariateFunction {
        private final MultivariateFunction delegate;
        private int evaluations;

        CountingFunction(MultivariateFunction delegate) {
            this.delegate = delegate;
        }

        @Override
        public double value(double[] point) {
            evaluations++;
            return delegate.value(point);
        }
    }

    private static final class LineSearchPoint {
        final RealVector x;
        final double value;
        final RealVector gradient;

        LineSearchPoint(RealVector x, double value, RealVector gradient) {
            this.x = x;
            this.value = value;
            this.gradient = gradient;
        }
    }
}
