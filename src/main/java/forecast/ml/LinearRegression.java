package forecast.ml;

import forecast.error.ForecastException;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Ordinary Least Squares fit of a straight line over the time index.
 * <p>
 * Model: y = β₀ + β₁·x with x = 0, 1, ..., n-1
 * <p>
 * Closed-form solution (normal equation): β = (X'X)⁻¹X'y
 * where X is the n×2 design matrix [1, x].
 */
public final class LinearRegression {

    private final double intercept;
    private final double slope;
    private final double[] fitted;
    private final double rSquared;

    private LinearRegression(double intercept, double slope, double[] y) {
        this.intercept = intercept;
        this.slope = slope;
        this.fitted = new double[y.length];
        for (int i = 0; i < y.length; i++) fitted[i] = predict(i);
        this.rSquared = ForecastStatistics.rSquared(y, fitted);
    }

    /**
     * Fit y against positions 0..n-1.
     *
     * A single observation gives a flat line through it.
     *
     * @param y observations in time order; at least one
     */
    public static LinearRegression fit(double[] y) {
        if (y == null || y.length == 0) {
            throw new ForecastException("Linear regression needs at least 1 point");
        }
        if (y.length == 1) {
            return new LinearRegression(y[0], 0, y);
        }
        int n = y.length;
        double[][] design = new double[n][2];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            design[i][1] = i;
        }

        RealMatrix xm = MatrixUtils.createRealMatrix(design);
        RealVector yv = MatrixUtils.createRealVector(y);

        // β = (X'X)⁻¹ X' y
        RealMatrix xt = xm.transpose();
        DecompositionSolver solver = new LUDecomposition(xt.multiply(xm)).getSolver();
        if (!solver.isNonSingular()) {
            throw new ForecastException("Design matrix X'X is singular; cannot compute (X'X)⁻¹");
        }
        double[] beta = solver.solve(xt.operate(yv)).toArray();
        return new LinearRegression(beta[0], beta[1], y);
    }

    /** Intercept β₀ */
    public double getIntercept() { return intercept; }

    /** Slope β₁ per period. */
    public double getSlope() { return slope; }

    public double getRSquared() { return rSquared; }

    /** In-sample fitted values (copy). */
    public double[] getFitted() { return fitted.clone(); }

    /** y at position x (fractional or beyond the sample is fine). */
    public double predict(double x) {
        return intercept + slope * x;
    }

    /** The next {@code steps} values after the fitted sample: positions n, n+1, ... */
    public double[] extrapolate(int steps) {
        double[] out = new double[steps];
        int n = fitted.length;
        for (int h = 1; h <= steps; h++) {
            out[h - 1] = predict(n - 1 + h);
        }
        return out;
    }
}
