package forecast.ml;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Error measures and confidence-band helpers shared by the forecast engines.
 * All measures compare equal-length actual and fitted arrays.
 */
public final class ForecastStatistics {

    static final double Z_95 = 1.96;
    static final double Z_99 = 2.576;

    private ForecastStatistics() {
    }

    /**
     * Two-point table: 1.96 for exactly 0.95, 2.576 for anything else.
     */
    public static double zScore(double confidenceLevel) {
        return confidenceLevel == 0.95 ? Z_95 : Z_99;
    }

    public static double[] residuals(double[] actual, double[] fitted) {
        checkLengths(actual, fitted);
        double[] out = new double[actual.length];
        for (int i = 0; i < actual.length; i++) out[i] = actual[i] - fitted[i];
        return out;
    }

    /** Population standard deviation (divisor n); 0 for an empty or single-element array. */
    public static double populationStd(double[] values) {
        if (values.length < 2) return 0;
        return new StandardDeviation(false).evaluate(values);
    }

    public static double mae(double[] actual, double[] fitted) {
        double[] r = residuals(actual, fitted);
        double sum = 0;
        for (double v : r) sum += Math.abs(v);
        return sum / r.length;
    }

    public static double rmse(double[] actual, double[] fitted) {
        double[] r = residuals(actual, fitted);
        double sum = 0;
        for (double v : r) sum += v * v;
        return Math.sqrt(sum / r.length);
    }

    /** R² = 1 - SS_res / SS_tot, or 0 when SS_tot is 0. */
    public static double rSquared(double[] actual, double[] fitted) {
        checkLengths(actual, fitted);
        double mean = StatUtils.mean(actual);
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < actual.length; i++) {
            ssTot += (actual[i] - mean) * (actual[i] - mean);
            ssRes += (actual[i] - fitted[i]) * (actual[i] - fitted[i]);
        }
        return ssTot != 0 ? 1.0 - ssRes / ssTot : 0;
    }

    /** Margin of error: z × population std of the residuals. */
    public static double marginOfError(double[] residuals, double confidenceLevel) {
        return zScore(confidenceLevel) * populationStd(residuals);
    }

    public static double[] shift(double[] values, double delta) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i] + delta;
        return out;
    }

    private static void checkLengths(double[] actual, double[] fitted) {
        if (actual.length != fitted.length) {
            throw new IllegalArgumentException("length mismatch: " + actual.length + " vs " + fitted.length);
        }
        if (actual.length == 0) throw new IllegalArgumentException("empty input");
    }
}
