package forecast.ml;

import forecast.data.PreparedSeries;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Derives {@link DataCharacteristics} from a prepared series.
 * <ul>
 *   <li>trend: |Pearson r| between position index and value above {@value #TREND_CORRELATION_THRESHOLD}</li>
 *   <li>seasonality: length of at least {@value #SEASONALITY_MIN_LENGTH} (length only, no periodicity test)</li>
 *   <li>volatility: sample standard deviation</li>
 *   <li>outliers: values outside [Q1 - 1.5·IQR, Q3 + 1.5·IQR]</li>
 * </ul>
 */
public class CharacteristicsAnalyzer {

    static final double TREND_CORRELATION_THRESHOLD = 0.3;
    static final int SEASONALITY_MIN_LENGTH = 12;
    static final double IQR_FACTOR = 1.5;

    public DataCharacteristics characterize(PreparedSeries series) {
        double[] values = series.values();
        return new DataCharacteristics(
            values.length,
            detectTrend(values),
            detectSeasonality(values),
            volatility(values),
            series.getMissingValues(),
            countOutliers(values));
    }

    static boolean detectTrend(double[] values) {
        double r = correlationWithIndex(values);
        // NaN (constant series) compares false
        return Math.abs(r) > TREND_CORRELATION_THRESHOLD;
    }

    /** Pearson correlation of (0..n-1, values); NaN when undefined. */
    static double correlationWithIndex(double[] values) {
        if (values.length < 2) return Double.NaN;
        double[] index = new double[values.length];
        for (int i = 0; i < index.length; i++) index[i] = i;
        return new PearsonsCorrelation().correlation(index, values);
    }

    static boolean detectSeasonality(double[] values) {
        return values.length >= SEASONALITY_MIN_LENGTH;
    }

    static double volatility(double[] values) {
        double sd = new DescriptiveStatistics(values).getStandardDeviation();
        return Double.isNaN(sd) ? 0 : sd;
    }

    static int countOutliers(double[] values) {
        // R-7: linear interpolation between order statistics
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        double q1 = percentile.evaluate(25);
        double q3 = percentile.evaluate(75);
        double iqr = q3 - q1;
        double lower = q1 - IQR_FACTOR * iqr;
        double upper = q3 + IQR_FACTOR * iqr;
        int count = 0;
        for (double v : values) {
            if (v < lower || v > upper) count++;
        }
        return count;
    }
}
