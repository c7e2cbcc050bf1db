package forecast.ml;

import forecast.data.PreparedSeries;
import forecast.error.ForecastException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ForecastEnginesTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 31, 0, 0);
    private static final ForecastConfig CONFIG = ForecastConfig.defaults();

    @Test
    void forVariantCoversEveryMethod() {
        for (MethodVariant v : MethodVariant.values()) {
            assertThat(ForecastEngine.forVariant(v).variant()).isEqualTo(v);
        }
    }

    @Test
    void linearRegressionExtrapolatesLine() {
        EngineOutput out = engine(MethodVariant.LINEAR_REGRESSION)
            .forecast(PreparedSeries.of(T0, 10, 15, 20, 25, 30), 3, 0.95, CONFIG);

        assertThat(out.getValues()).containsExactly(new double[] {35, 40, 45}, within(1e-9));
        assertThat(out.getMetrics().get("r_squared")).isCloseTo(1.0, within(1e-9));
        assertThat(out.getMetrics().get("mae")).isCloseTo(0, within(1e-9));
        assertThat(out.getMetrics().getMethodConfidence()).isEqualTo(MethodConfidence.HIGH);
        assertThat(out.getTrendDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(out.isSeasonalDetected()).isFalse();
    }

    @Test
    void linearRegressionConfidenceFollowsRSquared() {
        assertThat(LinearRegressionEngine.confidenceFor(0.71)).isEqualTo(MethodConfidence.HIGH);
        assertThat(LinearRegressionEngine.confidenceFor(0.7)).isEqualTo(MethodConfidence.MEDIUM);
        assertThat(LinearRegressionEngine.confidenceFor(0.41)).isEqualTo(MethodConfidence.MEDIUM);
        assertThat(LinearRegressionEngine.confidenceFor(0.4)).isEqualTo(MethodConfidence.LOW);
    }

    @Test
    void linearRegressionReportsDecline() {
        EngineOutput out = engine(MethodVariant.LINEAR_REGRESSION)
            .forecast(PreparedSeries.of(T0, 30, 27, 25, 20), 1, 0.95, CONFIG);
        assertThat(out.getTrendDirection()).isEqualTo(TrendDirection.DECREASING);
    }

    @Test
    void simpleSmoothingIsFlatAtLastSmoothedValue() {
        EngineOutput out = engine(MethodVariant.SIMPLE_EXPONENTIAL_SMOOTHING)
            .forecast(PreparedSeries.of(T0, 10, 20, 30), 4, 0.95, CONFIG);

        assertThat(out.getValues()).containsExactly(new double[] {18.1, 18.1, 18.1, 18.1}, within(1e-9));
        assertThat(out.horizon()).isEqualTo(4);
        assertThat(out.getMetrics().get("mae")).isCloseTo(6.3, within(1e-9));
        assertThat(out.getMetrics().get("rmse")).isCloseTo(7.970989064518069, within(1e-9));
        assertThat(out.getMetrics().get("alpha")).isEqualTo(0.3);
        assertThat(out.getMetrics().getMethodConfidence()).isEqualTo(MethodConfidence.MEDIUM);
        assertThat(out.getTrendDirection()).isEqualTo(TrendDirection.STABLE);
        assertThat(out.getUpper()[0] - out.getValues()[0]).isCloseTo(1.96 * 4.883304891839814, within(1e-9));
        assertThat(out.getValues()[0] - out.getLower()[0]).isCloseTo(1.96 * 4.883304891839814, within(1e-9));
    }

    @Test
    void simpleSmoothingUsesConfiguredAlpha() {
        double[] s = SimpleExponentialSmoothingEngine.smooth(new double[] {10, 20}, 0.5);
        assertThat(s).containsExactly(10, 15);

        EngineOutput out = engine(MethodVariant.SIMPLE_EXPONENTIAL_SMOOTHING)
            .forecast(PreparedSeries.of(T0, 10, 20), 1, 0.95, CONFIG.withAlpha(0.5));
        assertThat(out.getValues()).containsExactly(15);
        assertThat(out.getMetrics().get("alpha")).isEqualTo(0.5);
    }

    @Test
    void holtTracksLevelAndTrend() {
        EngineOutput out = engine(MethodVariant.DOUBLE_EXPONENTIAL_SMOOTHING)
            .forecast(PreparedSeries.of(T0, 10, 12, 15), 2, 0.95, CONFIG);

        // level 14.3, trend 2.03
        assertThat(out.getValues()).containsExactly(new double[] {16.33, 18.36}, within(1e-9));
        assertThat(out.getMetrics().get("final_trend")).isCloseTo(2.03, within(1e-9));
        assertThat(out.getMetrics().get("mae")).isCloseTo(0.7 / 3, within(1e-9));
        assertThat(out.getMetrics().get("alpha")).isEqualTo(0.3);
        assertThat(out.getMetrics().get("beta")).isEqualTo(0.1);
        assertThat(out.getMetrics().getMethodConfidence()).isEqualTo(MethodConfidence.HIGH);
        assertThat(out.getTrendDirection()).isEqualTo(TrendDirection.INCREASING);
    }

    @Test
    void holtFitKeepsInSampleLevels() {
        HoltLinearTrendEngine.Fit fit = HoltLinearTrendEngine.fit(new double[] {10, 12, 15}, 0.3, 0.1);
        assertThat(fit.smoothed).containsExactly(new double[] {10, 12, 14.3}, within(1e-9));

        HoltLinearTrendEngine.Fit single = HoltLinearTrendEngine.fit(new double[] {7}, 0.3, 0.1);
        assertThat(single.level).isEqualTo(7);
        assertThat(single.trend).isZero();
    }

    @Test
    void holtWithFlatTrendIsMediumConfidence() {
        EngineOutput out = engine(MethodVariant.DOUBLE_EXPONENTIAL_SMOOTHING)
            .forecast(PreparedSeries.of(T0, 5, 5, 5, 5), 2, 0.95, CONFIG);
        assertThat(out.getMetrics().getMethodConfidence()).isEqualTo(MethodConfidence.MEDIUM);
        assertThat(out.getTrendDirection()).isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void seasonalContinuesTheCycle() {
        double[] y = new double[12];
        for (int i = 0; i < y.length; i++) y[i] = 10 + 10 * (i % 3);

        EngineOutput out = engine(MethodVariant.SEASONAL_DECOMPOSITION)
            .forecast(PreparedSeries.of(T0, y), 4, 0.95, CONFIG);

        assertThat(out.getValues()).containsExactly(new double[] {10, 20, 30, 10}, within(1e-9));
        assertThat(out.getMetrics().get("seasonal_strength")).isCloseTo(Math.sqrt(200.0 / 3), within(1e-9));
        assertThat(out.getMetrics().get("mae")).isCloseTo(0, within(1e-9));
        assertThat(out.getMetrics().getMethodConfidence()).isEqualTo(MethodConfidence.HIGH);
        assertThat(out.getTrendDirection()).isEqualTo(TrendDirection.SEASONAL);
        assertThat(out.isSeasonalDetected()).isTrue();
    }

    @Test
    void seasonalPatternIsDeviationFromMean() {
        assertThat(SeasonalDecompositionEngine.seasonLength(30, 12)).isEqualTo(12);
        assertThat(SeasonalDecompositionEngine.seasonLength(13, 12)).isEqualTo(6);

        double[] pattern = SeasonalDecompositionEngine.seasonalPattern(new double[] {1, 5, 3, 7}, 2);
        // means 2 and 6 around overall mean 4
        assertThat(pattern).containsExactly(new double[] {-2, 2}, within(1e-12));
    }

    @Test
    void seasonalNeedsTwoPoints() {
        assertThatThrownBy(() -> engine(MethodVariant.SEASONAL_DECOMPOSITION)
            .forecast(PreparedSeries.of(T0, 5), 1, 0.95, CONFIG))
            .isInstanceOf(ForecastException.class);
    }

    @Test
    void boundsWidenAtHigherConfidence() {
        PreparedSeries series = PreparedSeries.of(T0, 12, 15, 11, 18, 14, 19, 13, 17);
        for (MethodVariant v : MethodVariant.values()) {
            EngineOutput at95 = engine(v).forecast(series, 3, 0.95, CONFIG);
            EngineOutput at99 = engine(v).forecast(series, 3, 0.99, CONFIG);
            for (int i = 0; i < 3; i++) {
                double w95 = at95.getUpper()[i] - at95.getLower()[i];
                double w99 = at99.getUpper()[i] - at99.getLower()[i];
                assertThat(w99).as("%s step %d", v, i).isGreaterThanOrEqualTo(w95);
            }
        }
    }

    private static ForecastEngine engine(MethodVariant v) {
        return ForecastEngine.forVariant(v);
    }
}
