package forecast.ml;

import forecast.error.ForecastException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearRegressionTest {

    @Test
    void recoversExactLine() {
        double[] y = new double[10];
        for (int i = 0; i < y.length; i++) y[i] = 5 * i + 10;

        LinearRegression lr = LinearRegression.fit(y);

        assertThat(lr.getSlope()).isCloseTo(5, within(1e-9));
        assertThat(lr.getIntercept()).isCloseTo(10, within(1e-9));
        assertThat(lr.getRSquared()).isCloseTo(1.0, within(1e-12));
        assertThat(lr.extrapolate(2)).containsExactly(new double[] {60, 65}, within(1e-9));
    }

    @Test
    void leastSquaresOnNoisyData() {
        // slope = 0.6, intercept = 2.4 for x = 0..4
        LinearRegression lr = LinearRegression.fit(new double[] {2, 4, 3, 4, 5});
        assertThat(lr.getSlope()).isCloseTo(0.6, within(1e-9));
        assertThat(lr.getIntercept()).isCloseTo(2.4, within(1e-9));
        assertThat(lr.getFitted()).containsExactly(new double[] {2.4, 3.0, 3.6, 4.2, 4.8}, within(1e-9));
    }

    @Test
    void singlePointIsAFlatLine() {
        LinearRegression lr = LinearRegression.fit(new double[] {7.5});

        assertThat(lr.getSlope()).isZero();
        assertThat(lr.getIntercept()).isEqualTo(7.5);
        assertThat(lr.getFitted()).containsExactly(7.5);
        assertThat(lr.extrapolate(2)).containsExactly(7.5, 7.5);
    }

    @Test
    void needsAtLeastOnePoint() {
        assertThatThrownBy(() -> LinearRegression.fit(new double[0]))
            .isInstanceOf(ForecastException.class);
    }
}
