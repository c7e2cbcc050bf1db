package forecast.data;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PreparedSeriesTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 1, 0, 0);

    @Test
    void valuesAreACopy() {
        PreparedSeries series = PreparedSeries.of(T0, 1, 2, 3);
        double[] values = series.values();
        values[0] = 99;
        assertThat(series.values()).containsExactly(1.0, 2.0, 3.0);
        assertThat(series.size()).isEqualTo(3);
        assertThat(series.lastTimestamp()).isEqualTo(T0.plusDays(2));
    }

    @Test
    void enforcesInvariants() {
        assertThatThrownBy(() -> new PreparedSeries(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PreparedSeries(List.of(
            new TimeSeriesPoint(T0, 1), new TimeSeriesPoint(T0, 2))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PreparedSeries(List.of(
            new TimeSeriesPoint(T0.plusDays(1), 1), new TimeSeriesPoint(T0, 2))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PreparedSeries.of(T0, 1, Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
