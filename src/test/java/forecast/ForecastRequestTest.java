package forecast;

import com.google.gson.Gson;
import forecast.ml.MethodVariant;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ForecastRequestTest {

    private final Gson gson = new Gson();

    @Test
    void appliesDefaults() {
        ForecastRequest req = ForecastRequest.parse(gson,
            "{\"rows\":[{\"Date\":\"2024-01-01\",\"Sales\":10},{\"Date\":\"2024-02-01\",\"Sales\":12}],"
                + "\"targetColumn\":\"Sales\"}");

        assertThat(req.getTargetColumn()).isEqualTo("Sales");
        assertThat(req.getDateColumn()).isEqualTo("Date");
        assertThat(req.getPeriods()).isEqualTo(6);
        assertThat(req.getConfidenceLevel()).isEqualTo(0.95);
        assertThat(req.getMethod()).isNull();
        assertThat(req.getTable().getColumns()).containsExactly("Date", "Sales");
        assertThat(req.getTable().rowCount()).isEqualTo(2);
        assertThat(req.getTable().isNumeric("Sales")).isTrue();
    }

    @Test
    void readsExplicitFields() {
        ForecastRequest req = ForecastRequest.parse(gson,
            "{\"rows\":[{\"day\":\"2024-01-01\",\"v\":1}],\"targetColumn\":\"v\",\"dateColumn\":\"day\","
                + "\"periods\":3,\"confidenceLevel\":0.99,\"method\":\"double exponential-smoothing\"}");

        assertThat(req.getDateColumn()).isEqualTo("day");
        assertThat(req.getPeriods()).isEqualTo(3);
        assertThat(req.getConfidenceLevel()).isEqualTo(0.99);
        assertThat(req.getMethod()).isEqualTo(MethodVariant.DOUBLE_EXPONENTIAL_SMOOTHING);
    }

    @Test
    void rowsWithDifferentKeysShareOneColumnSet() {
        ForecastRequest req = ForecastRequest.parse(gson,
            "{\"rows\":[{\"Date\":\"2024-01-01\",\"v\":1},{\"Date\":\"2024-02-01\",\"w\":2}],\"targetColumn\":\"v\"}");

        assertThat(req.getTable().getColumns()).containsExactly("Date", "v", "w");
        assertThat(req.getTable().get(1, "v")).isNull();
    }

    @Test
    void rejectsMalformedBodies() {
        assertThatThrownBy(() -> ForecastRequest.parse(gson, "")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ForecastRequest.parse(gson, "{not json"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Invalid JSON");
        assertThatThrownBy(() -> ForecastRequest.parse(gson, "{\"targetColumn\":\"v\"}"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("rows");
        assertThatThrownBy(() -> ForecastRequest.parse(gson, "{\"rows\":[]}"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("targetColumn");
        assertThatThrownBy(() -> ForecastRequest.parse(gson, "{\"rows\":[1,2],\"targetColumn\":\"v\"}"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ForecastRequest.parse(gson, "{\"rows\":[],\"targetColumn\":\"v\",\"periods\":\"six\"}"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("periods");
        assertThatThrownBy(() -> ForecastRequest.parse(gson, "{\"rows\":[],\"targetColumn\":\"v\",\"method\":\"arima\"}"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("arima");
    }
}
