package forecast;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import forecast.ml.TimeSeriesForecaster;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebAppTest {

    private static final Gson GSON = new Gson();

    private final HttpClient client = HttpClient.newHttpClient();
    private Javalin app;

    @BeforeEach
    void start() {
        app = WebApp.create(new TimeSeriesForecaster()).start(0);
    }

    @AfterEach
    void stop() {
        app.stop();
    }

    @Test
    void healthReportsOk() throws Exception {
        HttpResponse<String> res = get("/api/health");
        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(json(res.body())).containsEntry("status", "ok");
    }

    @Test
    void sampleRoundTripsThroughForecast() throws Exception {
        Map<String, Object> sample = json(get("/api/sample").body());
        assertThat(sample).containsEntry("targetColumn", "Revenue").containsEntry("dateColumn", "Date");
        assertThat((List<?>) sample.get("rows")).hasSize(48);

        sample.put("periods", 4);
        HttpResponse<String> res = post("/api/forecast", GSON.toJson(sample));

        assertThat(res.statusCode()).isEqualTo(200);
        Map<String, Object> body = json(res.body());
        assertThat(body).containsEntry("method", "Seasonal Decomposition");
        assertThat((List<?>) body.get("forecastValues")).hasSize(4);
        assertThat((List<?>) body.get("forecastDates")).hasSize(4);
        assertThat(body).containsEntry("seasonalDetected", true);
        assertThat(body.get("accuracyMetrics")).asString().contains("method_confidence");
        assertThat(body.get("display")).asString().startsWith("Seasonal Decomposition Forecast");
    }

    @Test
    void forcedMethodOverridesSelection() throws Exception {
        String req = "{\"rows\":[{\"Date\":\"2024-01-01\",\"v\":10},{\"Date\":\"2024-02-01\",\"v\":12},"
            + "{\"Date\":\"2024-03-01\",\"v\":15}],\"targetColumn\":\"v\",\"periods\":2,\"method\":\"LINEAR_REGRESSION\"}";
        HttpResponse<String> res = post("/api/forecast", req);

        assertThat(res.statusCode()).isEqualTo(200);
        assertThat(json(res.body())).containsEntry("method", "Linear Regression");
    }

    @Test
    void validationErrorsMapToBadRequest() throws Exception {
        HttpResponse<String> tooShort = post("/api/forecast",
            "{\"rows\":[{\"Date\":\"2024-01-01\",\"v\":1},{\"Date\":\"2024-02-01\",\"v\":2}],\"targetColumn\":\"v\"}");
        assertThat(tooShort.statusCode()).isEqualTo(400);
        assertThat(json(tooShort.body())).containsEntry("error", "InsufficientDataError");

        HttpResponse<String> noColumn = post("/api/forecast",
            "{\"rows\":[{\"Date\":\"2024-01-01\",\"v\":1}],\"targetColumn\":\"Sales\"}");
        assertThat(noColumn.statusCode()).isEqualTo(400);
        assertThat(json(noColumn.body())).containsEntry("error", "MissingColumnError");

        HttpResponse<String> garbage = post("/api/forecast", "{oops");
        assertThat(garbage.statusCode()).isEqualTo(400);
        assertThat(json(garbage.body())).containsEntry("error", "BadRequest");
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uri(path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + app.port() + path);
    }

    private static Map<String, Object> json(String body) {
        return GSON.fromJson(body, new TypeToken<Map<String, Object>>() {}.getType());
    }
}
