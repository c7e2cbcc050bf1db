package forecast;

import com.google.gson.Gson;
import forecast.data.DataTable;
import forecast.data.PreparedSeries;
import forecast.error.ForecastException;
import forecast.error.ValidationException;
import forecast.ml.AccuracyMetrics;
import forecast.ml.ForecastConfig;
import forecast.ml.ForecastFormatter;
import forecast.ml.ForecastResult;
import forecast.ml.TimeSeriesForecaster;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP front end for the forecaster.
 * Run with: mvn exec:java -Dexec.mainClass="forecast.WebApp"
 * <ul>
 *   <li>{@code POST /api/forecast} - forecast rows posted as JSON (see {@link ForecastRequest})</li>
 *   <li>{@code GET /api/sample} - demo rows accepted by {@code /api/forecast}</li>
 *   <li>{@code GET /api/health}</li>
 * </ul>
 */
public class WebApp {

    private static final Logger log = LoggerFactory.getLogger(WebApp.class);

    private static final Gson GSON = new Gson();

    private static int getPort() {
        String env = System.getenv("PORT");
        if (env != null && !env.isBlank()) {
            try {
                return Integer.parseInt(env.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring PORT='{}': not an integer", env);
            }
        }
        return 7000;
    }

    public static void main(String[] args) {
        int port = getPort();
        TimeSeriesForecaster forecaster = new TimeSeriesForecaster(ForecastConfig.fromEnvironment(System.getenv()));
        create(forecaster).start("0.0.0.0", port);
        log.info("Forecast web app: http://localhost:{}", port);
    }

    /** Routes and error mapping, not yet started. */
    static Javalin create(TimeSeriesForecaster forecaster) {
        Javalin app = Javalin.create(cfg ->
            cfg.requestLogger.http((ctx, ms) ->
                log.info("HTTP {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms.longValue())));

        app.post("/api/forecast", ctx -> {
            ForecastRequest req = ForecastRequest.parse(GSON, ctx.body());
            ForecastResult result;
            if (req.getMethod() == null) {
                result = forecaster.analyze(req.getTable(), req.getTargetColumn(), req.getDateColumn(),
                    req.getPeriods(), req.getConfidenceLevel());
            } else {
                PreparedSeries series = forecaster.prepare(req.getTable(), req.getTargetColumn(), req.getDateColumn());
                result = forecaster.forecast(series, req.getMethod(), req.getPeriods(), req.getConfidenceLevel());
            }
            sendJson(ctx, 200, toJson(result));
        });

        app.get("/api/sample", ctx -> {
            DataTable sample = SampleData.monthlyRevenue();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("targetColumn", SampleData.TARGET_COLUMN);
            out.put("dateColumn", SampleData.DATE_COLUMN);
            out.put("rows", sample.getRows());
            sendJson(ctx, 200, out);
        });

        app.get("/api/health", ctx -> {
            Map<String, Object> h = new HashMap<>();
            h.put("status", "ok");
            h.put("port", ctx.req().getServerPort());
            sendJson(ctx, 200, h);
        });

        app.exception(ValidationException.class, (e, ctx) -> {
            log.warn("Rejected forecast request: {} ({})", e.getMessage(), e.kind());
            sendJson(ctx, 400, error(e.kind(), e.getMessage()));
        });
        app.exception(ForecastException.class, (e, ctx) -> {
            log.error("Forecast failed: {}", e.getMessage(), e);
            sendJson(ctx, 422, error("ForecastError", e.getMessage()));
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            log.warn("Bad request: {}", e.getMessage());
            sendJson(ctx, 400, error("BadRequest", e.getMessage()));
        });
        return app;
    }

    static Map<String, Object> toJson(ForecastResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("method", result.getMethod().getDisplayName());
        out.put("forecastValues", result.getForecastValues());
        out.put("forecastDates", result.getForecastDates());
        out.put("confidenceUpper", result.getConfidenceUpper());
        out.put("confidenceLower", result.getConfidenceLower());
        AccuracyMetrics metrics = result.getAccuracyMetrics();
        Map<String, Object> accuracy = new LinkedHashMap<>(metrics.getValues());
        accuracy.put("method_confidence", metrics.getMethodConfidence().getLabel());
        out.put("accuracyMetrics", accuracy);
        out.put("seasonalDetected", result.isSeasonalDetected());
        out.put("trendDirection", result.getTrendDirection().getLabel());
        out.put("lastActualValue", result.getLastActualValue());
        out.put("forecastHorizon", result.getForecastHorizon());
        out.put("display", ForecastFormatter.format(result));
        return out;
    }

    private static Map<String, Object> error(String kind, String message) {
        Map<String, Object> err = new LinkedHashMap<>();
        err.put("error", kind);
        err.put("message", message != null && !message.isEmpty() ? message : kind);
        return err;
    }

    private static void sendJson(Context ctx, int status, Object body) {
        ctx.status(status).contentType("application/json").result(GSON.toJson(body));
    }
}
