package forecast;

import forecast.data.CsvTableReader;
import forecast.data.DataTable;
import forecast.ml.ForecastConfig;
import forecast.ml.ForecastFormatter;
import forecast.ml.ForecastResult;
import forecast.ml.TimeSeriesForecaster;

import java.nio.file.Paths;

/**
 * Command-line forecast.
 * <pre>
 *   Main                                   forecast the built-in monthly sample
 *   Main file.csv Revenue Date [periods [confidence]]
 * </pre>
 */
public class Main {

    private static final int DEFAULT_PERIODS = 6;

    public static void main(String[] args) {
        TimeSeriesForecaster forecaster = new TimeSeriesForecaster(ForecastConfig.fromEnvironment(System.getenv()));

        if (args.length == 0) {
            ForecastResult result = forecaster.analyze(SampleData.monthlyRevenue(),
                SampleData.TARGET_COLUMN, SampleData.DATE_COLUMN, DEFAULT_PERIODS);
            System.out.println(ForecastFormatter.format(result));
            return;
        }

        if (args.length < 3) {
            System.err.println("Usage: Main <csv-path> <target-column> <date-column> [periods [confidence]]");
            System.exit(2);
        }
        try {
            DataTable table = CsvTableReader.read(Paths.get(args[0].trim()));
            int periods = args.length > 3 ? Integer.parseInt(args[3].trim()) : DEFAULT_PERIODS;
            double confidence = args.length > 4 ? Double.parseDouble(args[4].trim())
                : TimeSeriesForecaster.DEFAULT_CONFIDENCE_LEVEL;
            ForecastResult result = forecaster.analyze(table, args[1], args[2], periods, confidence);
            System.out.println(ForecastFormatter.format(result));
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            System.err.println("Forecast error: " + msg);
            System.exit(1);
        }
    }
}
