package forecast.error;

/**
 * Numeric failure inside a forecast engine, e.g. a degenerate fit or a non-finite result.
 */
public class ForecastException extends RuntimeException {

    public ForecastException(String message) {
        super(message);
    }

    public ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
