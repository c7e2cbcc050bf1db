package forecast.error;

/**
 * Input rejected before any numeric work starts. Each subclass names one failure kind;
 * {@link #kind()} is the stable identifier reported to callers (e.g. in HTTP error bodies).
 */
public abstract class ValidationException extends IllegalArgumentException {

    protected ValidationException(String message) {
        super(message);
    }

    public abstract String kind();
}
