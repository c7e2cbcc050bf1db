package forecast.error;

/** Too few usable rows, or a non-positive number of forecast periods. */
public class InsufficientDataException extends ValidationException {

    public InsufficientDataException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "InsufficientDataError";
    }
}
