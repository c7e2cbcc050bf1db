package forecast.error;

/** A date cell is missing or cannot be parsed. */
public class InvalidDateException extends ValidationException {

    public InvalidDateException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "InvalidDateError";
    }
}
