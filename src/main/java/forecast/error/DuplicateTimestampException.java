package forecast.error;

/** Two rows share the same timestamp. */
public class DuplicateTimestampException extends ValidationException {

    public DuplicateTimestampException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "DuplicateTimestampError";
    }
}
