package forecast.error;

/** Target or date column is not present in the input table. */
public class MissingColumnException extends ValidationException {

    public MissingColumnException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "MissingColumnError";
    }
}
