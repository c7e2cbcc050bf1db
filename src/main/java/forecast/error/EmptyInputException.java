package forecast.error;

/** Input table has no rows. */
public class EmptyInputException extends ValidationException {

    public EmptyInputException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "EmptyInputError";
    }
}
