package forecast.error;

/** Target column holds non-numeric values. */
public class NonNumericTargetException extends ValidationException {

    public NonNumericTargetException(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "NonNumericTargetError";
    }
}
