package forecast.ml;

/** The four forecasting methods. */
public enum MethodVariant {
    LINEAR_REGRESSION("Linear Regression"),
    SIMPLE_EXPONENTIAL_SMOOTHING("Simple Exponential Smoothing"),
    DOUBLE_EXPONENTIAL_SMOOTHING("Double Exponential Smoothing"),
    SEASONAL_DECOMPOSITION("Seasonal Decomposition");

    private final String displayName;

    MethodVariant(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }
}
