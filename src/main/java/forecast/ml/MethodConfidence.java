package forecast.ml;

public enum MethodConfidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String label;

    MethodConfidence(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }
}
