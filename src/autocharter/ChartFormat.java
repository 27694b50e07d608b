package autocharter;

/**
 * Output formats a chart can be written in.
 */
public enum ChartFormat {
    JSON("json"),
    CHART_TEXT("chart");

    private final String extension;

    ChartFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /** Accepts "json", "chart" and "chart-text", case-insensitively. */
    public static ChartFormat fromLabel(String label) throws ChartingException {
        if (label != null) {
            String l = label.trim();
            if (l.equalsIgnoreCase("json")) return JSON;
            if (l.equalsIgnoreCase("chart") || l.equalsIgnoreCase("chart-text")) return CHART_TEXT;
        }
        throw new ChartingException(ChartingException.Kind.INVALID_CONFIG, "Invalid format: " + label);
    }
}
