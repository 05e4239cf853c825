package in.co.jathakam.pojos;

import java.util.Objects;

/**
 * Result of a chart request: either a complete {@link ChartResult} or the reason there is none.
 * A failed outcome never carries a partial chart.
 */
public final class ChartOutcome {

    private final ChartResult chart;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private ChartOutcome(ChartResult chart, ErrorKind errorKind, String errorMessage) {
        this.chart = chart;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static ChartOutcome success(ChartResult chart) {
        return new ChartOutcome(Objects.requireNonNull(chart, "chart"), null, null);
    }

    public static ChartOutcome failure(ErrorKind errorKind, String errorMessage) {
        return new ChartOutcome(null, Objects.requireNonNull(errorKind, "errorKind"), errorMessage);
    }

    public boolean isSuccess() {
        return chart != null;
    }

    /** The chart; null for a failed outcome. */
    public ChartResult getChart() {
        return chart;
    }

    /** Failure category; null for a successful outcome. */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ChartOutcome{success}" : "ChartOutcome{" + errorKind + ": " + errorMessage + "}";
    }
}
