package com.bo.knowledge.model;

/**
 * Confidence band selected by the execution outcome
 * The routing confidence places the final score inside the band
 */
public enum ConfidenceBand {

    /** Successful direct lookup */
    CLEAN(0.80, 0.95),

    /** Successful lookup of a filter or comparison question */
    COMPLEX(0.70, 0.89),

    /** Answered by the fallback tool */
    FALLBACK(0.50, 0.79),

    /** Failed, timed out, or found nothing */
    FAILED(0.00, 0.49);

    private final double low;
    private final double high;

    ConfidenceBand(double low, double high) {
        this.low = low;
        this.high = high;
    }

    public double low() {
        return low;
    }

    public double high() {
        return high;
    }

    /**
     * Linear position inside the band, fraction is clamped to [0, 1]
     */
    public double interpolate(double fraction) {
        double f = Math.max(0.0, Math.min(1.0, fraction));
        return low + (high - low) * f;
    }
}
