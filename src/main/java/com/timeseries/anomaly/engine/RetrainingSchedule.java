package com.timeseries.anomaly.engine;

/**
 * Decides when the engine retrains, counted in buffered observations rather than wall time.
 * <ul>
 *   <li>phase 0 (cold): once the buffer holds {@code shortThreshold} observations</li>
 *   <li>phase 1 (short-horizon): once the buffer holds {@code mediumThreshold} observations</li>
 *   <li>phase 2+ : every {@code recurringThreshold} observations since the last training</li>
 * </ul>
 */
public class RetrainingSchedule {

    private final int shortThreshold;
    private final int mediumThreshold;
    private final int recurringThreshold;

    public RetrainingSchedule(int shortThreshold, int mediumThreshold, int recurringThreshold) {
        if (shortThreshold <= 0 || mediumThreshold <= 0 || recurringThreshold <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Retraining thresholds must be positive: short=%d, medium=%d, recurring=%d",
                    shortThreshold, mediumThreshold, recurringThreshold));
        }
        this.shortThreshold = shortThreshold;
        this.mediumThreshold = mediumThreshold;
        this.recurringThreshold = recurringThreshold;
    }

    public boolean isDue(int phase, int bufferSize, int lastTrainedBufferSize) {
        if (phase == 0) {
            return bufferSize >= shortThreshold;
        }
        if (phase == 1) {
            return bufferSize >= mediumThreshold;
        }
        return bufferSize - lastTrainedBufferSize >= recurringThreshold;
    }

    public static String phaseName(int phase) {
        switch (phase) {
            case 0:
                return "cold";
            case 1:
                return "short-horizon";
            case 2:
                return "medium-horizon";
            default:
                return "steady-state";
        }
    }
}
