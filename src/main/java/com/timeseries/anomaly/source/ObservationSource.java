package com.timeseries.anomaly.source;

import com.timeseries.anomaly.model.Observation;

import java.util.Optional;

/**
 * Finite, ordered, replayable pull-based sequence of observations. Pacing is the caller's concern.
 */
public interface ObservationSource {

    /**
     * @return the next observation, or empty once the source is exhausted
     */
    Optional<Observation> next();

    /** Rewind to position zero. */
    void reset();

    /**
     * Advance past up to {@code count} observations without returning them.
     *
     * @return how many were actually skipped
     */
    int skip(int count);

    int position();

    int size();
}
