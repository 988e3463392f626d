package com.timeseries.anomaly.source;

import com.timeseries.anomaly.model.Observation;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory source over a fixed list. The position is readable from any thread.
 */
public class ReplayableObservationSource implements ObservationSource {

    private final List<Observation> observations;
    private final AtomicInteger position = new AtomicInteger();

    public ReplayableObservationSource(List<Observation> observations) {
        this.observations = List.copyOf(observations);
    }

    @Override
    public Optional<Observation> next() {
        int index = position.get();
        if (index >= observations.size()) {
            return Optional.empty();
        }
        position.set(index + 1);
        return Optional.of(observations.get(index));
    }

    @Override
    public void reset() {
        position.set(0);
    }

    @Override
    public int skip(int count) {
        int from = position.get();
        int to = Math.min(observations.size(), from + Math.max(0, count));
        position.set(to);
        return to - from;
    }

    @Override
    public int position() {
        return position.get();
    }

    @Override
    public int size() {
        return observations.size();
    }
}
