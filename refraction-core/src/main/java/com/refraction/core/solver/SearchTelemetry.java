package com.refraction.core.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-layer instrumentation captured during a single {@link Searcher#findPath} call.
 */
public final class SearchTelemetry {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(List.of());

    private final List<Layer> layers;

    public SearchTelemetry(List<Layer> layers) {
        if (layers == null || layers.isEmpty()) {
            this.layers = List.of();
        } else {
            this.layers = Collections.unmodifiableList(new ArrayList<>(layers));
        }
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public List<Layer> layers() {
        return layers;
    }

    public Layer latest() {
        return layers.isEmpty() ? null : layers.get(layers.size() - 1);
    }

    public long totalDequeued() {
        return layers.stream().mapToLong(Layer::dequeued).sum();
    }

    public long totalEnqueued() {
        return layers.stream().mapToLong(Layer::enqueued).sum();
    }

    public long totalDuplicates() {
        return layers.stream().mapToLong(Layer::duplicates).sum();
    }

    public long totalSingleActionRejections() {
        return layers.stream().mapToLong(Layer::singleActionRejections).sum();
    }

    public long totalElapsedNanos() {
        return layers.stream().mapToLong(Layer::elapsedNanos).sum();
    }

    /**
     * Counters for the states dequeued at one depth.
     */
    public record Layer(
            int depth,
            long dequeued,
            long enqueued,
            long duplicates,
            long singleActionRejections,
            long elapsedNanos) {

        public double elapsedMillis() {
            return elapsedNanos / 1_000_000.0;
        }
    }
}
