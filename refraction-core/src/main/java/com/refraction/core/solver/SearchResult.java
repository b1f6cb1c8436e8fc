package com.refraction.core.solver;

import com.refraction.core.TokenLayout;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations. Diagnostics are filled in for
 * every status; {@code actions} and {@code finalLayout} are only meaningful when solved.
 */
public record SearchResult(
        SearchStatus status,
        List<Action> actions,
        long statesExplored,
        Duration elapsed,
        TokenLayout finalLayout,
        SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(elapsed, "elapsed");
        actions = actions == null ? List.of() : List.copyOf(actions);
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
        if (status.isSuccess() && finalLayout == null) {
            throw new IllegalArgumentException("A solved result needs a final layout");
        }
    }

    static SearchResult failure(SearchStatus status, long statesExplored, Duration elapsed,
            SearchTelemetry telemetry) {
        return new SearchResult(status, List.of(), statesExplored, elapsed, null, telemetry);
    }

    public boolean isSolved() {
        return status.isSuccess();
    }

    public int actionCount() {
        return actions.size();
    }
}
