package com.refraction.core.solver.parallel;

import com.refraction.core.Board;
import com.refraction.core.Color;
import com.refraction.core.Position;
import com.refraction.core.TokenLayout;
import com.refraction.core.solver.BreadthFirstSolver;
import com.refraction.core.solver.SearchConstraints;
import com.refraction.core.solver.SearchResult;
import com.refraction.core.solver.Searcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Runs independent searches against one shared {@link Board} on a fixed pool of daemon
 * threads. Each search remains single-threaded; the board is read-only and needs no locking.
 */
public final class BatchSolver implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(BatchSolver.class.getName());

    private final Searcher searcher;
    private final ExecutorService executor;

    public BatchSolver() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public BatchSolver(int parallelism) {
        this(new BreadthFirstSolver(), parallelism);
    }

    /**
     * @param searcher a searcher that tolerates concurrent calls
     */
    public BatchSolver(Searcher searcher, int parallelism) {
        this.searcher = Objects.requireNonNull(searcher, "searcher");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, r -> {
            Thread thread = new Thread(r, "batch-solver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Solves every request and returns the results in request order.
     */
    public List<SearchResult> solveAll(Board board, List<SolveRequest> requests, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(requests, "requests");
        Objects.requireNonNull(constraints, "constraints");
        if (executor.isShutdown()) {
            throw new IllegalStateException("BatchSolver has been shut down");
        }

        long start = System.nanoTime();
        List<CompletableFuture<SearchResult>> futures = new ArrayList<>(requests.size());
        for (SolveRequest request : requests) {
            Objects.requireNonNull(request, "request");
            futures.add(CompletableFuture.supplyAsync(() -> searcher.findPath(board, request.layout(),
                    request.target(), request.goal(), constraints), executor));
        }

        List<SearchResult> results = new ArrayList<>(futures.size());
        try {
            for (CompletableFuture<SearchResult> future : futures) {
                results.add(future.join());
            }
        } catch (CompletionException ex) {
            futures.forEach(future -> future.cancel(true));
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw ex;
        }
        long solved = results.stream().filter(SearchResult::isSolved).count();
        LOGGER.info(() -> String.format("Batch of %d searches finished in %d ms, %d solved", requests.size(),
                (System.nanoTime() - start) / 1_000_000L, solved));
        return results;
    }

    public List<SearchResult> solveAll(Board board, List<SolveRequest> requests) {
        return solveAll(board, requests, SearchConstraints.defaults());
    }

    /**
     * Stops accepting work. Running searches finish normally.
     */
    public void shutdown() {
        executor.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * One search of a batch.
     */
    public record SolveRequest(TokenLayout layout, Color target, Position goal) {

        public SolveRequest {
            Objects.requireNonNull(layout, "layout");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(goal, "goal");
        }
    }
}
