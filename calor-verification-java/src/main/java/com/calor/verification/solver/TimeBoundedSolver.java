package com.calor.verification.solver;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * Runs a delegate solver with a wall-clock budget. A call that exceeds the budget, is
 * interrupted or fails is reported as {@link VerificationStatus#SKIPPED}, which the cache
 * never stores.
 */
public class TimeBoundedSolver implements ConstraintSolver, AutoCloseable {

    private final ConstraintSolver delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeBoundedSolver(ConstraintSolver delegate, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "calor-solver");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String version() {
        return delegate.version();
    }

    @Override
    public VerificationResult verify(ContractQuery query) {
        long start = System.nanoTime();
        Future<VerificationResult> future = executor.submit(() -> delegate.verify(query));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            System.err.println("[calor-verifier] WARNING: solver timed out after "
                    + timeout.toMillis() + " ms on " + query.label());
            return VerificationResult.skipped(elapsedSince(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return VerificationResult.skipped(elapsedSince(start));
        } catch (ExecutionException e) {
            System.err.println("[calor-verifier] WARNING: solver failed on " + query.label()
                    + ": " + e.getCause());
            return VerificationResult.skipped(elapsedSince(start));
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
