package com.example.ecotravel.planner.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs calls to external collaborators (tools, embedding, vector query, generation, NLU model)
 * on a bounded pool with a hard timeout, so a conversation lock is never held across an
 * unbounded wait. A timed-out call is cancelled with interruption.
 */
@Component
public class ExternalCallGuard {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallGuard.class);

    private final ExecutorService executor;

    public ExternalCallGuard(@Qualifier("externalCallExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * @throws TimeoutException     the call did not finish within {@code timeoutMs}
     * @throws ExecutionException   the call threw; the original exception is the cause
     * @throws InterruptedException the calling thread was interrupted while waiting
     */
    public <T> T call(String name, Callable<T> task, long timeoutMs)
            throws TimeoutException, ExecutionException, InterruptedException {
        long start = System.currentTimeMillis();
        Future<T> future = executor.submit(task);
        try {
            T out = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            log.debug("[ExternalCallGuard] {} done in {} ms", name, System.currentTimeMillis() - start);
            return out;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[ExternalCallGuard] {} timed out after {} ms", name, timeoutMs);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }
}
