package com.flagship.bounty_ledger.collaborator;

import com.flagship.bounty_ledger.exception.CollaboratorException;
import com.flagship.bounty_ledger.exception.CollaboratorTimeoutException;
import com.flagship.bounty_ledger.observability.OrchestrationMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs collaborator calls on per-collaborator executors with a hard time bound.
 *
 * Every failure comes back as a {@link CollaboratorException}: a timeout as
 * {@link CollaboratorTimeoutException}, anything the call threw wrapped with the collaborator's name.
 * A timed-out call is cancelled; the caller never waits past the bound.
 */
@Component
@Slf4j
public class BoundedCaller {

    private final OrchestrationMetrics metrics;
    private final Map<Collaborator, ExecutorService> executors = new EnumMap<>(Collaborator.class);

    public BoundedCaller(OrchestrationMetrics metrics) {
        this.metrics = metrics;
        for (Collaborator collaborator : Collaborator.values()) {
            executors.put(collaborator, Executors.newFixedThreadPool(
                    collaborator.getMaxInFlight(), namedDaemonThreads(collaborator)));
        }
    }

    public <T> T call(Collaborator collaborator, Duration timeout, Callable<T> call) {
        String name = collaborator.getDisplayName();
        long start = System.nanoTime();
        boolean success = false;
        Future<T> future = executors.get(collaborator).submit(call);
        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            success = true;
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} call timed out after {}", name, timeout);
            throw new CollaboratorTimeoutException(name, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CollaboratorException(name, name + " call interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CollaboratorException) {
                throw (CollaboratorException) cause;
            }
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new CollaboratorException(name, name + " call failed: " + message, cause);
        } finally {
            metrics.recordCollaboratorCall(collaborator.name(), success, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @PreDestroy
    public void shutdown() {
        executors.values().forEach(ExecutorService::shutdownNow);
    }

    private static ThreadFactory namedDaemonThreads(Collaborator collaborator) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = collaborator.name().toLowerCase().replace('_', '-') + "-";
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
