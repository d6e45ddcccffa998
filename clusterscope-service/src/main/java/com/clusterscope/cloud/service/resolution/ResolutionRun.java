package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.exception.CloudResolutionException;
import com.clusterscope.cloud.exception.ProviderException;
import com.clusterscope.cloud.service.ClusterCloudGateway;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Everything one resolution run shares between its stages: the gateway, the generation it was
 * started with, and the bounded way of calling out to the gateway.
 */
public class ResolutionRun {

    private final long generation;
    private final String clusterContext;
    private final boolean freshCredentials;
    private final ClusterCloudGateway gateway;
    private final Executor fetchExecutor;
    private final Duration fetchTimeout;
    private final LongSupplier latestGeneration;

    public ResolutionRun(long generation, String clusterContext, boolean freshCredentials,
                         ClusterCloudGateway gateway, Executor fetchExecutor, Duration fetchTimeout,
                         LongSupplier latestGeneration) {
        this.generation = generation;
        this.clusterContext = clusterContext;
        this.freshCredentials = freshCredentials;
        this.gateway = gateway;
        this.fetchExecutor = fetchExecutor;
        this.fetchTimeout = fetchTimeout;
        this.latestGeneration = latestGeneration;
    }

    public long getGeneration() {
        return generation;
    }

    public String getClusterContext() {
        return clusterContext;
    }

    /** True when this run was started by a user-initiated credential retry. */
    public boolean isFreshCredentials() {
        return freshCredentials;
    }

    public ClusterCloudGateway gateway() {
        return gateway;
    }

    public boolean isSuperseded() {
        return latestGeneration.getAsLong() != generation;
    }

    public void ensureCurrent() {
        if (isSuperseded()) {
            throw new SupersededRunException(generation, latestGeneration.getAsLong());
        }
    }

    /**
     * Starts a gateway call on the fetch executor, failing with a {@link TimeoutException} once the
     * fetch timeout has passed.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> call) {
        return CompletableFuture.supplyAsync(call, fetchExecutor)
                .orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Runs a gateway call and waits for it, translating every failure into a
     * {@link CloudResolutionException}.
     */
    public <T> T call(String operation, Supplier<T> call) {
        try {
            return submit(call).join();
        } catch (CompletionException e) {
            throw translate(operation, e.getCause() != null ? e.getCause() : e);
        }
    }

    public CloudResolutionException translate(String operation, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof CloudResolutionException) {
            return (CloudResolutionException) cause;
        }
        if (cause instanceof TimeoutException) {
            return ProviderException.timeout(operation, fetchTimeout);
        }
        return ProviderException.from(operation, cause);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
