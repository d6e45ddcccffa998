package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.dto.k8s.ClusterNode;
import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.resolution.AggregatedResources;
import com.clusterscope.cloud.dto.resolution.AuthStatus;
import com.clusterscope.cloud.dto.resolution.ClusterIdentity;
import com.clusterscope.cloud.dto.resolution.ResolutionState;
import com.clusterscope.cloud.dto.resolution.ResolutionStatus;
import com.clusterscope.cloud.exception.AuthRequiredException;
import com.clusterscope.cloud.exception.CloudResolutionException;
import com.clusterscope.cloud.exception.ProviderException;
import com.clusterscope.cloud.service.ClusterCloudGateway;
import com.clusterscope.cloud.service.ResolutionUpdateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves the cloud-side picture of a cluster context:
 * region, auth, cluster identity, then a concurrent resource fetch and node correlation.
 * <p>
 * Every refresh gets a new generation. Snapshots are published whole, and a snapshot from an older
 * generation than the current one is dropped.
 */
@Service
public class CloudResolutionService {

    private static final Logger logger = LoggerFactory.getLogger(CloudResolutionService.class);

    private final ClusterCloudGateway gateway;
    private final RegionDetector regionDetector;
    private final AuthProbe authProbe;
    private final ClusterIdentityResolver identityResolver;
    private final ResourceAggregator resourceAggregator;
    private final NodeInstanceCorrelator correlator;
    private final ResolutionUpdateService updateService;
    private final Executor resolutionExecutor;
    private final Executor fetchExecutor;
    private final Duration fetchTimeout;

    private final AtomicLong generations = new AtomicLong();
    private final AtomicReference<ResolutionState> current = new AtomicReference<>(ResolutionState.initial());
    private volatile String lastClusterContext;

    public CloudResolutionService(ClusterCloudGateway gateway,
                                  RegionDetector regionDetector,
                                  AuthProbe authProbe,
                                  ClusterIdentityResolver identityResolver,
                                  ResourceAggregator resourceAggregator,
                                  NodeInstanceCorrelator correlator,
                                  ResolutionUpdateService updateService,
                                  @Qualifier("resolutionTaskExecutor") Executor resolutionExecutor,
                                  @Qualifier("awsTaskExecutor") Executor fetchExecutor,
                                  @Value("${clusterscope.resolution.fetch-timeout:20s}") Duration fetchTimeout) {
        this.gateway = gateway;
        this.regionDetector = regionDetector;
        this.authProbe = authProbe;
        this.identityResolver = identityResolver;
        this.resourceAggregator = resourceAggregator;
        this.correlator = correlator;
        this.updateService = updateService;
        this.resolutionExecutor = resolutionExecutor;
        this.fetchExecutor = fetchExecutor;
        this.fetchTimeout = fetchTimeout;
    }

    public ResolutionState getState() {
        return current.get();
    }

    /**
     * Starts a new run for the context. The returned future completes with the run's last snapshot,
     * which is not necessarily the current state if a newer refresh started in the meantime.
     */
    public CompletableFuture<ResolutionState> refresh(String clusterContext) {
        return start(clusterContext, false);
    }

    /**
     * Clears the credential cache and reruns the last refreshed context.
     */
    public CompletableFuture<ResolutionState> retryWithClearedCredentials() {
        String context = lastClusterContext;
        if (context == null) {
            throw new IllegalStateException("No cluster context has been refreshed yet");
        }
        logger.info("Retrying resolution of {} with cleared credentials", context);
        gateway.clearCredentialCache();
        return start(context, true);
    }

    public void restartApplication() {
        gateway.restartApplicationProcess();
    }

    private CompletableFuture<ResolutionState> start(String clusterContext, boolean freshCredentials) {
        if (clusterContext == null || clusterContext.isBlank()) {
            throw new IllegalArgumentException("Cluster context is required");
        }
        long generation = generations.incrementAndGet();
        lastClusterContext = clusterContext;
        ResolutionRun run = new ResolutionRun(generation, clusterContext, freshCredentials, gateway,
                fetchExecutor, fetchTimeout, generations::get);
        ResolutionState idle = ResolutionState.idle(generation, clusterContext);
        publish(idle);
        logger.info("Starting resolution run {} for context {}", generation, clusterContext);
        try {
            return CompletableFuture.supplyAsync(() -> execute(run, idle), resolutionExecutor);
        } catch (RejectedExecutionException e) {
            logger.error("Resolution run {} for {} was rejected by the executor", generation, clusterContext, e);
            return CompletableFuture.completedFuture(finish(run, idle.toBuilder()
                    .status(ResolutionStatus.ERROR)
                    .error(new ProviderException("Resolution could not be scheduled: " + e.getMessage(), e)
                            .toResolutionError())));
        }
    }

    ResolutionState execute(ResolutionRun run, ResolutionState idle) {
        ResolutionState state = idle;
        try {
            state = advance(run, state.toBuilder().status(ResolutionStatus.DETECTING_REGION));

            List<ClusterNode> nodes = run.call("list nodes", () -> gateway.listNodes(run.getClusterContext()));
            String region = regionDetector.detect(nodes);
            state = advance(run, state.toBuilder()
                    .nodes(List.copyOf(nodes))
                    .region(region)
                    .authStatus(AuthStatus.CHECKING)
                    .status(ResolutionStatus.CHECKING_AUTH));

            AuthProbeResult auth = authProbe.probe(run, region);
            switch (auth.getOutcome()) {
                case UNAUTHENTICATED:
                    return finish(run, state.toBuilder()
                            .authStatus(AuthStatus.UNAUTHENTICATED)
                            .status(ResolutionStatus.UNAUTHENTICATED)
                            .error(new AuthRequiredException(region, auth.getReason()).toResolutionError()));
                case PROBE_ERROR:
                    throw new ProviderException("AWS auth check failed: " + auth.getReason());
                default:
                    break;
            }
            state = advance(run, state.toBuilder()
                    .authStatus(AuthStatus.AUTHENTICATED)
                    .callerIdentity(auth.getIdentity())
                    .status(ResolutionStatus.RESOLVING_IDENTITY));

            ClusterIdentity identity = identityResolver.resolve(run, region, nodes.get(0));
            state = advance(run, state.toBuilder()
                    .identity(identity)
                    .vpcId(identity.getVpcId())
                    .status(ResolutionStatus.AGGREGATING));

            AggregatedResources resources = resourceAggregator.aggregate(run, identity, region);
            List<ComputeInstance> instances = correlator.correlate(nodes, resources.getInstances());
            return finish(run, state.toBuilder()
                    .vpc(resources.getVpc())
                    .subnets(resources.getSubnets())
                    .instances(instances)
                    .workloadIdentityBindings(resources.getWorkloadIdentityBindings())
                    .categoryFailures(resources.getFailures())
                    .skippedCategories(resources.getSkipped())
                    .status(ResolutionStatus.READY));
        } catch (SupersededRunException e) {
            logger.info(e.getMessage());
            return state;
        } catch (CloudResolutionException e) {
            logger.error("Resolution run {} for {} failed: {}", run.getGeneration(), run.getClusterContext(),
                    e.getMessage(), e);
            return finish(run, state.toBuilder()
                    .status(ResolutionStatus.ERROR)
                    .error(e.toResolutionError()));
        } catch (RuntimeException e) {
            logger.error("Resolution run {} for {} failed unexpectedly", run.getGeneration(),
                    run.getClusterContext(), e);
            return finish(run, state.toBuilder()
                    .status(ResolutionStatus.ERROR)
                    .error(ProviderException.from("load AWS resources", e).toResolutionError()));
        }
    }

    private ResolutionState advance(ResolutionRun run, ResolutionState.ResolutionStateBuilder next) {
        run.ensureCurrent();
        ResolutionState state = next.updatedAt(Instant.now()).build();
        if (!publish(state)) {
            throw new SupersededRunException(run.getGeneration(), generations.get());
        }
        return state;
    }

    private ResolutionState finish(ResolutionRun run, ResolutionState.ResolutionStateBuilder next) {
        ResolutionState state = next.updatedAt(Instant.now()).build();
        if (publish(state)) {
            logger.info("Resolution run {} for {} finished with status {}", run.getGeneration(),
                    run.getClusterContext(), state.getStatus());
        }
        return state;
    }

    /**
     * Accepts a snapshot only if it belongs to the current generation. The check and the push happen
     * under one lock.
     */
    private synchronized boolean publish(ResolutionState state) {
        ResolutionState previous = current.get();
        if (state.getGeneration() < previous.getGeneration() || state.getGeneration() != generations.get()) {
            logger.warn("Dropping stale snapshot of run {} (current run {})", state.getGeneration(),
                    Math.max(previous.getGeneration(), generations.get()));
            return false;
        }
        current.set(state);
        updateService.sendUpdate(state);
        return true;
    }
}
