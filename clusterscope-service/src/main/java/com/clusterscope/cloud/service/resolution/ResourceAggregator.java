package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.eks.SubnetRecord;
import com.clusterscope.cloud.dto.eks.VpcRecord;
import com.clusterscope.cloud.dto.eks.WorkloadIdentityBinding;
import com.clusterscope.cloud.dto.resolution.AggregatedResources;
import com.clusterscope.cloud.dto.resolution.CategoryFailure;
import com.clusterscope.cloud.dto.resolution.ClusterIdentity;
import com.clusterscope.cloud.dto.resolution.ResourceCategory;
import com.clusterscope.cloud.exception.CloudResolutionException;
import com.clusterscope.cloud.service.ClusterCloudGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Fetches the cluster's cloud resources concurrently. Each category fails on its own: a failure is
 * recorded against that category and the others carry on. Returns once every fetch has settled.
 */
@Component
public class ResourceAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ResourceAggregator.class);

    public AggregatedResources aggregate(ResolutionRun run, ClusterIdentity identity, String region) {
        ClusterCloudGateway gateway = run.gateway();
        String vpcId = identity.getVpcId();
        String clusterName = identity.getResolvedName();
        Map<ResourceCategory, CategoryFailure> failures = new ConcurrentHashMap<>();
        Set<ResourceCategory> skipped = EnumSet.noneOf(ResourceCategory.class);
        List<CompletableFuture<?>> fetches = new ArrayList<>();

        CompletableFuture<Optional<VpcRecord>> vpc;
        CompletableFuture<List<SubnetRecord>> subnets;
        CompletableFuture<List<ComputeInstance>> instances;
        if (vpcId != null && !vpcId.isEmpty()) {
            vpc = fetch(run, ResourceCategory.VPC, () -> gateway.getVpcDetails(region, vpcId),
                    Optional.empty(), failures);
            subnets = fetch(run, ResourceCategory.SUBNETS, () -> gateway.listSubnets(region, vpcId),
                    Collections.emptyList(), failures);
            instances = fetch(run, ResourceCategory.COMPUTE_INSTANCES,
                    () -> gateway.listComputeInstances(region, vpcId, clusterName),
                    Collections.emptyList(), failures);
            fetches.add(vpc);
            fetches.add(subnets);
            fetches.add(instances);
        } else {
            logger.warn("No VPC id resolved for cluster {}; skipping VPC, subnet and instance fetches", clusterName);
            vpc = CompletableFuture.completedFuture(Optional.empty());
            subnets = CompletableFuture.completedFuture(Collections.emptyList());
            instances = CompletableFuture.completedFuture(Collections.emptyList());
            for (ResourceCategory category : ResourceCategory.values()) {
                if (category.isRequiresVpc()) {
                    skipped.add(category);
                }
            }
        }
        CompletableFuture<List<WorkloadIdentityBinding>> bindings = fetch(run,
                ResourceCategory.WORKLOAD_IDENTITY_BINDINGS,
                () -> gateway.listWorkloadIdentityBindings(region, clusterName),
                Collections.emptyList(), failures);
        fetches.add(bindings);

        CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0])).join();

        Map<ResourceCategory, CategoryFailure> orderedFailures = new EnumMap<>(ResourceCategory.class);
        orderedFailures.putAll(failures);
        logger.info("Aggregated resources for cluster {}: {} subnets, {} instances, {} pod identities, {} failed",
                clusterName, subnets.join().size(), instances.join().size(), bindings.join().size(),
                orderedFailures.keySet());
        return AggregatedResources.builder()
                .vpc(vpc.join().orElse(null))
                .subnets(subnets.join())
                .instances(instances.join())
                .workloadIdentityBindings(bindings.join())
                .failures(Collections.unmodifiableMap(orderedFailures))
                .skipped(Collections.unmodifiableSet(skipped))
                .build();
    }

    private <T> CompletableFuture<T> fetch(ResolutionRun run, ResourceCategory category, Supplier<T> call,
                                           T fallback, Map<ResourceCategory, CategoryFailure> failures) {
        return run.submit(call)
                .thenApply(value -> value != null ? value : fallback)
                .exceptionally(error -> {
                    CloudResolutionException failure = run.translate(category.getOperation(), error);
                    logger.warn("Failed to fetch {}: {}", category, failure.getMessage());
                    failures.put(category, new CategoryFailure(category, failure.getMessage(),
                            failure.isCredentialRelated()));
                    return fallback;
                });
    }
}
