package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.eks.SubnetRecord;
import com.clusterscope.cloud.dto.eks.VpcRecord;
import com.clusterscope.cloud.dto.eks.WorkloadIdentityBinding;
import com.clusterscope.cloud.dto.resolution.AggregatedResources;
import com.clusterscope.cloud.dto.resolution.ClusterIdentity;
import com.clusterscope.cloud.dto.resolution.ResourceCategory;
import com.clusterscope.cloud.exception.ProviderException;
import com.clusterscope.cloud.service.ClusterCloudGateway;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResourceAggregatorTest {

    private static final String REGION = "us-east-1";

    private final ClusterCloudGateway gateway = mock(ClusterCloudGateway.class);
    private final ResourceAggregator aggregator = new ResourceAggregator();

    @Test
    void collectsEveryCategory() {
        stubAllSucceeding();

        AggregatedResources resources = aggregator.aggregate(TestRuns.run(gateway, "prod"), identity("vpc-1"), REGION);

        assertThat(resources.getVpc().getVpcId()).isEqualTo("vpc-1");
        assertThat(resources.getSubnets()).extracting(SubnetRecord::getSubnetId).containsExactly("subnet-a");
        assertThat(resources.getInstances()).extracting(ComputeInstance::getInstanceId).containsExactly("i-0123");
        assertThat(resources.getWorkloadIdentityBindings()).hasSize(1);
        assertThat(resources.getFailures()).isEmpty();
        assertThat(resources.getSkipped()).isEmpty();
    }

    @Test
    void subnetFailureDoesNotAffectOtherCategories() {
        stubAllSucceeding();
        when(gateway.listSubnets(REGION, "vpc-1")).thenThrow(new RuntimeException("UnauthorizedOperation"));

        AggregatedResources resources = aggregator.aggregate(TestRuns.run(gateway, "prod"), identity("vpc-1"), REGION);

        assertThat(resources.getSubnets()).isEmpty();
        assertThat(resources.getInstances()).hasSize(1);
        assertThat(resources.getVpc()).isNotNull();
        assertThat(resources.getFailures()).containsOnlyKeys(ResourceCategory.SUBNETS);
        assertThat(resources.getFailures().get(ResourceCategory.SUBNETS).getMessage())
                .isEqualTo("Failed to listSubnets: UnauthorizedOperation");
    }

    @Test
    void bindingFailureIsRecordedWithItsCredentialClassification() {
        stubAllSucceeding();
        when(gateway.listWorkloadIdentityBindings(REGION, "prod"))
                .thenThrow(new ProviderException("Failed to list pod identities: ExpiredTokenException"));

        AggregatedResources resources = aggregator.aggregate(TestRuns.run(gateway, "prod"), identity("vpc-1"), REGION);

        assertThat(resources.getWorkloadIdentityBindings()).isEmpty();
        assertThat(resources.getSubnets()).hasSize(1);
        assertThat(resources.getFailures()).containsOnlyKeys(ResourceCategory.WORKLOAD_IDENTITY_BINDINGS);
        assertThat(resources.getFailures().get(ResourceCategory.WORKLOAD_IDENTITY_BINDINGS).isCredentialRelated())
                .isTrue();
    }

    @Test
    void skipsNetworkCategoriesWithoutAVpcButStillFetchesBindings() {
        stubAllSucceeding();

        AggregatedResources resources = aggregator.aggregate(TestRuns.run(gateway, "prod"), identity(null), REGION);

        assertThat(resources.getSkipped()).containsExactlyInAnyOrder(
                ResourceCategory.VPC, ResourceCategory.SUBNETS, ResourceCategory.COMPUTE_INSTANCES);
        assertThat(resources.getVpc()).isNull();
        assertThat(resources.getSubnets()).isEmpty();
        assertThat(resources.getWorkloadIdentityBindings()).hasSize(1);
        verify(gateway, never()).getVpcDetails(anyString(), anyString());
        verify(gateway, never()).listSubnets(anyString(), anyString());
        verify(gateway, never()).listComputeInstances(anyString(), anyString(), anyString());
    }

    @Test
    void nullResultsBecomeEmpty() {
        when(gateway.listSubnets(REGION, "vpc-1")).thenReturn(null);

        AggregatedResources resources = aggregator.aggregate(TestRuns.run(gateway, "prod"), identity("vpc-1"), REGION);

        assertThat(resources.getSubnets()).isEmpty();
        assertThat(resources.getFailures()).isEmpty();
    }

    @Test
    void slowFetchTimesOutWithoutHoldingTheOthers() throws Exception {
        stubAllSucceeding();
        CountDownLatch release = new CountDownLatch(1);
        when(gateway.listComputeInstances(REGION, "vpc-1", "prod")).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            ResolutionRun run = new ResolutionRun(1, "prod", false, gateway, executor, Duration.ofMillis(200), () -> 1L);

            AggregatedResources resources = aggregator.aggregate(run, identity("vpc-1"), REGION);

            assertThat(resources.getFailures()).containsOnlyKeys(ResourceCategory.COMPUTE_INSTANCES);
            assertThat(resources.getFailures().get(ResourceCategory.COMPUTE_INSTANCES).getMessage())
                    .contains("timed out");
            assertThat(resources.getSubnets()).hasSize(1);
            assertThat(resources.getWorkloadIdentityBindings()).hasSize(1);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    private void stubAllSucceeding() {
        when(gateway.getVpcDetails(REGION, "vpc-1")).thenReturn(Optional.of(VpcRecord.builder()
                .vpcId("vpc-1").name("main").cidrBlock("10.0.0.0/16").state("available").build()));
        when(gateway.listSubnets(REGION, "vpc-1")).thenReturn(List.of(SubnetRecord.builder()
                .subnetId("subnet-a").cidrBlock("10.0.1.0/24").availabilityZone("us-east-1a").build()));
        when(gateway.listComputeInstances(REGION, "vpc-1", "prod")).thenReturn(List.of(ComputeInstance.builder()
                .instanceId("i-0123").name("worker").state("running").build()));
        when(gateway.listWorkloadIdentityBindings(REGION, "prod")).thenReturn(List.of(WorkloadIdentityBinding.builder()
                .associationId("a-1").clusterName("prod").namespace("default").serviceAccount("app").build()));
    }

    private static ClusterIdentity identity(String vpcId) {
        return ClusterIdentity.builder().resolvedName("prod").candidates(List.of("prod")).vpcId(vpcId).build();
    }
}
