package com.clusterscope.cloud.service.resolution;

import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.eks.ManagedClusterRecord;
import com.clusterscope.cloud.dto.resolution.CandidateAttempt;
import com.clusterscope.cloud.dto.resolution.ClusterIdentity;
import com.clusterscope.cloud.exception.ClusterIdentityNotFoundException;
import com.clusterscope.cloud.exception.ProviderException;
import com.clusterscope.cloud.service.ClusterCloudGateway;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.Map;
import java.util.Optional;

import static com.clusterscope.cloud.service.resolution.TestRuns.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClusterIdentityResolverTest {

    private static final String REGION = "us-east-1";

    private final ClusterCloudGateway gateway = mock(ClusterCloudGateway.class);
    private final ClusterIdentityResolver resolver = new ClusterIdentityResolver("-eks");

    @Test
    void candidatesAreOrderedAndDeduplicated() {
        assertThat(resolver.candidates("prod-eks", "prod")).containsExactly("prod-eks", "prod");
        assertThat(resolver.candidates("shared", "prod")).containsExactly("shared", "prod", "prod-eks");
        assertThat(resolver.candidates(null, "prod")).containsExactly("prod", "prod-eks");
        assertThat(resolver.candidates("prod", "prod")).containsExactly("prod", "prod-eks");
    }

    @Test
    void tagDerivedNameIsTriedFirstAndStopsTheSearch() {
        when(gateway.getInstanceDetails(REGION, "i-0123")).thenReturn(Optional.of(instance("vpc-from-instance",
                Map.of("kubernetes.io/cluster/payments", "owned"))));
        when(gateway.getManagedCluster(REGION, "payments")).thenReturn(Optional.of(cluster("payments", "vpc-other")));

        ClusterIdentity identity = resolver.resolve(TestRuns.run(gateway, "prod"), REGION,
                node("n1", "aws:///us-east-1a/i-0123"));

        assertThat(identity.getResolvedName()).isEqualTo("payments");
        assertThat(identity.getTagDerivedName()).isEqualTo("payments");
        assertThat(identity.getCandidates()).containsExactly("payments", "prod", "prod-eks");
        assertThat(identity.getVpcId()).isEqualTo("vpc-from-instance");
        verify(gateway, times(1)).getManagedCluster(anyString(), anyString());
    }

    @Test
    void duplicateCandidatesAreOnlyLookedUpOnce() {
        when(gateway.getInstanceDetails(REGION, "i-0123")).thenReturn(Optional.of(instance("vpc-1",
                Map.of("kubernetes.io/cluster/prod-eks", "owned"))));

        ClusterIdentityNotFoundException error = catchThrowableOfType(
                () -> resolver.resolve(TestRuns.run(gateway, "prod"), REGION, node("n1", "aws:///us-east-1a/i-0123")),
                ClusterIdentityNotFoundException.class);

        assertThat(error.getCandidates()).containsExactly("prod-eks", "prod");
        verify(gateway, times(2)).getManagedCluster(eq(REGION), anyString());
    }

    @Test
    void fallsThroughToContextNameThenSuffix() {
        when(gateway.getManagedCluster(REGION, "prod-eks")).thenReturn(Optional.of(cluster("prod-eks", "vpc-9")));

        ClusterIdentity identity = resolver.resolve(TestRuns.run(gateway, "prod"), REGION,
                node("n1", "aws:///us-east-1a/i-0123"));

        InOrder order = inOrder(gateway);
        order.verify(gateway).getManagedCluster(REGION, "prod");
        order.verify(gateway).getManagedCluster(REGION, "prod-eks");
        assertThat(identity.getResolvedName()).isEqualTo("prod-eks");
        assertThat(identity.getAttempts()).extracting(CandidateAttempt::getOutcome)
                .containsExactly(CandidateAttempt.Outcome.NOT_FOUND, CandidateAttempt.Outcome.FOUND);
    }

    @Test
    void adoptsVpcFromClusterRecordWhenInstanceGaveNone() {
        when(gateway.getManagedCluster(REGION, "prod")).thenReturn(Optional.of(cluster("prod", "vpc-cluster")));

        ClusterIdentity identity = resolver.resolve(TestRuns.run(gateway, "prod"), REGION,
                node("n1", "aws:///us-east-1a/i-0123"));

        assertThat(identity.getVpcId()).isEqualTo("vpc-cluster");
    }

    @Test
    void skipsInstanceLookupWithoutAnInstanceId() {
        when(gateway.getManagedCluster(REGION, "prod")).thenReturn(Optional.of(cluster("prod", "vpc-1")));

        resolver.resolve(TestRuns.run(gateway, "prod"), REGION, node("n1", null));

        verify(gateway, never()).getInstanceDetails(anyString(), anyString());
    }

    @Test
    void instanceLookupFailureDoesNotStopResolution() {
        when(gateway.getInstanceDetails(REGION, "i-0123")).thenThrow(new ProviderException("Failed to get instance details: boom"));
        when(gateway.getManagedCluster(REGION, "prod")).thenReturn(Optional.of(cluster("prod", "vpc-1")));

        ClusterIdentity identity = resolver.resolve(TestRuns.run(gateway, "prod"), REGION,
                node("n1", "aws:///us-east-1a/i-0123"));

        assertThat(identity.getResolvedName()).isEqualTo("prod");
        assertThat(identity.getTagDerivedName()).isNull();
    }

    @Test
    void failedLookupsMoveOnToTheNextCandidate() {
        when(gateway.getManagedCluster(REGION, "prod")).thenThrow(new ProviderException("Failed to get EKS cluster: throttled"));
        when(gateway.getManagedCluster(REGION, "prod-eks")).thenReturn(Optional.of(cluster("prod-eks", "vpc-1")));

        ClusterIdentity identity = resolver.resolve(TestRuns.run(gateway, "prod"), REGION, node("n1", null));

        assertThat(identity.getResolvedName()).isEqualTo("prod-eks");
        assertThat(identity.getAttempts().get(0).getOutcome()).isEqualTo(CandidateAttempt.Outcome.FAILED);
        assertThat(identity.getAttempts().get(0).getMessage()).contains("throttled");
    }

    @Test
    void notFoundCarriesEveryCandidateInOrder() {
        ClusterIdentityNotFoundException error = catchThrowableOfType(
                () -> resolver.resolve(TestRuns.run(gateway, "ctx"), REGION, node("n1", null)),
                ClusterIdentityNotFoundException.class);

        assertThat(error.getCandidates()).containsExactly("ctx", "ctx-eks");
        assertThat(error.getMessage()).contains("Tried: ctx, ctx-eks");
        assertThat(error.isCredentialRelated()).isFalse();
    }

    @Test
    void notFoundIsCredentialRelatedWhenLookupsFailedOnExpiredTokens() {
        when(gateway.getManagedCluster(eq(REGION), anyString()))
                .thenThrow(new ProviderException("Failed to get EKS cluster: ExpiredTokenException"));

        ClusterIdentityNotFoundException error = catchThrowableOfType(
                () -> resolver.resolve(TestRuns.run(gateway, "ctx"), REGION, node("n1", null)),
                ClusterIdentityNotFoundException.class);

        assertThat(error.isCredentialRelated()).isTrue();
    }

    @Test
    void owningClusterTagRulesApplyInOrder() {
        assertThat(ClusterIdentityResolver.owningClusterName(Map.of(
                "eks:cluster-name", "from-eks-tag",
                "kubernetes.io/cluster/from-key", "owned"))).contains("from-eks-tag");
        assertThat(ClusterIdentityResolver.owningClusterName(Map.of(
                "alpha.eksctl.io/cluster-name", "from-eksctl"))).contains("from-eksctl");
        assertThat(ClusterIdentityResolver.owningClusterName(Map.of(
                "Name", "worker", "kubernetes.io/cluster/from-key", "shared"))).contains("from-key");
        assertThat(ClusterIdentityResolver.owningClusterName(Map.of("Name", "worker"))).isEmpty();
    }

    private static ComputeInstance instance(String vpcId, Map<String, String> tags) {
        return ComputeInstance.builder().instanceId("i-0123").vpcId(vpcId).tags(tags).build();
    }

    private static ManagedClusterRecord cluster(String name, String vpcId) {
        return ManagedClusterRecord.builder().name(name).status("ACTIVE").version("1.29").vpcId(vpcId).build();
    }
}
