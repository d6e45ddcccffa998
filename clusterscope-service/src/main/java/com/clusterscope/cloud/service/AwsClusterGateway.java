package com.clusterscope.cloud.service;

import com.clusterscope.cloud.dto.eks.AuthCheckResult;
import com.clusterscope.cloud.dto.eks.ComputeInstance;
import com.clusterscope.cloud.dto.eks.ManagedClusterRecord;
import com.clusterscope.cloud.dto.eks.SubnetRecord;
import com.clusterscope.cloud.dto.eks.VpcRecord;
import com.clusterscope.cloud.dto.eks.WorkloadIdentityBinding;
import com.clusterscope.cloud.dto.k8s.ClusterNode;
import com.clusterscope.cloud.exception.CredentialErrorClassifier;
import com.clusterscope.cloud.exception.ProviderException;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeSubnetsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVpcsRequest;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.Subnet;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.Vpc;
import software.amazon.awssdk.services.eks.EksClient;
import software.amazon.awssdk.services.eks.model.Cluster;
import software.amazon.awssdk.services.eks.model.DescribeClusterRequest;
import software.amazon.awssdk.services.eks.model.DescribePodIdentityAssociationRequest;
import software.amazon.awssdk.services.eks.model.ListPodIdentityAssociationsRequest;
import software.amazon.awssdk.services.eks.model.ListPodIdentityAssociationsResponse;
import software.amazon.awssdk.services.eks.model.PodIdentityAssociationSummary;
import software.amazon.awssdk.services.eks.model.ResourceNotFoundException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class AwsClusterGateway implements ClusterCloudGateway {

    private static final Logger logger = LoggerFactory.getLogger(AwsClusterGateway.class);

    static final String CLUSTER_TAG_PREFIX = "kubernetes.io/cluster/";

    static final Set<String> AUTH_ERROR_CODES = Set.of(
            "ExpiredToken",
            "ExpiredTokenException",
            "InvalidClientTokenId",
            "SignatureDoesNotMatch",
            "UnrecognizedClientException",
            "AccessDenied",
            "AccessDeniedException");

    private final AwsClientProvider awsClientProvider;
    private final K8sClientFactory k8sClientFactory;
    private final ApplicationRestarter applicationRestarter;

    public AwsClusterGateway(AwsClientProvider awsClientProvider, K8sClientFactory k8sClientFactory,
                             ApplicationRestarter applicationRestarter) {
        this.awsClientProvider = awsClientProvider;
        this.k8sClientFactory = k8sClientFactory;
        this.applicationRestarter = applicationRestarter;
    }

    @Override
    public List<ClusterNode> listNodes(String clusterContext) {
        logger.info("Listing nodes for context {}", clusterContext);
        try (KubernetesClient client = k8sClientFactory.createForContext(clusterContext)) {
            return client.nodes().list().getItems().stream()
                    .map(AwsClusterGateway::toClusterNode)
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            logger.error("Failed to list nodes for context {}: {}", clusterContext, e.getMessage());
            throw ProviderException.from("list nodes for context " + clusterContext, e);
        }
    }

    @Override
    public void clearCredentialCache() {
        awsClientProvider.clearClientCache();
    }

    /**
     * Reports unauthenticated only for credential failures. Anything else (DNS, connect timeouts,
     * throttling) is thrown as a {@link ProviderException} so it is not mistaken for expired credentials.
     */
    @Override
    public AuthCheckResult checkAuth(String region) {
        try {
            StsClient sts = awsClientProvider.getStsClient(region);
            GetCallerIdentityResponse response = sts.getCallerIdentity(GetCallerIdentityRequest.builder().build());
            logger.info("Auth check successful - Account: {}, Identity: {}", response.account(), response.arn());
            return AuthCheckResult.authenticated(response.arn(), response.account());
        } catch (RuntimeException e) {
            if (isCredentialFailure(e)) {
                logger.warn("Auth check failed in region {}: {}", region, e.getMessage());
                return AuthCheckResult.unauthenticated(e.getMessage());
            }
            logger.error("Auth check could not reach AWS in region {}: {}", region, e.getMessage());
            throw ProviderException.from("check AWS auth in region " + region, e);
        }
    }

    static boolean isCredentialFailure(RuntimeException e) {
        if (e instanceof AwsServiceException) {
            AwsServiceException service = (AwsServiceException) e;
            if (service.statusCode() == 401 || service.statusCode() == 403) {
                return true;
            }
            AwsErrorDetails details = service.awsErrorDetails();
            if (details != null && details.errorCode() != null
                    && AUTH_ERROR_CODES.contains(details.errorCode())) {
                return true;
            }
        }
        return CredentialErrorClassifier.isCredentialRelated(e);
    }

    @Override
    public Optional<ComputeInstance> getInstanceDetails(String region, String instanceId) {
        logger.debug("getInstanceDetails region={} instanceId={}", region, instanceId);
        try {
            Ec2Client ec2 = awsClientProvider.getEc2Client(region);
            DescribeInstancesResponse response = ec2.describeInstances(DescribeInstancesRequest.builder()
                    .instanceIds(instanceId)
                    .build());
            return response.reservations().stream()
                    .flatMap(r -> r.instances().stream())
                    .findFirst()
                    .map(AwsClusterGateway::toComputeInstance);
        } catch (RuntimeException e) {
            throw ProviderException.from("get instance details", e);
        }
    }

    @Override
    public Optional<ManagedClusterRecord> getManagedCluster(String region, String name) {
        logger.debug("getManagedCluster region={} name={}", region, name);
        try {
            EksClient eks = awsClientProvider.getEksClient(region);
            Cluster cluster = eks.describeCluster(DescribeClusterRequest.builder().name(name).build()).cluster();
            return Optional.ofNullable(cluster).map(AwsClusterGateway::toManagedCluster);
        } catch (ResourceNotFoundException e) {
            logger.info("EKS cluster '{}' not found in region {}", name, region);
            return Optional.empty();
        } catch (RuntimeException e) {
            throw ProviderException.from("get EKS cluster '" + name + "' in region " + region, e);
        }
    }

    @Override
    public Optional<VpcRecord> getVpcDetails(String region, String vpcId) {
        requireVpcId(vpcId);
        logger.debug("getVpcDetails region={} vpcId={}", region, vpcId);
        try {
            Ec2Client ec2 = awsClientProvider.getEc2Client(region);
            return ec2.describeVpcs(DescribeVpcsRequest.builder().vpcIds(vpcId).build())
                    .vpcs().stream()
                    .findFirst()
                    .map(AwsClusterGateway::toVpcRecord);
        } catch (RuntimeException e) {
            throw ProviderException.from("get VPC details", e);
        }
    }

    @Override
    public List<SubnetRecord> listSubnets(String region, String vpcId) {
        requireVpcId(vpcId);
        logger.debug("listSubnets region={} vpcId={}", region, vpcId);
        try {
            Ec2Client ec2 = awsClientProvider.getEc2Client(region);
            return ec2.describeSubnets(DescribeSubnetsRequest.builder()
                            .filters(filter("vpc-id", vpcId))
                            .build())
                    .subnets().stream()
                    .map(AwsClusterGateway::toSubnetRecord)
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            throw ProviderException.from("get subnets", e);
        }
    }

    @Override
    public List<ComputeInstance> listComputeInstances(String region, String vpcId, String clusterName) {
        requireVpcId(vpcId);
        logger.debug("listComputeInstances region={} vpcId={} cluster={}", region, vpcId, clusterName);
        List<Filter> filters = new ArrayList<>();
        filters.add(filter("vpc-id", vpcId));
        // shared VPCs carry instances of other clusters too
        if (clusterName != null && !clusterName.isEmpty()) {
            filters.add(filter("tag:" + CLUSTER_TAG_PREFIX + clusterName, "owned", "shared"));
        }
        filters.add(filter("instance-state-name", "running"));
        try {
            Ec2Client ec2 = awsClientProvider.getEc2Client(region);
            List<ComputeInstance> instances = new ArrayList<>();
            String nextToken = null;
            do {
                DescribeInstancesResponse page = ec2.describeInstances(DescribeInstancesRequest.builder()
                        .filters(filters)
                        .nextToken(nextToken)
                        .build());
                page.reservations().stream()
                        .map(Reservation::instances)
                        .flatMap(Collection::stream)
                        .map(AwsClusterGateway::toComputeInstance)
                        .forEach(instances::add);
                nextToken = page.nextToken();
            } while (nextToken != null);
            return instances;
        } catch (RuntimeException e) {
            throw ProviderException.from("get EC2 instances", e);
        }
    }

    @Override
    public List<WorkloadIdentityBinding> listWorkloadIdentityBindings(String region, String clusterName) {
        logger.debug("listWorkloadIdentityBindings region={} cluster={}", region, clusterName);
        EksClient eks = awsClientProvider.getEksClient(region);
        List<PodIdentityAssociationSummary> summaries = new ArrayList<>();
        try {
            String nextToken = null;
            do {
                ListPodIdentityAssociationsResponse page = eks.listPodIdentityAssociations(
                        ListPodIdentityAssociationsRequest.builder()
                                .clusterName(clusterName)
                                .nextToken(nextToken)
                                .build());
                summaries.addAll(page.associations());
                nextToken = page.nextToken();
            } while (nextToken != null);
        } catch (RuntimeException e) {
            throw ProviderException.from("get pod identities", e);
        }
        return summaries.stream()
                .map(summary -> withRoleArn(eks, clusterName, toBinding(summary)))
                .collect(Collectors.toList());
    }

    @Override
    public void restartApplicationProcess() {
        applicationRestarter.restart();
    }

    private WorkloadIdentityBinding withRoleArn(EksClient eks, String clusterName, WorkloadIdentityBinding binding) {
        try {
            String roleArn = eks.describePodIdentityAssociation(DescribePodIdentityAssociationRequest.builder()
                            .clusterName(clusterName)
                            .associationId(binding.getAssociationId())
                            .build())
                    .association()
                    .roleArn();
            return binding.toBuilder().roleArn(roleArn).build();
        } catch (RuntimeException e) {
            logger.warn("Could not describe pod identity association {}: {}", binding.getAssociationId(), e.getMessage());
            return binding;
        }
    }

    private static void requireVpcId(String vpcId) {
        if (vpcId == null || vpcId.isEmpty()) {
            throw new IllegalArgumentException("VPC ID is required");
        }
    }

    private static Filter filter(String name, String... values) {
        return Filter.builder().name(name).values(values).build();
    }

    static ClusterNode toClusterNode(Node node) {
        String providerId = node.getSpec() != null ? node.getSpec().getProviderID() : null;
        Map<String, String> labels = node.getMetadata().getLabels() != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(node.getMetadata().getLabels()))
                : Collections.emptyMap();
        return ClusterNode.builder()
                .name(node.getMetadata().getName())
                .providerId(providerId)
                .labels(labels)
                .creationTimestamp(node.getMetadata().getCreationTimestamp())
                .build();
    }

    static ComputeInstance toComputeInstance(Instance instance) {
        Map<String, String> tags = tagMap(instance.tags());
        return ComputeInstance.builder()
                .instanceId(instance.instanceId())
                .name(tags.getOrDefault("Name", "-"))
                .instanceType(instance.instanceTypeAsString())
                .state(instance.state() != null ? instance.state().nameAsString() : null)
                .privateIpAddress(instance.privateIpAddress())
                .vpcId(instance.vpcId())
                .availabilityZone(instance.placement() != null ? instance.placement().availabilityZone() : null)
                .launchTime(instance.launchTime())
                .tags(tags)
                .build();
    }

    static ManagedClusterRecord toManagedCluster(Cluster cluster) {
        ManagedClusterRecord.ManagedClusterRecordBuilder builder = ManagedClusterRecord.builder()
                .name(cluster.name())
                .arn(cluster.arn())
                .status(cluster.statusAsString())
                .version(cluster.version())
                .platformVersion(cluster.platformVersion())
                .endpoint(cluster.endpoint())
                .createdAt(cluster.createdAt());
        if (cluster.resourcesVpcConfig() != null) {
            builder.vpcId(cluster.resourcesVpcConfig().vpcId())
                    .subnetIds(List.copyOf(cluster.resourcesVpcConfig().subnetIds()))
                    .securityGroupIds(List.copyOf(cluster.resourcesVpcConfig().securityGroupIds()));
        }
        return builder.build();
    }

    static VpcRecord toVpcRecord(Vpc vpc) {
        return VpcRecord.builder()
                .vpcId(vpc.vpcId())
                .name(tagMap(vpc.tags()).getOrDefault("Name", "-"))
                .cidrBlock(vpc.cidrBlock())
                .state(vpc.stateAsString())
                .defaultVpc(Boolean.TRUE.equals(vpc.isDefault()))
                .build();
    }

    static SubnetRecord toSubnetRecord(Subnet subnet) {
        return SubnetRecord.builder()
                .subnetId(subnet.subnetId())
                .name(tagMap(subnet.tags()).getOrDefault("Name", "-"))
                .cidrBlock(subnet.cidrBlock())
                .availabilityZone(subnet.availabilityZone())
                .availableIpAddressCount(subnet.availableIpAddressCount())
                .publicSubnet(Boolean.TRUE.equals(subnet.mapPublicIpOnLaunch()))
                .build();
    }

    static WorkloadIdentityBinding toBinding(PodIdentityAssociationSummary summary) {
        return WorkloadIdentityBinding.builder()
                .associationId(summary.associationId())
                .associationArn(summary.associationArn())
                .clusterName(summary.clusterName())
                .namespace(summary.namespace())
                .serviceAccount(summary.serviceAccount())
                .build();
    }

    private static Map<String, String> tagMap(List<Tag> tags) {
        Map<String, String> result = new LinkedHashMap<>();
        if (tags != null) {
            tags.forEach(tag -> result.put(tag.key(), tag.value()));
        }
        return Collections.unmodifiableMap(result);
    }
}
