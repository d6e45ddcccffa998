package com.clusterscope.cloud.dto.eks;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

@Value
@Builder
public class ManagedClusterRecord {
    String name;
    String arn;
    String status;
    String version;
    String platformVersion;
    String endpoint;
    String vpcId;
    @Builder.Default
    List<String> subnetIds = Collections.emptyList();
    @Builder.Default
    List<String> securityGroupIds = Collections.emptyList();
    Instant createdAt;
}
