package com.clusterscope.cloud.dto.eks;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VpcRecord {
    String vpcId;
    String name;
    String cidrBlock;
    String state;
    boolean defaultVpc;
}
