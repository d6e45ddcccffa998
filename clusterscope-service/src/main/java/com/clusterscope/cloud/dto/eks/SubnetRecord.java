package com.clusterscope.cloud.dto.eks;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubnetRecord {
    String subnetId;
    String name;
    String cidrBlock;
    String availabilityZone;
    Integer availableIpAddressCount;
    boolean publicSubnet;
}
