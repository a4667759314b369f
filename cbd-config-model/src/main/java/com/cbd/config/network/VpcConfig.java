package com.cbd.config.network;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Network settings: an existing VPC and its subnets, plus the VPC endpoints used by private
 * deployments. Lists are {@code null} when not configured (distinct from an empty list).
 */
public final class VpcConfig extends ConfigGroup {

    private final String vpcId;
    private final List<String> subnetIds;
    private final Boolean createVpcEndpoints;
    private final String executeApiVpcEndpointId;
    private final String s3VpcEndpointId;
    private final List<String> s3VpcEndpointIps;

    @JsonCreator
    public VpcConfig(
            @JsonProperty("vpcId") String vpcId,
            @JsonProperty("subnetIds") List<String> subnetIds,
            @JsonProperty("createVpcEndpoints") Boolean createVpcEndpoints,
            @JsonProperty("executeApiVpcEndpointId") String executeApiVpcEndpointId,
            @JsonProperty("s3VpcEndpointId") String s3VpcEndpointId,
            @JsonProperty("s3VpcEndpointIps") List<String> s3VpcEndpointIps) {
        this.vpcId = vpcId;
        this.subnetIds = subnetIds != null ? List.copyOf(subnetIds) : null;
        this.createVpcEndpoints = createVpcEndpoints;
        this.executeApiVpcEndpointId = executeApiVpcEndpointId;
        this.s3VpcEndpointId = s3VpcEndpointId;
        this.s3VpcEndpointIps = s3VpcEndpointIps != null ? List.copyOf(s3VpcEndpointIps) : null;
    }

    public String getVpcId() {
        return vpcId;
    }

    public List<String> getSubnetIds() {
        return subnetIds;
    }

    public Boolean getCreateVpcEndpoints() {
        return createVpcEndpoints;
    }

    public String getExecuteApiVpcEndpointId() {
        return executeApiVpcEndpointId;
    }

    public String getS3VpcEndpointId() {
        return s3VpcEndpointId;
    }

    public List<String> getS3VpcEndpointIps() {
        return s3VpcEndpointIps;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VpcConfig that = (VpcConfig) o;
        return Objects.equals(vpcId, that.vpcId)
                && Objects.equals(subnetIds, that.subnetIds)
                && Objects.equals(createVpcEndpoints, that.createVpcEndpoints)
                && Objects.equals(executeApiVpcEndpointId, that.executeApiVpcEndpointId)
                && Objects.equals(s3VpcEndpointId, that.s3VpcEndpointId)
                && Objects.equals(s3VpcEndpointIps, that.s3VpcEndpointIps)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vpcId, subnetIds, createVpcEndpoints, executeApiVpcEndpointId,
                s3VpcEndpointId, s3VpcEndpointIps, additionalFieldsHash());
    }
}
