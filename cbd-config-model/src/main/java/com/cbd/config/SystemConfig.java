package com.cbd.config;

import com.cbd.config.auth.CognitoFederationConfig;
import com.cbd.config.bedrock.BedrockConfig;
import com.cbd.config.network.VpcConfig;
import com.cbd.config.pipeline.PipelineConfig;
import com.cbd.config.rag.RagConfig;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Root deployment configuration (the shape of {@code bin/config.json}): root-level switches,
 * the network, federation, Bedrock, RAG and pipeline groups, and everything else the
 * provisioning layer reads (kept as {@link #getAdditionalFields() additional fields}).
 * <p>
 * Absent optional groups are {@code null}; instances are immutable.
 */
public final class SystemConfig extends ConfigGroup {

    private final String prefix;
    private final Boolean enableWaf;
    private final Boolean enableS3TransferAcceleration;
    private final Boolean directSend;
    private final Integer provisionedConcurrency;
    private final String cloudfrontLogBucketArn;
    private final Boolean createCMKs;
    private final Boolean retainOnDelete;
    private final Boolean ddbDeletionProtection;
    private final Boolean advancedMonitoring;
    private final Boolean disableS3AccessLogs;
    private final String logArchiveBucketName;
    private final Integer logRetention;
    private final Integer rateLimitPerIP;
    private final Boolean privateWebsite;
    private final String certificate;
    private final String domain;
    private final Boolean cfGeoRestrictEnable;
    private final List<String> cfGeoRestrictList;
    private final VpcConfig vpc;
    private final CognitoFederationConfig cognitoFederation;
    private final BedrockConfig bedrock;
    private final RagConfig rag;
    private final PipelineConfig pipeline;

    @JsonCreator
    public SystemConfig(
            @JsonProperty("prefix") String prefix,
            @JsonProperty("enableWaf") Boolean enableWaf,
            @JsonProperty("enableS3TransferAcceleration") Boolean enableS3TransferAcceleration,
            @JsonProperty("directSend") Boolean directSend,
            @JsonProperty("provisionedConcurrency") Integer provisionedConcurrency,
            @JsonProperty("cloudfrontLogBucketArn") String cloudfrontLogBucketArn,
            @JsonProperty("createCMKs") Boolean createCMKs,
            @JsonProperty("retainOnDelete") Boolean retainOnDelete,
            @JsonProperty("ddbDeletionProtection") Boolean ddbDeletionProtection,
            @JsonProperty("advancedMonitoring") Boolean advancedMonitoring,
            @JsonProperty("disableS3AccessLogs") Boolean disableS3AccessLogs,
            @JsonProperty("logArchiveBucketName") String logArchiveBucketName,
            @JsonProperty("logRetention") Integer logRetention,
            @JsonProperty("rateLimitPerIP") Integer rateLimitPerIP,
            @JsonProperty("privateWebsite") Boolean privateWebsite,
            @JsonProperty("certificate") String certificate,
            @JsonProperty("domain") String domain,
            @JsonProperty("cfGeoRestrictEnable") Boolean cfGeoRestrictEnable,
            @JsonProperty("cfGeoRestrictList") List<String> cfGeoRestrictList,
            @JsonProperty("vpc") VpcConfig vpc,
            @JsonProperty("cognitoFederation") CognitoFederationConfig cognitoFederation,
            @JsonProperty("bedrock") BedrockConfig bedrock,
            @JsonProperty("rag") RagConfig rag,
            @JsonProperty("pipeline") PipelineConfig pipeline) {
        this.prefix = prefix;
        this.enableWaf = enableWaf;
        this.enableS3TransferAcceleration = enableS3TransferAcceleration;
        this.directSend = directSend;
        this.provisionedConcurrency = provisionedConcurrency;
        this.cloudfrontLogBucketArn = cloudfrontLogBucketArn;
        this.createCMKs = createCMKs;
        this.retainOnDelete = retainOnDelete;
        this.ddbDeletionProtection = ddbDeletionProtection;
        this.advancedMonitoring = advancedMonitoring;
        this.disableS3AccessLogs = disableS3AccessLogs;
        this.logArchiveBucketName = logArchiveBucketName;
        this.logRetention = logRetention;
        this.rateLimitPerIP = rateLimitPerIP;
        this.privateWebsite = privateWebsite;
        this.certificate = certificate;
        this.domain = domain;
        this.cfGeoRestrictEnable = cfGeoRestrictEnable;
        this.cfGeoRestrictList = cfGeoRestrictList != null ? List.copyOf(cfGeoRestrictList) : null;
        this.vpc = vpc;
        this.cognitoFederation = cognitoFederation;
        this.bedrock = bedrock;
        this.rag = rag;
        this.pipeline = pipeline;
    }

    /** Deployment identifier; prefixes every stack and resource name. */
    public String getPrefix() {
        return prefix;
    }

    public Boolean getEnableWaf() {
        return enableWaf;
    }

    public Boolean getEnableS3TransferAcceleration() {
        return enableS3TransferAcceleration;
    }

    public Boolean getDirectSend() {
        return directSend;
    }

    public Integer getProvisionedConcurrency() {
        return provisionedConcurrency;
    }

    public String getCloudfrontLogBucketArn() {
        return cloudfrontLogBucketArn;
    }

    public Boolean getCreateCMKs() {
        return createCMKs;
    }

    public Boolean getRetainOnDelete() {
        return retainOnDelete;
    }

    public Boolean getDdbDeletionProtection() {
        return ddbDeletionProtection;
    }

    public Boolean getAdvancedMonitoring() {
        return advancedMonitoring;
    }

    /** Skip S3 server access log buckets (when CloudTrail data events already cover them). */
    public Boolean getDisableS3AccessLogs() {
        return disableS3AccessLogs;
    }

    /** Centralized, possibly cross-account, bucket for load balancer access logs. */
    public String getLogArchiveBucketName() {
        return logArchiveBucketName;
    }

    /** CloudWatch log retention in days. */
    public Integer getLogRetention() {
        return logRetention;
    }

    public Integer getRateLimitPerIP() {
        return rateLimitPerIP;
    }

    public Boolean getPrivateWebsite() {
        return privateWebsite;
    }

    /** ACM certificate ARN for the custom domain; empty when not used. */
    public String getCertificate() {
        return certificate;
    }

    public String getDomain() {
        return domain;
    }

    public Boolean getCfGeoRestrictEnable() {
        return cfGeoRestrictEnable;
    }

    public List<String> getCfGeoRestrictList() {
        return cfGeoRestrictList;
    }

    public VpcConfig getVpc() {
        return vpc;
    }

    public CognitoFederationConfig getCognitoFederation() {
        return cognitoFederation;
    }

    public BedrockConfig getBedrock() {
        return bedrock;
    }

    public RagConfig getRag() {
        return rag;
    }

    public PipelineConfig getPipeline() {
        return pipeline;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SystemConfig that = (SystemConfig) o;
        return Objects.equals(prefix, that.prefix)
                && Objects.equals(enableWaf, that.enableWaf)
                && Objects.equals(enableS3TransferAcceleration, that.enableS3TransferAcceleration)
                && Objects.equals(directSend, that.directSend)
                && Objects.equals(provisionedConcurrency, that.provisionedConcurrency)
                && Objects.equals(cloudfrontLogBucketArn, that.cloudfrontLogBucketArn)
                && Objects.equals(createCMKs, that.createCMKs)
                && Objects.equals(retainOnDelete, that.retainOnDelete)
                && Objects.equals(ddbDeletionProtection, that.ddbDeletionProtection)
                && Objects.equals(advancedMonitoring, that.advancedMonitoring)
                && Objects.equals(disableS3AccessLogs, that.disableS3AccessLogs)
                && Objects.equals(logArchiveBucketName, that.logArchiveBucketName)
                && Objects.equals(logRetention, that.logRetention)
                && Objects.equals(rateLimitPerIP, that.rateLimitPerIP)
                && Objects.equals(privateWebsite, that.privateWebsite)
                && Objects.equals(certificate, that.certificate)
                && Objects.equals(domain, that.domain)
                && Objects.equals(cfGeoRestrictEnable, that.cfGeoRestrictEnable)
                && Objects.equals(cfGeoRestrictList, that.cfGeoRestrictList)
                && Objects.equals(vpc, that.vpc)
                && Objects.equals(cognitoFederation, that.cognitoFederation)
                && Objects.equals(bedrock, that.bedrock)
                && Objects.equals(rag, that.rag)
                && Objects.equals(pipeline, that.pipeline)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, enableWaf, enableS3TransferAcceleration, directSend, provisionedConcurrency,
                cloudfrontLogBucketArn, createCMKs, retainOnDelete, ddbDeletionProtection, advancedMonitoring,
                disableS3AccessLogs, logArchiveBucketName, logRetention, rateLimitPerIP, privateWebsite,
                certificate, domain, cfGeoRestrictEnable, cfGeoRestrictList, vpc, cognitoFederation, bedrock,
                rag, pipeline, additionalFieldsHash());
    }

    @Override
    public String toString() {
        return "SystemConfig{prefix=" + prefix + "}";
    }
}
