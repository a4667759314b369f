package com.cbd.config.pipeline;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * CI/CD pipeline deployment settings. When {@code enabled}, the application is deployed by a
 * self-mutating pipeline watching {@code branch} instead of directly.
 */
public final class PipelineConfig extends ConfigGroup {

    public static final String DEFAULT_BRANCH = "main";

    private final Boolean enabled;
    private final CodeCommitConfig codecommit;
    private final String branch;
    private final Boolean requireApproval;
    private final String notificationEmail;

    @JsonCreator
    public PipelineConfig(
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("codecommit") CodeCommitConfig codecommit,
            @JsonProperty("branch") String branch,
            @JsonProperty("requireApproval") Boolean requireApproval,
            @JsonProperty("notificationEmail") String notificationEmail) {
        this.enabled = enabled;
        this.codecommit = codecommit;
        this.branch = branch;
        this.requireApproval = requireApproval;
        this.notificationEmail = notificationEmail;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public CodeCommitConfig getCodecommit() {
        return codecommit;
    }

    public String getBranch() {
        return branch;
    }

    public Boolean getRequireApproval() {
        return requireApproval;
    }

    /** SNS notifications are only set up when an address is given. */
    public String getNotificationEmail() {
        return notificationEmail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineConfig that = (PipelineConfig) o;
        return Objects.equals(enabled, that.enabled)
                && Objects.equals(codecommit, that.codecommit)
                && Objects.equals(branch, that.branch)
                && Objects.equals(requireApproval, that.requireApproval)
                && Objects.equals(notificationEmail, that.notificationEmail)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, codecommit, branch, requireApproval, notificationEmail, additionalFieldsHash());
    }
}
