package com.cbd.config.pipeline;

import com.cbd.config.ConfigGroup;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Source repository for the pipeline. Either an existing repository is named, or
 * {@code createNew} is set together with {@code newRepositoryName}; never both.
 */
public final class CodeCommitConfig extends ConfigGroup {

    private final String existingRepositoryName;
    private final Boolean createNew;
    private final String newRepositoryName;
    private final Boolean seedOnCreate;

    @JsonCreator
    public CodeCommitConfig(
            @JsonProperty("existingRepositoryName") String existingRepositoryName,
            @JsonProperty("createNew") Boolean createNew,
            @JsonProperty("newRepositoryName") String newRepositoryName,
            @JsonProperty("seedOnCreate") Boolean seedOnCreate) {
        this.existingRepositoryName = existingRepositoryName;
        this.createNew = createNew;
        this.newRepositoryName = newRepositoryName;
        this.seedOnCreate = seedOnCreate;
    }

    public String getExistingRepositoryName() {
        return existingRepositoryName;
    }

    public Boolean getCreateNew() {
        return createNew;
    }

    public String getNewRepositoryName() {
        return newRepositoryName;
    }

    /** Seed a newly created repository with the project sources on first creation. */
    public Boolean getSeedOnCreate() {
        return seedOnCreate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CodeCommitConfig that = (CodeCommitConfig) o;
        return Objects.equals(existingRepositoryName, that.existingRepositoryName)
                && Objects.equals(createNew, that.createNew)
                && Objects.equals(newRepositoryName, that.newRepositoryName)
                && Objects.equals(seedOnCreate, that.seedOnCreate)
                && sameAdditionalFields(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(existingRepositoryName, createNew, newRepositoryName, seedOnCreate, additionalFieldsHash());
    }
}
