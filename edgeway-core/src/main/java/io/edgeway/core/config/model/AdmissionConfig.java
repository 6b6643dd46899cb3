package io.edgeway.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AdmissionConfig(
    @JsonAlias({"max_per_user"}) int maxPerUser,
    @JsonAlias({"max_global"}) int maxGlobal
) {

    public static AdmissionConfig defaults() {
        return new AdmissionConfig(5, 1000);
    }
}
