package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgeAnalysis {
    @JsonProperty("package")
    String packageName;
    String version;
    String lastPublish; // ISO date or "unknown"
    long ageDays;
    String ageHuman;
    boolean deprecated;
    String deprecationMessage;
    Severity severity;
    String repositoryUrl;

    @JsonProperty("hasRepository")
    public boolean hasRepository() {
        return repositoryUrl != null && !repositoryUrl.isBlank();
    }
}
