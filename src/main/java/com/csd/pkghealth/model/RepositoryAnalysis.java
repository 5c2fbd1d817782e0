package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RepositoryAnalysis {
    @JsonProperty("package")
    String packageName;
    String url;
    int stars;
    int forks;
    int openIssues;
    boolean archived;
    Instant lastPush;
    Severity severity;
}
