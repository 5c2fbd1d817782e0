package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Recommendation {
    @JsonProperty("package")
    private String packageName;
    private String reason;
    private String priority; // low, medium, high
    private String estimatedEffort;
}
