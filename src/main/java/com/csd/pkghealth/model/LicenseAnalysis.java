package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LicenseAnalysis {
    @JsonProperty("package")
    String packageName;
    String version;
    String license;     // expression as declared
    String spdxId;      // identifier the classification was taken from
    LicenseCategory category;
    BlueOakRating blueOakRating;
    Severity severity;
    boolean dualLicense;
    boolean patentClause;
    boolean commercialUse;
    String reason;
}
