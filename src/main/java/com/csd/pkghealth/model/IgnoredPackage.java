package com.csd.pkghealth.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class IgnoredPackage {
    @JsonProperty("package")
    String packageName;
    String version;
    String reason;
}
