package com.csd.pkghealth.model;

import lombok.Value;

@Value
public class PackageAlternative {
    String name;
    String description;
    String license;
}
