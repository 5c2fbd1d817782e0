package com.csd.pkghealth.model;

import lombok.Value;

@Value
public class UpgradeStep {
    String from;
    String to;
    String description;
}
