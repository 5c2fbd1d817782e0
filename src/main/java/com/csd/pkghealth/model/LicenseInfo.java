package com.csd.pkghealth.model;

import lombok.Builder;
import lombok.Value;

/**
 * Reference record for one SPDX license.
 */
@Value
@Builder
public class LicenseInfo {
    String id;
    String name;
    LicenseFamily family;
    BlueOakRating rating;
    boolean patentClause;
    boolean osiApproved;
    boolean deprecated;
}
