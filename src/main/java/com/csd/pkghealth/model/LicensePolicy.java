package com.csd.pkghealth.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * License rules applied to one scan. Entries may end in {@code *} to match a prefix.
 */
@Value
@Builder
public class LicensePolicy {
    @Builder.Default
    List<String> allow = List.of();
    @Builder.Default
    List<String> deny = List.of();
    @Builder.Default
    List<String> warn = List.of();
    @Builder.Default
    boolean warnOnUnknown = true;
    @Builder.Default
    boolean checkPatentClauses = true;
}
