package com.csd.pkghealth.model;

/**
 * Why a declared dependency did not make it into the tree.
 */
public enum SkipReason {
    CIRCULAR_STOPPED,
    FETCH_FAILED,
    TIMEOUT,
    UNRESOLVABLE_VERSION
}
