package com.csd.pkghealth.service;

import com.csd.pkghealth.model.PackageMetadata;

import java.util.concurrent.CompletableFuture;

/**
 * Source of registry metadata. Implementations fail the future when the package cannot be fetched.
 */
@FunctionalInterface
public interface MetadataFetcher {

    CompletableFuture<PackageMetadata> fetch(String packageName);
}
