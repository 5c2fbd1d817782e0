package com.csd.pkghealth.exception;

/**
 * A single-package check could not get a usable registry record.
 */
public class PackageCheckException extends RuntimeException {

    private final String packageName;

    public PackageCheckException(String packageName, String reason) {
        super("Failed to check package " + packageName + ": " + reason);
        this.packageName = packageName;
    }

    public PackageCheckException(String packageName, Throwable cause) {
        super("Failed to check package " + packageName + ": " + cause.getMessage(), cause);
        this.packageName = packageName;
    }

    public String getPackageName() {
        return packageName;
    }
}
