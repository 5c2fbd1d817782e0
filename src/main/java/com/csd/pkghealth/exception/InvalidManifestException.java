package com.csd.pkghealth.exception;

/**
 * The submitted project manifest cannot be scanned.
 */
public class InvalidManifestException extends RuntimeException {

    public InvalidManifestException(String message) {
        super(message);
    }
}
