package com.procureinsight.discovery.exception;

/**
 * Base class for discovery pipeline failures
 */
public class DiscoveryException extends RuntimeException {

    private final String errorCode;

    public DiscoveryException(String message) {
        super(message);
        this.errorCode = "DISCOVERY_ERROR";
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "DISCOVERY_ERROR";
    }

    public DiscoveryException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DiscoveryException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
