package com.heystive.guard.exception;

/**
 * Thrown when a request originates from an address that is temporarily blocked
 * after repeated authentication failures.
 */
public class IpBlockedException extends HeystiveException {

    private final String ipAddress;

    public IpBlockedException(String ipAddress) {
        super("IP temporarily blocked: " + ipAddress);
        this.ipAddress = ipAddress;
    }

    public String getIpAddress() {
        return ipAddress;
    }
}
