package com.vidnyan.archgate.application.port.in;

/**
 * Invalid gate invocation, such as a root that does not exist.
 * Raised before any file is scanned.
 */
public class GateConfigurationException extends RuntimeException {

    public GateConfigurationException(String message) {
        super(message);
    }
}
