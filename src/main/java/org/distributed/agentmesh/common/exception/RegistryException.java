package org.distributed.agentmesh.common.exception;

/**
 * Raised by the directory client when a call fails at the transport level or
 * the directory answers with an unexpected status.
 */
public class RegistryException extends RuntimeException {

    // 0 when the failure happened before any response arrived
    private final int statusCode;

    public RegistryException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public RegistryException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
