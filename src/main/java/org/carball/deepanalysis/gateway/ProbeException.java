package org.carball.deepanalysis.gateway;

/**
 * Raised by a gateway when a single probe cannot be answered.
 */
public class ProbeException extends Exception {

    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
