package com.pytaintscanner.config;

/**
 * Invalid caps or an unreadable rules file. Raised before analysis starts; it is the only
 * error that stops a scan.
 */
public class ConfigValidationException extends RuntimeException {
    public ConfigValidationException(String message) {
        super(message);
    }

    public ConfigValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
