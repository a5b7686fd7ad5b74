package com.di.splitnova.sampling;

/**
 * Base class for fatal sampling failures. Raised on the driver before any output is produced;
 * a failed run never leaves a partial sample behind.
 */
public class SamplingException extends RuntimeException {

    public SamplingException(String message) {
        super(message);
    }

    public SamplingException(String message, Throwable cause) {
        super(message, cause);
    }
}
