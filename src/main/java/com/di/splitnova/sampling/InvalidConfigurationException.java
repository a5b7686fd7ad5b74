package com.di.splitnova.sampling;

/**
 * Thrown when the requested target sets cannot be satisfied from the population, e.g. the sum of
 * absolute sizes exceeds the population while reproportioning is disabled, or a parameter such as
 * {@code delta} is out of range.
 *
 * <p>Mapped to 422 by {@link com.di.splitnova.exception.GlobalExceptionHandler}.
 */
public class InvalidConfigurationException extends SamplingException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
