package com.di.splitnova.aspect;

import com.di.splitnova.sampling.CapacityExceededException;
import com.di.splitnova.sampling.InvalidConfigurationException;
import com.di.splitnova.sampling.SamplingException;
import org.apache.beam.sdk.Pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for transaction event logging and alerting.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Beam wraps user-code failures in {@link Pipeline.PipelineExecutionException}; those are
 * categorized by their cause.
 */
public enum ErrorCategory {

    SAMPLING_CONFIGURATION_ERROR("Sampling configuration error", "Invalid set sizes, delta or population for a sampling job"),
    CAPACITY_ERROR("Capacity exceeded", "Requested sets need more than the unit interval of random keys"),
    PIPELINE_ERROR("Pipeline error", "Failure while executing the sampling pipeline"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "Missing input, exhausted disk or memory"),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof CapacityExceededException, CAPACITY_ERROR);
        MATCHERS.put(t -> t instanceof InvalidConfigurationException, SAMPLING_CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(t -> t instanceof SamplingException, PIPELINE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof Pipeline.PipelineExecutionException && exception.getCause() != null) {
            ErrorCategory byCause = categorize(exception.getCause());
            return byCause == APPLICATION_ERROR ? PIPELINE_ERROR : byCause;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /** Follows the cause chain to its end. */
    public static Throwable rootCause(Throwable exception) {
        Throwable current = exception;
        while (current != null && current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    // --- Matcher helpers ---

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || (t instanceof java.io.IOException && !(t instanceof java.io.FileNotFoundException));
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.NoSuchFileException
                || (t instanceof java.io.UncheckedIOException && t.getCause() instanceof java.io.FileNotFoundException)
                || (t instanceof java.io.IOException && messageContains(t, "no space", "no matching files"));
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof java.io.NotSerializableException
                || t instanceof java.io.InvalidClassException
                || t instanceof org.apache.beam.sdk.coders.CoderException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) return false;
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
