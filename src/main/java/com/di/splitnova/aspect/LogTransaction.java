package com.di.splitnova.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method whose execution is logged as a transaction by {@link TransactionEventAspect}.
 *
 * <p>The aspect emits {@code <eventType>_STARTED} before the call, then either
 * {@code <eventType>_COMPLETED} with the duration or {@code <eventType>_FAILED} with the
 * {@link ErrorCategory} of the thrown exception. The transaction id is read from the MDC.
 *
 * <pre>
 * {@code
 * @LogTransaction(
 *     eventType = "SAMPLING_JOB",
 *     transactionContext = "file_sampling",
 *     parameterNames = {"request"}
 * )
 * public SamplingRun runFileJob(SamplingJobRequest request) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogTransaction {

    /** Event type prefix, e.g. {@code SAMPLING_JOB}. */
    String eventType();

    /** Short label of the operation, e.g. {@code file_sampling} or {@code preview}. */
    String transactionContext() default "";

    /**
     * Names given to the method arguments in the event context, positionally.
     * If empty, all arguments are included under their reflective names.
     */
    String[] parameterNames() default {};

    /** Whether the completed event records the result type. */
    boolean includeResult() default false;

    /** MDC key holding the transaction id; falls back to {@code jobId}. */
    String transactionIdKey() default "jobId";
}
