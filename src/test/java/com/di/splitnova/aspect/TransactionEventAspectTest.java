package com.di.splitnova.aspect;

import com.di.splitnova.sampling.CapacityExceededException;
import com.di.splitnova.util.TransactionEventLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@DisplayName("TransactionEventAspect Tests")
class TransactionEventAspectTest {

    public static class Job {
        @LogTransaction(eventType = "TEST_JOB", transactionContext = "unit", parameterNames = {"input", "size"})
        public String run(String input, int size) {
            return input + size;
        }

        @LogTransaction(eventType = "TEST_JOB", transactionContext = "unit")
        public void fail() {
            throw new CapacityExceededException("full", 1.5);
        }
    }

    private TransactionEventLogger eventLogger;
    private Job proxy;

    @BeforeEach
    void setUp() {
        eventLogger = mock(TransactionEventLogger.class);
        AspectJProxyFactory factory = new AspectJProxyFactory(new Job());
        factory.setProxyTargetClass(true);
        factory.addAspect(new TransactionEventAspect(eventLogger));
        proxy = factory.getProxy();
        MDC.put("jobId", "sample-test");
    }

    @AfterEach
    void tearDown() {
        MDC.remove("jobId");
    }

    @Test
    @DisplayName("Should log started and completed events with the named parameters")
    @SuppressWarnings("unchecked")
    void testLogTransaction_Completed() {
        assertEquals("in5", proxy.run("in", 5));

        verify(eventLogger).logEvent(eq("TEST_JOB_STARTED"), anyMap(), eq("sample-test"), eq("unit"));
        ArgumentCaptor<Map<String, Object>> context = ArgumentCaptor.forClass(Map.class);
        verify(eventLogger).logEvent(eq("TEST_JOB_COMPLETED"), context.capture(), eq("sample-test"), eq("unit"));
        assertEquals("in", context.getValue().get("input"));
        assertEquals(5, context.getValue().get("size"));
        assertTrue(context.getValue().containsKey("durationMs"));
    }

    @Test
    @DisplayName("Should log a categorized failure and re-throw the exception")
    @SuppressWarnings("unchecked")
    void testLogTransaction_Failed() {
        assertThrows(CapacityExceededException.class, () -> proxy.fail());

        ArgumentCaptor<Map<String, Object>> context = ArgumentCaptor.forClass(Map.class);
        verify(eventLogger).logEvent(eq("TEST_JOB_FAILED"), context.capture(), eq("sample-test"), eq("unit"),
                any(CapacityExceededException.class));
        assertEquals(ErrorCategory.CAPACITY_ERROR.name(), context.getValue().get("errorCategory"));
        assertEquals(1.5, context.getValue().get("requiredWidth"));
    }
}
