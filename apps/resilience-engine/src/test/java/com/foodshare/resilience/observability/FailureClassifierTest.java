package com.foodshare.resilience.observability;

import com.foodshare.resilience.rpc.CircuitOpenException;
import com.foodshare.resilience.rpc.RateLimitExceededException;
import com.foodshare.resilience.rpc.RpcStatusException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier();

    @Test
    void testSuccess() {
        CallOutcome outcome = classifier.classify((Throwable) null);
        assertEquals(ErrorReason.SUCCESS, outcome.reason());
        assertFalse(outcome.retryable());
        assertTrue(outcome.isSuccess());
        assertEquals("SUCCESS", outcome.resultLabel());
    }

    @Test
    void testSuccessStatuses() {
        assertTrue(classifier.classify(200).isSuccess());
        assertTrue(classifier.classify(204).isSuccess());
    }

    @Test
    void testRetryableStatuses() {
        assertEquals(ErrorReason.TIMEOUT, classifier.classify(408).reason());
        assertEquals(ErrorReason.RATE_LIMITED, classifier.classify(429).reason());
        for (int status : new int[] {408, 429, 500, 502, 503, 504}) {
            assertTrue(classifier.classify(status).retryable(), "status " + status + " should be retryable");
        }
        assertEquals(ErrorReason.SERVER_UNAVAILABLE, classifier.classify(503).reason());
    }

    @Test
    void testClientError() {
        CallOutcome outcome = classifier.classify(404);
        assertEquals(ErrorReason.CLIENT_ERROR, outcome.reason());
        assertFalse(outcome.retryable());
        assertEquals("404", outcome.statusLabel());
        assertFalse(classifier.classify(400).retryable());
        assertFalse(classifier.classify(401).retryable());
    }

    @Test
    void testServerError_NotAnOutage() {
        CallOutcome outcome = classifier.classify(501);
        assertEquals(ErrorReason.SERVER_ERROR, outcome.reason());
        assertFalse(outcome.retryable());
    }

    @Test
    void testNoResponse_NetworkFailure() {
        CallOutcome outcome = classifier.classify(FailureClassifier.NO_STATUS);
        assertEquals(ErrorReason.NETWORK_FAILURE, outcome.reason());
        assertTrue(outcome.retryable());
        assertEquals("NETWORK_FAILURE", outcome.statusLabel());
        assertEquals(ErrorReason.NETWORK_FAILURE, classifier.classify(-1).reason());
    }

    @Test
    void testUnclassifiedStatus() {
        assertEquals(ErrorReason.UNKNOWN, classifier.classify(302).reason());
        assertEquals(ErrorReason.UNKNOWN, classifier.classify(600).reason());
        assertFalse(classifier.classify(302).retryable());
    }

    @Test
    void testStatusException() {
        CallOutcome outcome = classifier.classify(new RpcStatusException(503, "unavailable"));
        assertEquals(ErrorReason.SERVER_UNAVAILABLE, outcome.reason());
        assertEquals(503, outcome.statusCode());
    }

    @Test
    void testIoFailures() {
        assertEquals(ErrorReason.TIMEOUT, classifier.classify(new SocketTimeoutException("read timed out")).reason());
        assertEquals(ErrorReason.NETWORK_FAILURE, classifier.classify(new UnknownHostException("api")).reason());
        assertEquals(ErrorReason.NETWORK_FAILURE, classifier.classify(new ConnectException("refused")).reason());
        assertEquals(ErrorReason.NETWORK_FAILURE,
                classifier.classify(new UncheckedIOException(new IOException("reset"))).reason());
        assertTrue(classifier.classify(new SocketTimeoutException()).retryable());
    }

    @Test
    void testProtectionEvents() {
        CallOutcome circuitOpen = classifier.classify(new CircuitOpenException("sign_in", 1000));
        assertEquals(ErrorReason.CIRCUIT_OPEN, circuitOpen.reason());
        assertFalse(circuitOpen.retryable());
        assertTrue(circuitOpen.isProtectionEvent());

        CallOutcome rateLimited = classifier.classify(new RateLimitExceededException("sign_in", 1000));
        assertEquals(ErrorReason.RATE_LIMIT_REJECTED, rateLimited.reason());
        assertFalse(rateLimited.retryable());
        assertTrue(rateLimited.isProtectionEvent());
    }

    @Test
    void testUnknownException() {
        CallOutcome outcome = classifier.classify(new IllegalStateException("boom"));
        assertEquals(ErrorReason.UNKNOWN, outcome.reason());
        assertFalse(outcome.retryable());
        assertEquals("FAILURE", outcome.resultLabel());
    }
}
