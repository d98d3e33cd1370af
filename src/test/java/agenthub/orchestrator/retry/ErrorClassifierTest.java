package agenthub.orchestrator.retry;

import agenthub.orchestrator.error.WorkExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @ParameterizedTest
    @CsvSource({
            "Connection refused, TRANSIENT",
            "Service temporarily unavailable, TRANSIENT",
            "upstream returned 503, TRANSIENT",
            "Request timed out after 30s, TIMEOUT",
            "Rate limit exceeded, RESOURCE",
            "Quota exhausted for project, RESOURCE",
            "Resource not found, PERMANENT",
            "Permission denied, PERMANENT",
            "Invalid input: payload.url, PERMANENT",
            "something odd happened, UNKNOWN"
    })
    void categorizesByMessage(String message, ErrorCategory expected) {
        assertEquals(expected, classifier.classify(message).category());
    }

    @Test
    void permanentPatternsWinOverRetryableOnes() {
        // "invalid" and "timeout" both match
        ErrorClassification c = classifier.classify("Invalid timeout value");
        assertEquals(ErrorCategory.PERMANENT, c.category());
        assertFalse(c.retryable());
    }

    @Test
    void unknownAndEmptyMessagesAreRetryable() {
        assertTrue(classifier.isRetryable("the flux capacitor hiccupped"));
        assertTrue(classifier.isRetryable(""));
        assertTrue(classifier.isRetryable((String) null));
    }

    @Test
    void normalizedMessageCarriesTheCategory() {
        ErrorClassification c = classifier.classify(new IllegalStateException("Connection reset"));
        assertEquals("[transient] Connection reset", c.normalizedMessage());
        assertEquals("TRANSIENT", c.code());
        assertEquals(1.0, c.backoffMultiplier());
    }

    @Test
    void resourceErrorsDoubleTheBackoff() {
        assertEquals(ErrorClassifier.RESOURCE_BACKOFF_MULTIPLIER,
                classifier.classify("throttled by provider").backoffMultiplier());
    }

    @Test
    void explicitFlagOnWorkExecutionExceptionWins() {
        ErrorClassification permanent = classifier.classify(
                WorkExecutionException.permanent("BAD_MODEL", "Connection refused"));
        assertFalse(permanent.retryable());
        assertEquals(ErrorCategory.PERMANENT, permanent.category());
        assertEquals("BAD_MODEL", permanent.code());

        ErrorClassification retryable = classifier.classify(
                WorkExecutionException.retryable("FLAKY", "file not found yet"));
        assertTrue(retryable.retryable());
        assertEquals(ErrorCategory.UNKNOWN, retryable.category());
        assertEquals("FLAKY", retryable.code());
    }

    @Test
    void unwrapsExecutionExceptions() {
        ErrorClassification c = classifier.classify(
                new ExecutionException(new RuntimeException("Access denied for user")));
        assertEquals(ErrorCategory.PERMANENT, c.category());
        assertEquals("Access denied for user", c.message());
    }

    @Test
    void exceptionWithoutMessageIsDescribedByType() {
        ErrorClassification c = classifier.classify(new NullPointerException());
        assertEquals("NullPointerException", c.message());
        assertTrue(c.retryable());
    }
}
