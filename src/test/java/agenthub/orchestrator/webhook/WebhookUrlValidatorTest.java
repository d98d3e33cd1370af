package agenthub.orchestrator.webhook;

import agenthub.orchestrator.error.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class WebhookUrlValidatorTest {

    private final WebhookUrlValidator strict = new WebhookUrlValidator(false);

    @ParameterizedTest
    @ValueSource(strings = {
            "https://hooks.example.com/agenthub",
            "http://example.org:8080/callback?x=1",
            "https://8.8.8.8/hook"
    })
    void acceptsPublicUrls(String url) {
        assertDoesNotThrow(() -> strict.validate(url));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "http://localhost:8080/hook",
            "http://127.0.0.1/hook",
            "http://10.1.2.3/hook",
            "http://192.168.0.10/hook",
            "http://172.16.5.5/hook",
            "http://169.254.169.254/latest/meta-data",
            "http://metadata.google.internal/computeMetadata",
            "http://[::1]/hook",
            "http://[fd00::1]/hook",
            "http://0.0.0.0/hook"
    })
    void rejectsInternalHosts(String url) {
        ValidationException e = assertThrows(ValidationException.class, () -> strict.validate(url));
        assertEquals("webhook_url", e.fieldErrors().get(0).field());
    }

    @ParameterizedTest
    @ValueSource(strings = { "ftp://example.com/x", "example.com/hook", "https:///nohost", " " })
    void rejectsMalformedUrls(String url) {
        assertThrows(ValidationException.class, () -> strict.validate(url));
    }

    @Test
    void nullMeansNoWebhook() {
        assertDoesNotThrow(() -> strict.validate(null));
    }

    @Test
    void privateHostsAllowedWhenConfigured() {
        WebhookUrlValidator lenient = new WebhookUrlValidator(true);
        assertDoesNotThrow(() -> lenient.validate("http://127.0.0.1:9000/hook"));
        assertThrows(ValidationException.class, () -> lenient.validate("file:///etc/passwd"));
    }
}
