package turnstile.core.model.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AccessRequest")
class AccessRequestTest {

    @Test
    @DisplayName("should replace blank identity and consumer with placeholders")
    void shouldReplaceBlanks() {
        var request = new AccessRequest(" ", null, "").normalized();

        assertEquals(AccessRequest.UNKNOWN_IDENTITY, request.identity());
        assertEquals(AccessRequest.UNKNOWN_CONSUMER, request.consumer());
        assertNull(request.country());
        assertFalse(request.hasCountry());
    }

    @Test
    @DisplayName("should trim values and upper-case the country")
    void shouldTrimAndUpperCase() {
        var request = new AccessRequest(" 10.0.0.1 ", " reports ", " de ").normalized();

        assertEquals("10.0.0.1", request.identity());
        assertEquals("reports", request.consumer());
        assertEquals("DE", request.country());
    }
}
