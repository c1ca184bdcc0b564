package com.pharmatrack.ledger_core.observability;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    private String runWithHeader(String header, AtomicReference<String> seenInMdc) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/stock/movements");
        if (header != null) {
            request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, header);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenInMdc.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            }
        };

        filter.doFilter(request, response, chain);
        return response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
    }

    @Test
    @DisplayName("Incoming correlation id is logged and echoed")
    void incomingIdEchoed() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();

        String echoed = runWithHeader("order-7731", seen);

        assertEquals("order-7731", echoed);
        assertEquals("order-7731", seen.get());
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Missing or oversized ids are replaced by a generated one")
    void generatedWhenUnusable() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();

        String generated = runWithHeader(null, seen);
        assertNotNull(generated);
        assertEquals(generated, seen.get());

        String replaced = runWithHeader("x".repeat(CorrelationContext.MAX_CORRELATION_ID_LENGTH + 1), seen);
        assertEquals(8, replaced.length());
    }
}
