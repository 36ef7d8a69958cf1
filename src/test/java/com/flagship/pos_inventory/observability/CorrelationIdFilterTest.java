package com.flagship.pos_inventory.observability;

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

    @Test
    @DisplayName("Incoming correlation ID is echoed and visible in the MDC during the request")
    void testPropagatesIncomingId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/sales");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "till-7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInChain = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenInChain.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            }
        });

        assertEquals("till-7", seenInChain.get());
        assertEquals("till-7", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Missing header gets a generated ID")
    void testGeneratesId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/inventory/low-stock");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }

    @Test
    @DisplayName("Actuator requests are not filtered")
    void testSkipsActuator() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertNull(response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }
}
