package com.al.medreportz.interceptor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MdcInterceptorTest {

    private final MdcInterceptor interceptor = new MdcInterceptor();

    @AfterEach
    public void clearMdc() {
        MDC.clear();
    }

    @Test
    public void testUsesReportIdHeader() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(MdcInterceptor.HEADER_KEY, "report-123");
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertTrue(interceptor.preHandle(request, response, new Object()));

        assertEquals("report-123", MDC.get(MdcInterceptor.MDC_KEY));
        assertEquals("report-123", response.getHeader(MdcInterceptor.HEADER_KEY));
    }

    @Test
    public void testGeneratesReportId() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        interceptor.preHandle(new MockHttpServletRequest(), response, new Object());

        String reportId = MDC.get(MdcInterceptor.MDC_KEY);
        assertNotNull(reportId);
        assertEquals(reportId, UUID.fromString(reportId).toString());
        assertEquals(reportId, response.getHeader(MdcInterceptor.HEADER_KEY));
    }

    @Test
    public void testClearsAfterCompletion() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();
        interceptor.preHandle(request, response, new Object());

        interceptor.afterCompletion(request, response, new Object(), null);

        assertNull(MDC.get(MdcInterceptor.MDC_KEY));
    }
}
