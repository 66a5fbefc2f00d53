package com.al.medreportz.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

@Component
public class MdcInterceptor implements HandlerInterceptor {

    public static final String MDC_KEY = "reportId";
    public static final String HEADER_KEY = "reportId";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String reportId = request.getHeader(HEADER_KEY);
        if (reportId == null || reportId.isEmpty()) {
            reportId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_KEY, reportId);
        response.setHeader(HEADER_KEY, reportId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
            @Nullable Exception ex) {
        MDC.remove(MDC_KEY);
    }
}
