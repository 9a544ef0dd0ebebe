package ru.derendyaev.SmsInbox.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;
import java.util.UUID;

/**
 * Одна строка лога на запрос: метод, путь, статус, время ответа.
 * request_id кладётся в MDC и попадает во все логи, написанные в рамках запроса.
 */
@Slf4j
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID = "request_id";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String requestId = UUID.randomUUID().toString();
        MDC.put(REQUEST_ID, requestId);
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
            log.info("{} {} {} latency_ms={}",
                    request.getMethod(), request.getRequestURI(), response.getStatus(),
                    String.format(Locale.ROOT, "%.2f", latencyMs));
            MDC.remove(REQUEST_ID);
        }
    }
}
