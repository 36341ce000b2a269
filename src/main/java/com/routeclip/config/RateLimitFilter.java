package com.routeclip.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.routeclip.web.UserIdentity;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed one-minute window on video uploads, counted per user (falls back to the remote address
 * when the identity header is absent; the controller rejects those requests anyway).
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private final int limitPerMinute;

    private final Cache<String, Window> windows = Caffeine.newBuilder()
            .expireAfterAccess(5, TimeUnit.MINUTES)
            .maximumSize(10000)
            .build();

    public RateLimitFilter(@Value("${app.media.upload-limit-per-minute:30}") int limitPerMinute) {
        this.limitPerMinute = limitPerMinute;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !("POST".equalsIgnoreCase(request.getMethod())
                && request.getRequestURI() != null
                && request.getRequestURI().endsWith("/video"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String key = request.getHeader(UserIdentity.USER_ID_HEADER);
        if (key == null || key.isBlank()) {
            key = "ip:" + request.getRemoteAddr();
        }
        long currentWin = Instant.now().getEpochSecond() / 60;

        Window w = windows.get(key, k -> new Window(currentWin));
        synchronized (w) {
            if (w.win != currentWin) {
                w.win = currentWin;
                w.count.set(0);
            }
            if (w.count.incrementAndGet() > limitPerMinute) {
                response.setStatus(429);
                response.setContentType("application/json");
                response.getWriter().write("{\"code\":\"RATE_LIMIT\",\"message\":\"Too many uploads\",\"data\":null,\"traceId\":null}");
                return;
            }
        }
        filterChain.doFilter(request, response);
    }

    private static class Window {
        long win;
        final AtomicInteger count = new AtomicInteger(0);
        Window(long w) { this.win = w; }
    }
}
