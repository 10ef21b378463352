package com.rms.restaurantservice.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window request limit per client address, applied to every request.
 * Over the limit the client gets {@code 429} until its window ends.
 */
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitFilter.class);
    static final String LIMIT_MESSAGE = "Too many requests, please try again later.";

    private final boolean enabled;
    private final long windowMillis;
    private final int maxRequests;
    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final AtomicLong lastSweep = new AtomicLong();

    @Autowired
    public RateLimitFilter(@Value("${restaurant.rate-limit.enabled:true}") boolean enabled,
                           @Value("${restaurant.rate-limit.window-minutes:15}") long windowMinutes,
                           @Value("${restaurant.rate-limit.max-requests:100}") int maxRequests) {
        this(enabled, Duration.ofMinutes(windowMinutes), maxRequests, Clock.systemUTC());
    }

    RateLimitFilter(boolean enabled, Duration window, int maxRequests, Clock clock) {
        if (window.isZero() || window.isNegative() || maxRequests <= 0) {
            throw new IllegalArgumentException("Rate limit needs a positive window and request count");
        }
        this.enabled = enabled;
        this.windowMillis = window.toMillis();
        this.maxRequests = maxRequests;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return !enabled;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        long now = clock.millis();
        sweepExpired(now);

        String client = request.getRemoteAddr();
        Window window = windows.compute(client, (key, current) ->
                current == null || current.endsBefore(now, windowMillis) ? new Window(now, 1) : current.next());

        response.setHeader("RateLimit-Limit", String.valueOf(maxRequests));
        response.setHeader("RateLimit-Remaining", String.valueOf(Math.max(0, maxRequests - window.count())));

        if (window.count() > maxRequests) {
            long retryAfterSeconds = Math.max(1, (window.startedAt() + windowMillis - now + 999) / 1000);
            if (window.count() == maxRequests + 1) {
                logger.warn("Rate limit of {} requests reached for {}", maxRequests, client);
            }
            response.setStatus(429);
            response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
            response.setContentType("application/json");
            response.setCharacterEncoding("UTF-8");
            response.getWriter().write("{\"error\":\"" + LIMIT_MESSAGE + "\"}");
            return;
        }

        filterChain.doFilter(request, response);
    }

    int trackedClients() {
        return windows.size();
    }

    private void sweepExpired(long now) {
        long previous = lastSweep.get();
        if (now - previous >= windowMillis && lastSweep.compareAndSet(previous, now)) {
            windows.values().removeIf(window -> window.endsBefore(now, windowMillis));
        }
    }

    private record Window(long startedAt, int count) {

        boolean endsBefore(long now, long windowMillis) {
            return now - startedAt >= windowMillis;
        }

        Window next() {
            return new Window(startedAt, count + 1);
        }
    }
}
