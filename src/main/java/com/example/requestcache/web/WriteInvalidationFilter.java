package com.example.requestcache.web;

import com.example.requestcache.core.CacheStore;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Flushes families of cached reads after successful writes, using the configured
 * {@link InvalidationRule}s. Runs after the handler; a failed write leaves the cache alone.
 * For asynchronous handlers the flush waits for the async dispatch, when the final status is known.
 */
@Slf4j
@RequiredArgsConstructor
public class WriteInvalidationFilter extends OncePerRequestFilter {

    private static final AntPathMatcher PATHS = new AntPathMatcher();

    private final CacheStore store;
    private final List<InvalidationRule> rules;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return patternsFor(request).isEmpty();
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
        throws ServletException, IOException {

        filterChain.doFilter(request, response);
        if (isAsyncStarted(request)) {
            return;
        }

        int status = response.getStatus();
        if (status < 200 || status >= 300) {
            return;
        }
        for (String pattern : patternsFor(request)) {
            try {
                store.invalidatePattern(pattern);
            } catch (RuntimeException e) {
                log.warn("Cache invalidation after write failed: pattern={}, uri={}", pattern, request.getRequestURI(), e);
            }
        }
    }

    private Set<String> patternsFor(HttpServletRequest request) {
        Set<String> patterns = new LinkedHashSet<>();
        String path = request.getRequestURI();
        for (InvalidationRule rule : rules) {
            if (rule.methods().contains(request.getMethod()) && PATHS.match(rule.pattern(), path)) {
                patterns.addAll(rule.invalidates());
            }
        }
        return patterns;
    }
}
